package fsa.json;

import java.io.IOException;

/**
 * A JSON document which is well-formed JSON but does not describe a valid
 * automaton.
 */
public class MalformedAutomatonException extends IOException {

  public MalformedAutomatonException(String message) {
    super(message);
  }

  public MalformedAutomatonException(String message, Throwable cause) {
    super(message, cause);
  }
}
