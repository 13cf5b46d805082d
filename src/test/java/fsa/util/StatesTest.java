package fsa.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;

import java.util.List;
import java.util.Set;
import org.junit.Test;

public class StatesTest {

  @Test
  public void plainStatesRenderWithToString() {
    assertThat(States.render(3), equalTo("3"));
    assertThat(States.render("q0"), equalTo("q0"));
    assertThat(States.render(null), equalTo("null"));
  }

  @Test
  public void setsRenderSortedAndNested() {
    assertThat(States.render(Set.of(3, 1, 2)), equalTo("{1,2,3}"));
    assertThat(States.render(Set.of(Set.of(2, 1), Set.of(0))), equalTo("{{0},{1,2}}"));
    assertThat(States.render(Set.of()), equalTo("{}"));
  }

  @Test
  public void sortedUsesRendering() {
    assertThat(States.sorted(List.of("b", "c", "a")), contains("a", "b", "c"));
    assertThat(
      States.sorted(List.of(Set.of(2), Set.of(0, 1))),
      contains(Set.of(0, 1), Set.of(2))
    );
  }

  @Test
  public void charsSplitsText() {
    assertThat(Symbols.chars("ab"), contains('a', 'b'));
    assertThat(Symbols.chars("").isEmpty(), equalTo(true));
  }
}
