package kleene.graph;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DotGraphTest {

  @Test
  void renderOnlyAs() {
    Assertions.assertEquals(
      String.join(
        "\n",
        "digraph \"only a\" {",
        "  rankdir = LR;",
        "  \"_start\" [shape = none, label = <>];",
        "  \"0\" [shape = doublecircle, label = <0>];",
        "  \"_start\" -> \"0\" [label = <>];",
        "  \"0\" -> \"0\" [label = <a>];",
        "}",
        ""
      ),
      DotGraph.render("only a", Automata.onlyAs())
    );
  }

  @Test
  void epsilonEdgesAndKeyLabels() {
    final var aut = new Automaton("a");
    aut.changeKey(aut.start(), List.of(1, 2));
    final int end = aut.makeNode("<end>", true);
    aut.link(aut.start(), end, "");

    final String dot = DotGraph.render("g", aut, key -> "k" + key);
    Assertions.assertTrue(dot.contains("\"0\" [shape = circle, label = <k[1, 2]>];"), dot);
    Assertions.assertTrue(dot.contains("\"1\" [shape = doublecircle, label = <k&lt;end&gt;>];"), dot);
    Assertions.assertTrue(dot.contains("\"0\" -> \"1\" [label = <ε>];"), dot);
    Assertions.assertTrue(dot.contains("\"_start\" -> \"0\""), dot);
  }
}
