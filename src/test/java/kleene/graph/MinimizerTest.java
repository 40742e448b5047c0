package kleene.graph;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class MinimizerTest {

  @Test
  void countsAgreeMod3() {
    final Automaton aut = Automata.countsAgreeMod3();
    Assertions.assertEquals(9, aut.size());

    // Only the difference of the counts mod 3 matters
    final Automaton minimal = Minimizer.minimize(aut);
    Assertions.assertEquals(3, minimal.size());
    Assertions.assertTrue(minimal.isTotal());
    Assertions.assertTrue(Equivalence.equivalent(aut, minimal));
  }

  @Test
  void parityIsAlreadyMinimal() {
    final Automaton minimal = Minimizer.minimize(Automata.parity());
    Assertions.assertEquals(4, minimal.size());
    Assertions.assertTrue(Equivalence.equivalent(Automata.parity(), minimal));
  }

  @Test
  void keysAreClassIds() {
    final Automaton minimal = Minimizer.minimize(Automata.onlyAs());
    // Class 0 holds the start (terminal), class 1 the sink
    Assertions.assertEquals(2, minimal.size());
    Assertions.assertEquals(0, minimal.key(minimal.start()));
    Assertions.assertTrue(minimal.isTerminal(minimal.start()));
    Assertions.assertFalse(minimal.isTerminal(minimal.node(1)));
  }

  @Test
  void minimizeIsIdempotent() {
    for (long seed = 0; seed < 20; seed++) {
      final Automaton aut = Automata.random(seed, "ab", 8, 16);
      final Automaton once = Minimizer.minimize(aut);
      final Automaton twice = Minimizer.minimize(once);
      Assertions.assertEquals(once.size(), twice.size());
      Assertions.assertTrue(Equivalence.equivalent(aut, once));
      Automata.assertSameLanguage(aut, once, 6);
    }
  }

  @Test
  void emptyLanguageHasOneState() {
    final var aut = new Automaton("ab");
    aut.link(aut.start(), aut.makeNode(), "a");
    final Automaton minimal = Minimizer.minimize(aut);
    Assertions.assertEquals(1, minimal.size());
    Assertions.assertTrue(minimal.terminals().isEmpty());
    Assertions.assertEquals(2, minimal.edges().size());
  }
}
