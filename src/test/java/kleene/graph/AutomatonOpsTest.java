package kleene.graph;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AutomatonOpsTest {

  private static Automaton word(String alphabet, String word) {
    final var aut = new Automaton(alphabet);
    final int end = aut.makeNode(true);
    aut.link(aut.start(), end, word);
    return aut;
  }

  @Test
  void concat() {
    final Automaton result = AutomatonOps.concat(word("a", "a"), Automata.onlyAs());
    Assertions.assertEquals(Alphabet.of("ab"), result.alphabet());
    Assertions.assertFalse(result.accepts(""));
    Assertions.assertTrue(result.accepts("a"));
    Assertions.assertTrue(result.accepts("aaa"));
    Assertions.assertFalse(result.accepts("ab"));
  }

  @Test
  void concatOfNothingIsTheEmptyWord() {
    final Automaton result = AutomatonOps.concat(List.of());
    Assertions.assertEquals(1, result.size());
    Assertions.assertTrue(result.accepts(""));
  }

  @Test
  void union() {
    final Automaton result = AutomatonOps.union(word("ab", "ab"), word("c", "cc"));
    Assertions.assertEquals(Alphabet.of("abc"), result.alphabet());
    Assertions.assertTrue(result.accepts("ab"));
    Assertions.assertTrue(result.accepts("cc"));
    Assertions.assertFalse(result.accepts(""));
    Assertions.assertFalse(result.accepts("abcc"));
  }

  @Test
  void unionOfNothingIsEmpty() {
    final Automaton result = AutomatonOps.union(List.of());
    Assertions.assertTrue(result.terminals().isEmpty());
    Assertions.assertFalse(result.accepts(""));
  }

  @Test
  void starAndPlus() {
    final Automaton star = AutomatonOps.star(word("ab", "ab"));
    final Automaton plus = AutomatonOps.plus(word("ab", "ab"));
    for (String w : List.of("", "ab", "abab", "ababab")) {
      Assertions.assertTrue(star.accepts(w), w);
      Assertions.assertEquals(!w.isEmpty(), plus.accepts(w), w);
    }
    for (String w : List.of("a", "aba", "ba")) {
      Assertions.assertFalse(star.accepts(w), w);
      Assertions.assertFalse(plus.accepts(w), w);
    }
  }

  @Test
  void operandsAreUntouched() {
    final Automaton operand = word("ab", "ab");
    AutomatonOps.star(AutomatonOps.concat(operand, operand));
    Assertions.assertEquals(2, operand.size());
    Assertions.assertEquals(1, operand.edges().size());
    Assertions.assertEquals(1, operand.terminals().size());
  }

  @Test
  void merge() {
    final Automaton result = AutomatonOps.merge(Automata.onlyAs(), Automata.parity());
    Assertions.assertEquals(1 + 1 + 4, result.size());
    Assertions.assertEquals(1 + 8, result.edges().size());
    Assertions.assertTrue(result.terminals().isEmpty());
    Assertions.assertTrue(result.outgoing(result.start()).isEmpty());
    Assertions.assertTrue(result.containsKey(List.of(0, 0)));
    Assertions.assertTrue(result.containsKey(List.of(1, List.of(1, 1))));
  }

  @Test
  void intersect() {
    final Automaton result = AutomatonOps.intersect(Automata.onlyAs(), Automata.parity());
    // Only a's and an odd number of b's: never
    Assertions.assertTrue(result.terminals().isEmpty());

    final Automaton evenAs = AutomatonOps.intersect(
      Automata.onlyAs(),
      Complementer.complement(word("ab", "a"))
    );
    for (String w : Automata.words("ab", 5)) {
      final boolean expected = w.chars().allMatch(c -> c == 'a') && !w.equals("a");
      Assertions.assertEquals(expected, evenAs.accepts(w), w);
    }
  }

  @Test
  void crossHasEveryPair() {
    final Automaton result = AutomatonOps.cross(Automata.parity(), Automata.onlyAs());
    // parity has 4 states, onlyAs 2 once completed
    Assertions.assertEquals(8, result.size());
    Assertions.assertTrue(result.isTotal());
    Assertions.assertEquals(List.of(List.of(0, 0), 0), result.key(result.start()));
  }

  @Test
  void crossNeedsMatchingAlphabets() {
    Assertions.assertThrows(
      AlphabetMismatchException.class,
      () -> AutomatonOps.cross(word("a", "a"), word("ab", "a"))
    );
  }

  @Test
  void withAlphabet() {
    final Automaton wider = AutomatonOps.withAlphabet(word("a", "a"), Alphabet.of("ab"));
    Assertions.assertEquals(Alphabet.of("ab"), wider.alphabet());
    Assertions.assertTrue(wider.accepts("a"));
    wider.link(wider.start(), wider.start(), "b");
    Assertions.assertTrue(wider.accepts("ba"));

    Assertions.assertThrows(
      IllegalArgumentException.class,
      () -> AutomatonOps.withAlphabet(word("ab", "a"), Alphabet.of("a"))
    );
  }
}
