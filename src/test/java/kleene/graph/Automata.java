package kleene.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Assertions;

/**
 * Fixture automata and language checks shared by the tests.
 */
public final class Automata {

  private Automata() {
  }

  /** Words over "ab" made only of a's. */
  public static Automaton onlyAs() {
    final var aut = new Automaton("ab");
    aut.setTerminal(aut.start(), true);
    aut.linkKeys(0, 0, "a");
    return aut;
  }

  /** Words over "ab" with an even number of a's and an odd number of b's. */
  public static Automaton parity() {
    final var aut = new Automaton("ab");
    aut.changeKey(aut.start(), List.of(0, 0));
    aut.makeNode(List.of(0, 1), true);
    aut.makeNode(List.of(1, 0), false);
    aut.makeNode(List.of(1, 1), false);

    aut.linkKeys(List.of(0, 0), List.of(1, 0), "a");
    aut.linkKeys(List.of(0, 0), List.of(0, 1), "b");
    aut.linkKeys(List.of(0, 1), List.of(1, 1), "a");
    aut.linkKeys(List.of(0, 1), List.of(0, 0), "b");
    aut.linkKeys(List.of(1, 0), List.of(0, 0), "a");
    aut.linkKeys(List.of(1, 0), List.of(1, 1), "b");
    aut.linkKeys(List.of(1, 1), List.of(0, 1), "a");
    aut.linkKeys(List.of(1, 1), List.of(1, 0), "b");
    return aut;
  }

  /**
   * Nine-state total DFA over "ab" tracking (count of a's mod 3, count of b's
   * mod 3), accepting when both counts agree.
   */
  public static Automaton countsAgreeMod3() {
    final var aut = new Automaton("ab");
    aut.changeKey(aut.start(), List.of(0, 0));
    aut.setTerminal(aut.start(), true);
    for (int a = 0; a < 3; a++) {
      for (int b = 0; b < 3; b++) {
        if (a != 0 || b != 0) {
          aut.makeNode(List.of(a, b), a == b);
        }
      }
    }
    for (int a = 0; a < 3; a++) {
      for (int b = 0; b < 3; b++) {
        aut.linkKeys(List.of(a, b), List.of((a + 1) % 3, b), "a");
        aut.linkKeys(List.of(a, b), List.of(a, (b + 1) % 3), "b");
      }
    }
    return aut;
  }

  /**
   * Random automaton with epsilon and multi-symbol edges.
   *
   * @param seed random seed
   * @param alphabet alphabet of the automaton
   * @param nodes number of nodes
   * @param edges number of edges
   */
  public static Automaton random(long seed, String alphabet, int nodes, int edges) {
    final var random = new Random(seed);
    final var aut = new Automaton(alphabet);
    aut.setTerminal(aut.start(), random.nextInt(4) == 0);
    for (int i = 1; i < nodes; i++) {
      aut.makeNode(random.nextInt(3) == 0);
    }
    for (int i = 0; i < edges; i++) {
      final int length = random.nextInt(4);
      final var label = new StringBuilder();
      for (int j = 0; j < length; j++) {
        label.append(alphabet.charAt(random.nextInt(alphabet.length())));
      }
      aut.link(random.nextInt(nodes), random.nextInt(nodes), label.toString());
    }
    return aut;
  }

  /**
   * All words over an alphabet, shortest first.
   *
   * @param alphabet symbols to use
   * @param maxLength longest word length (inclusive)
   */
  public static List<String> words(Alphabet alphabet, int maxLength) {
    final List<String> words = new ArrayList<>();
    words.add("");
    int from = 0;
    for (int length = 1; length <= maxLength; length++) {
      final int to = words.size();
      for (int i = from; i < to; i++) {
        for (char symbol : alphabet) {
          words.add(words.get(i) + symbol);
        }
      }
      from = to;
    }
    return words;
  }

  public static List<String> words(String alphabet, int maxLength) {
    return words(Alphabet.of(alphabet), maxLength);
  }

  /**
   * Check that two automata agree on every word up to some length.
   */
  public static void assertSameLanguage(Automaton expected, Automaton actual, int maxLength) {
    for (String word : words(expected.alphabet().union(actual.alphabet()), maxLength)) {
      Assertions.assertEquals(
        expected.accepts(word),
        actual.accepts(word),
        () -> "Automata should have agreed on '" + word + "'"
      );
    }
  }
}
