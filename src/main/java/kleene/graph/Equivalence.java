package kleene.graph;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.OptionalInt;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Language equivalence of two automata.
 */
public final class Equivalence {

  private static final Logger log = LoggerFactory.getLogger(Equivalence.class);

  private Equivalence() {
  }

  private record Pair(int left, int right) { }

  /**
   * Check whether two automata accept the same words.
   *
   * Both sides are completed, then their synchronized product is explored
   * breadth-first from the pair of starts. The languages differ exactly when
   * some reachable pair disagrees on being terminal.
   *
   * @param first first automaton
   * @param second second automaton
   * @return whether the languages are equal
   * @throws AlphabetMismatchException if the declared alphabets differ
   */
  public static boolean equivalent(Automaton first, Automaton second) {
    if (!first.alphabet().equals(second.alphabet())) {
      throw new AlphabetMismatchException(first.alphabet(), second.alphabet());
    }
    final Automaton left = Determinizer.complete(first);
    final Automaton right = Determinizer.complete(second);

    final Set<Pair> seen = new HashSet<>();
    final ArrayDeque<Pair> toVisit = new ArrayDeque<>();
    toVisit.add(new Pair(left.start(), right.start()));

    while (!toVisit.isEmpty()) {
      final Pair pair = toVisit.poll();
      if (!seen.add(pair)) {
        continue;
      }
      if (left.isTerminal(pair.left()) != right.isTerminal(pair.right())) {
        log.debug("Found distinguishing pair ({}, {})", left.key(pair.left()), right.key(pair.right()));
        return false;
      }
      for (char symbol : left.alphabet()) {
        final OptionalInt leftTarget = left.transition(pair.left(), symbol);
        final OptionalInt rightTarget = right.transition(pair.right(), symbol);
        toVisit.add(new Pair(leftTarget.getAsInt(), rightTarget.getAsInt()));
      }
    }
    return true;
  }
}
