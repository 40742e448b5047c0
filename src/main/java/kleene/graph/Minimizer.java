package kleene.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimization by iterated partition refinement (Moore's algorithm).
 *
 * <p>States start out split into accepting and non-accepting classes. Each
 * round, the signature of a state is its current class followed by the classes
 * of its successors (one per symbol, in alphabet order), and states with equal
 * signatures share a class in the next round. Class ids are handed out in the
 * order signatures are first seen, so once a round leaves the partition
 * unchanged it also leaves the ids unchanged.
 */
public final class Minimizer {

  private static final Logger log = LoggerFactory.getLogger(Minimizer.class);

  private Minimizer() {
  }

  /**
   * Minimal total DFA with the same language.
   *
   * Node keys of the result are the integer class ids.
   *
   * @param automaton automaton to minimize
   * @return minimal total DFA
   */
  public static Automaton minimize(Automaton automaton) {
    final Automaton dfa = Determinizer.complete(automaton);
    final Alphabet alphabet = dfa.alphabet();
    final List<Integer> states = dfa.nodes();

    final Map<Integer, Integer> indices = new HashMap<>();
    for (int i = 0; i < states.size(); i++) {
      indices.put(states.get(i), i);
    }
    final int[][] delta = transitionTable(dfa, states, indices);

    int[] classes = new int[states.size()];
    for (int i = 0; i < classes.length; i++) {
      classes[i] = dfa.isTerminal(states.get(i)) ? 1 : 0;
    }

    int rounds = 0;
    while (true) {
      final int[] refined = refine(classes, delta);
      rounds++;
      if (Arrays.equals(classes, refined)) {
        break;
      }
      classes = refined;
    }

    final var result = new Automaton(alphabet);
    final int startIndex = indices.get(dfa.start());
    result.changeKey(result.start(), classes[startIndex]);
    result.setTerminal(result.start(), dfa.isTerminal(dfa.start()));
    for (int i = 0; i < classes.length; i++) {
      if (!result.containsKey(classes[i])) {
        result.makeNode(classes[i], dfa.isTerminal(states.get(i)));
      }
    }
    for (int i = 0; i < classes.length; i++) {
      final int source = result.node(classes[i]);
      for (int s = 0; s < alphabet.size(); s++) {
        final int target = result.node(classes[delta[i][s]]);
        result.link(source, target, String.valueOf(alphabet.symbol(s)));
      }
    }

    log.debug("Minimized {} states into {} classes in {} rounds", states.size(), result.size(), rounds);
    return result;
  }

  /**
   * Transition table indexed by state position then symbol position.
   *
   * @throws NonDeterministicException on a repeated (state, symbol) pair
   */
  private static int[][] transitionTable(Automaton dfa, List<Integer> states, Map<Integer, Integer> indices) {
    final Alphabet alphabet = dfa.alphabet();
    final int[][] delta = new int[states.size()][alphabet.size()];
    for (int i = 0; i < states.size(); i++) {
      Arrays.fill(delta[i], -1);
      for (Edge edge : dfa.outgoing(states.get(i))) {
        if (edge.length() != 1) {
          throw new NonDeterministicException(dfa.key(states.get(i)), edge.label());
        }
        final int symbol = alphabet.indexOf(edge.symbol());
        if (delta[i][symbol] != -1) {
          throw new NonDeterministicException(dfa.key(states.get(i)), edge.label());
        }
        delta[i][symbol] = indices.get(edge.target());
      }
      for (int s = 0; s < alphabet.size(); s++) {
        if (delta[i][s] == -1) {
          throw new IllegalStateException(
            "State " + dfa.key(states.get(i)) + " has no transition on '" + alphabet.symbol(s) + "'"
          );
        }
      }
    }
    return delta;
  }

  private static int[] refine(int[] classes, int[][] delta) {
    final Map<List<Integer>, Integer> ids = new LinkedHashMap<>();
    final int[] refined = new int[classes.length];
    for (int i = 0; i < classes.length; i++) {
      final List<Integer> signature = new ArrayList<>(delta[i].length + 1);
      signature.add(classes[i]);
      for (int target : delta[i]) {
        signature.add(classes[target]);
      }
      refined[i] = ids.computeIfAbsent(signature, k -> ids.size());
    }
    return refined;
  }
}
