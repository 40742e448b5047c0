package kleene.graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Combinators building new automata out of existing ones.
 *
 * <p>Operands are never modified. The concatenation, union, star and plus
 * combinators copy their operands' nodes into the result under fresh integer
 * keys, keeping terminal flags, and the result's alphabet is the union of the
 * operands' alphabets.
 */
public final class AutomatonOps {

  private AutomatonOps() {
  }

  /**
   * Copy every node and edge of an operand into a target automaton.
   *
   * @return ids of the operand's nodes in the target
   */
  private static Map<Integer, Integer> place(Automaton target, Automaton operand) {
    final Map<Integer, Integer> ids = new HashMap<>();
    for (int node : operand.nodes()) {
      ids.put(node, target.makeNode(operand.isTerminal(node)));
    }
    for (Edge edge : operand.edges()) {
      target.link(ids.get(edge.source()), ids.get(edge.target()), edge.label());
    }
    return ids;
  }

  private static Alphabet unionAlphabet(List<Automaton> operands) {
    Alphabet alphabet = Alphabet.EMPTY;
    for (Automaton operand : operands) {
      alphabet = alphabet.union(operand.alphabet());
    }
    return alphabet;
  }

  /**
   * Automaton accepting the concatenation of the operands' languages.
   *
   * Terminals of each operand lose their flag and get an epsilon edge to the
   * start of the next operand. No operands means the empty word.
   */
  public static Automaton concat(List<Automaton> operands) {
    final var result = new Automaton(unionAlphabet(operands));
    if (operands.isEmpty()) {
      result.setTerminal(result.start(), true);
      return result;
    }

    final int placeholder = result.start();
    Automaton previous = operands.get(0);
    Map<Integer, Integer> previousIds = place(result, previous);
    result.setStart(previousIds.get(previous.start()));
    result.removeNodes(List.of(placeholder));

    for (Automaton next : operands.subList(1, operands.size())) {
      final Map<Integer, Integer> nextIds = place(result, next);
      for (int terminal : previous.terminals()) {
        final int node = previousIds.get(terminal);
        result.setTerminal(node, false);
        result.link(node, nextIds.get(next.start()), "");
      }
      previous = next;
      previousIds = nextIds;
    }
    return result;
  }

  public static Automaton concat(Automaton first, Automaton second) {
    return concat(List.of(first, second));
  }

  /**
   * Automaton accepting the union of the operands' languages.
   *
   * A new start node gets an epsilon edge to each operand's start. No
   * operands means the empty language.
   */
  public static Automaton union(List<Automaton> operands) {
    final var result = new Automaton(unionAlphabet(operands));
    for (Automaton operand : operands) {
      final Map<Integer, Integer> ids = place(result, operand);
      result.link(result.start(), ids.get(operand.start()), "");
    }
    return result;
  }

  public static Automaton union(Automaton first, Automaton second) {
    return union(List.of(first, second));
  }

  /** Kleene star: zero or more repetitions. */
  public static Automaton star(Automaton operand) {
    return loop(operand, true);
  }

  /** One or more repetitions. */
  public static Automaton plus(Automaton operand) {
    return loop(operand, false);
  }

  private static Automaton loop(Automaton operand, boolean acceptsEmpty) {
    final var result = new Automaton(operand.alphabet());
    result.setTerminal(result.start(), acceptsEmpty);
    final Map<Integer, Integer> ids = place(result, operand);
    result.link(result.start(), ids.get(operand.start()), "");
    for (int terminal : operand.terminals()) {
      result.link(ids.get(terminal), result.start(), "");
    }
    return result;
  }

  /**
   * Both operands side by side in one automaton.
   *
   * Nodes are keyed {@code [0, key]} for the first operand and
   * {@code [1, key]} for the second. The start is a fresh node with no edges
   * and nothing is terminal: this is raw material for building other
   * automata, not a language operation.
   */
  public static Automaton merge(Automaton first, Automaton second) {
    final var result = new Automaton(first.alphabet().union(second.alphabet()));
    final List<Automaton> operands = List.of(first, second);
    for (int i = 0; i < operands.size(); i++) {
      final Automaton operand = operands.get(i);
      for (int node : operand.nodes()) {
        result.makeNode(List.of(i, operand.key(node)), false);
      }
      for (Edge edge : operand.edges()) {
        result.linkKeys(
          List.of(i, operand.key(edge.source())),
          List.of(i, operand.key(edge.target())),
          edge.label()
        );
      }
    }
    return result;
  }

  /**
   * Synchronized product of the completed operands.
   *
   * Every pair of states is present (reachable or not), keyed
   * {@code [key1, key2]}, and is terminal when both members are.
   *
   * @throws AlphabetMismatchException if the declared alphabets differ
   */
  public static Automaton cross(Automaton first, Automaton second) {
    if (!first.alphabet().equals(second.alphabet())) {
      throw new AlphabetMismatchException(first.alphabet(), second.alphabet());
    }
    final Automaton left = Determinizer.complete(first);
    final Automaton right = Determinizer.complete(second);

    final var result = new Automaton(left.alphabet());
    result.changeKey(result.start(), List.of(left.key(left.start()), right.key(right.start())));
    for (int l : left.nodes()) {
      for (int r : right.nodes()) {
        final List<Object> key = List.of(left.key(l), right.key(r));
        final boolean terminal = left.isTerminal(l) && right.isTerminal(r);
        if (result.containsKey(key)) {
          result.setTerminal(result.node(key), terminal);
        } else {
          result.makeNode(key, terminal);
        }
      }
    }
    for (int l : left.nodes()) {
      for (int r : right.nodes()) {
        for (char symbol : left.alphabet()) {
          final int leftTarget = left.transition(l, symbol).getAsInt();
          final int rightTarget = right.transition(r, symbol).getAsInt();
          result.linkKeys(
            List.of(left.key(l), right.key(r)),
            List.of(left.key(leftTarget), right.key(rightTarget)),
            String.valueOf(symbol)
          );
        }
      }
    }
    return result;
  }

  /** Trimmed synchronized product: words accepted by both operands. */
  public static Automaton intersect(Automaton first, Automaton second) {
    return Trimmer.trim(cross(first, second));
  }

  /**
   * Copy declared over a larger alphabet.
   *
   * @param automaton automaton to widen
   * @param alphabet new alphabet, which must contain the current one
   * @throws IllegalArgumentException if the new alphabet drops a symbol
   */
  public static Automaton withAlphabet(Automaton automaton, Alphabet alphabet) {
    if (!alphabet.containsAll(automaton.alphabet())) {
      throw new IllegalArgumentException(
        "Alphabet '" + alphabet + "' does not contain '" + automaton.alphabet() + "'"
      );
    }
    return automaton.copy(alphabet);
  }
}
