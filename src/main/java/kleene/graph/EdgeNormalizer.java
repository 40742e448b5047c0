package kleene.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites the edges of an automaton without changing its language.
 *
 * <ul>
 *   <li>{@link #splitSymbols} turns multi-symbol edges into chains</li>
 *   <li>{@link #eliminateEpsilons} removes epsilon edges altogether</li>
 *   <li>{@link #unifyTerminals} funnels all accepting nodes into one</li>
 * </ul>
 */
public final class EdgeNormalizer {

  private static final Logger log = LoggerFactory.getLogger(EdgeNormalizer.class);

  private EdgeNormalizer() {
  }

  /**
   * Nodes reachable through epsilon edges only.
   */
  private static final class EpsilonClosure extends AutomatonVisitor {

    EpsilonClosure(Automaton automaton) {
      super(automaton);
    }

    @Override
    protected void visitNode(Edge via, int node) {
      for (Edge edge : automaton.outgoing(node)) {
        if (edge.isEpsilon()) {
          enqueue(edge);
        }
      }
    }
  }

  /**
   * Copy where every edge has at most one symbol.
   *
   * An edge labelled {@code s1 s2 ... sn} becomes a chain of {@code n} edges
   * through {@code n - 1} fresh non-terminal nodes.
   *
   * @param automaton automaton to rewrite
   * @return rewritten copy
   */
  public static Automaton splitSymbols(Automaton automaton) {
    final Automaton result = automaton.copy();
    for (Edge edge : List.copyOf(result.edges())) {
      if (edge.length() <= 1) {
        continue;
      }
      result.unlink(edge);
      int from = edge.source();
      final String label = edge.label();
      for (int i = 0; i < label.length() - 1; i++) {
        final int next = result.makeNode();
        result.link(from, next, label.substring(i, i + 1));
        from = next;
      }
      result.link(from, edge.target(), label.substring(label.length() - 1));
    }
    return result;
  }

  /**
   * Copy without epsilon edges, where every edge has exactly one symbol.
   *
   * <ol>
   *   <li>split multi-symbol edges</li>
   *   <li>mark as terminal every node that reaches a terminal through epsilon edges</li>
   *   <li>give every node the symbol edges of the nodes in its epsilon closure</li>
   *   <li>drop the epsilon edges</li>
   * </ol>
   *
   * @param automaton automaton to rewrite
   * @return rewritten copy
   */
  public static Automaton eliminateEpsilons(Automaton automaton) {
    final Automaton result = splitSymbols(automaton);
    propagateTerminals(result);

    for (int node : result.nodes()) {
      final var closure = new EpsilonClosure(result);
      closure.visit(node);
      for (int reachable : closure.seen()) {
        if (reachable == node) {
          continue;
        }
        for (Edge edge : List.copyOf(result.outgoing(reachable))) {
          if (!edge.isEpsilon()) {
            result.link(node, edge.target(), edge.label());
          }
        }
      }
    }

    int removed = 0;
    for (Edge edge : List.copyOf(result.edges())) {
      if (edge.isEpsilon()) {
        result.unlink(edge);
        removed++;
      }
    }
    log.debug("Eliminated {} epsilon edges, {} edges remain", removed, result.edges().size());
    return result;
  }

  /**
   * Mark terminal every node that has an epsilon path to a terminal node.
   */
  private static void propagateTerminals(Automaton automaton) {
    final Map<Integer, List<Integer>> epsilonSources = new HashMap<>();
    for (Edge edge : automaton.edges()) {
      if (edge.isEpsilon()) {
        epsilonSources.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge.source());
      }
    }

    final ArrayDeque<Integer> toVisit = new ArrayDeque<>(automaton.terminals());
    while (!toVisit.isEmpty()) {
      final int terminal = toVisit.poll();
      for (int source : epsilonSources.getOrDefault(terminal, List.of())) {
        if (!automaton.isTerminal(source)) {
          automaton.setTerminal(source, true);
          toVisit.add(source);
        }
      }
    }
  }

  /**
   * Copy with a single terminal node.
   *
   * A fresh terminal node is always added (even if there was only one
   * terminal to begin with) and every former terminal gets an epsilon edge to
   * it and loses its terminal flag.
   *
   * @param automaton automaton to rewrite
   * @return rewritten copy
   */
  public static Automaton unifyTerminals(Automaton automaton) {
    final Automaton result = automaton.copy();
    final List<Integer> terminals = result.terminals();
    final int end = result.makeNode(true);
    for (int terminal : terminals) {
      result.setTerminal(terminal, false);
      result.link(terminal, end, "");
    }
    return result;
  }
}
