package kleene.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import kleene.regex.Regex;
import kleene.regex.RegexSimplifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of an automaton back into a regex, by eliminating states one at
 * a time (Kleene's construction).
 *
 * <p>The automaton is first normalized so that it has no epsilon or
 * multi-symbol edges, then given a single fresh terminal node. Edges are then
 * moved into a generalized transition graph whose labels are regexes, where
 * every node has exactly one self loop and every pair of nodes at most one
 * edge. Eliminating a node {@code t} replaces each path
 * {@code in -> t -> out} with an edge labelled {@code in t* out}. Once only
 * the start and the end are left, the answer can be read off directly.
 */
public final class StateElimination {

  private static final Logger log = LoggerFactory.getLogger(StateElimination.class);

  // Outgoing and incoming edges of the generalized graph, by node
  private final Map<Integer, Map<Integer, Regex>> outgoing = new LinkedHashMap<>();
  private final Map<Integer, Map<Integer, Regex>> incoming = new LinkedHashMap<>();

  private final int start;
  private final int end;

  private StateElimination(Automaton automaton, int end) {
    this.start = automaton.start();
    this.end = end;
    for (int node : automaton.nodes()) {
      outgoing.put(node, new LinkedHashMap<>());
      incoming.put(node, new LinkedHashMap<>());
    }
    for (Edge edge : automaton.edges()) {
      final Regex label = edge.isEpsilon() ? Regex.ONE : Regex.letter(edge.symbol());
      link(edge.source(), edge.target(), label);
    }
    for (int node : automaton.nodes()) {
      if (!outgoing.get(node).containsKey(node)) {
        link(node, node, Regex.ZERO);
      }
    }
  }

  /**
   * Regex with the same language as an automaton.
   *
   * @param automaton automaton to convert
   * @return simplified regex
   */
  public static Regex toRegex(Automaton automaton) {
    final Automaton normalized = Trimmer.trim(
      EdgeNormalizer.unifyTerminals(EdgeNormalizer.eliminateEpsilons(automaton))
    );

    // The fresh end node is the only terminal and gets trimmed if unreachable
    final List<Integer> terminals = normalized.terminals();
    if (terminals.isEmpty()) {
      return Regex.ZERO;
    }

    final var elimination = new StateElimination(normalized, terminals.get(0));
    return RegexSimplifier.simplify(elimination.eliminate());
  }

  /**
   * Add an edge to the generalized graph, merging it with any parallel edge
   * into a (simplified) union.
   */
  private void link(int source, int target, Regex label) {
    final Regex existing = outgoing.get(source).get(target);
    final Regex merged;
    if (existing == null) {
      merged = label;
    } else if (existing instanceof Regex.Union union) {
      final List<Regex> alternatives = new ArrayList<>(union.children());
      alternatives.add(label);
      merged = RegexSimplifier.simplify(new Regex.Union(alternatives));
    } else {
      merged = RegexSimplifier.simplify(Regex.union(existing, label));
    }
    outgoing.get(source).put(target, merged);
    incoming.get(target).put(source, merged);
  }

  private Regex eliminate() {
    // The end is fresh so it differs from the start and has no outgoing edges
    while (outgoing.size() > 2) {
      final int target = outgoing
        .keySet()
        .stream()
        .filter(node -> node != start && node != end)
        .findFirst()
        .orElseThrow();
      eliminateNode(target);
    }

    final Regex startLoop = outgoing.get(start).get(start);
    final Regex endLoop = outgoing.get(end).get(end);
    final Regex bridge = outgoing.get(start).getOrDefault(end, Regex.ZERO);
    return Regex.concat(Regex.star(startLoop), bridge, Regex.star(endLoop));
  }

  private void eliminateNode(int target) {
    final Regex loop = Regex.star(outgoing.get(target).get(target));

    final Map<Integer, Regex> sources = new LinkedHashMap<>(incoming.remove(target));
    final Map<Integer, Regex> targets = new LinkedHashMap<>(outgoing.remove(target));
    sources.remove(target);
    targets.remove(target);
    for (int source : sources.keySet()) {
      outgoing.get(source).remove(target);
    }
    for (int next : targets.keySet()) {
      incoming.get(next).remove(target);
    }

    for (var in : sources.entrySet()) {
      for (var out : targets.entrySet()) {
        final Regex path = Regex.concat(in.getValue(), loop, out.getValue());
        link(in.getKey(), out.getKey(), RegexSimplifier.simplify(path));
      }
    }
    log.debug("Eliminated node {}: {} incoming, {} outgoing", target, sources.size(), targets.size());
  }
}
