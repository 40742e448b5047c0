package kleene.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subset construction and completion.
 *
 * States of a determinized automaton are keyed by the (unmodifiable) set of
 * the keys of the original nodes they stand for.
 */
public final class Determinizer {

  private static final Logger log = LoggerFactory.getLogger(Determinizer.class);

  private Determinizer() {
  }

  /**
   * Deterministic automaton with the same language.
   *
   * If the input is already deterministic, this is just a copy. Otherwise
   * epsilon edges are removed, the result trimmed and then only the subsets
   * reachable from the start subset are constructed.
   *
   * @param automaton automaton to determinize
   * @return deterministic automaton, possibly not total
   */
  public static Automaton determinize(Automaton automaton) {
    if (automaton.isDeterministic()) {
      return automaton.copy();
    }

    final Automaton nfa = Trimmer.trim(EdgeNormalizer.eliminateEpsilons(automaton));
    final var dfa = new Automaton(nfa.alphabet());

    final Map<Integer, List<Integer>> members = new HashMap<>();
    final ArrayDeque<Integer> toVisit = new ArrayDeque<>();

    final int start = dfa.start();
    dfa.changeKey(start, subsetKey(nfa, List.of(nfa.start())));
    dfa.setTerminal(start, nfa.isTerminal(nfa.start()));
    members.put(start, List.of(nfa.start()));
    toVisit.add(start);

    while (!toVisit.isEmpty()) {
      final int state = toVisit.poll();

      // Successor subsets, in alphabet order
      final Map<Character, SortedSet<Integer>> successors = new TreeMap<>();
      for (int member : members.get(state)) {
        for (Edge edge : nfa.outgoing(member)) {
          successors.computeIfAbsent(edge.symbol(), c -> new TreeSet<>()).add(edge.target());
        }
      }

      for (var entry : successors.entrySet()) {
        final Set<Object> key = subsetKey(nfa, entry.getValue());
        final int target;
        if (dfa.containsKey(key)) {
          target = dfa.node(key);
        } else {
          final boolean terminal = entry.getValue().stream().anyMatch(nfa::isTerminal);
          target = dfa.makeNode(key, terminal);
          members.put(target, new ArrayList<>(entry.getValue()));
          toVisit.add(target);
        }
        dfa.link(state, target, String.valueOf(entry.getKey()));
      }
    }

    log.debug("Determinized {} nodes into {} subset states", nfa.size(), dfa.size());
    return dfa;
  }

  private static Set<Object> subsetKey(Automaton nfa, Collection<Integer> nodes) {
    final Set<Object> keys = new LinkedHashSet<>();
    for (int node : nodes) {
      keys.add(nfa.key(node));
    }
    return Collections.unmodifiableSet(keys);
  }

  /**
   * Deterministic and total automaton with the same language.
   *
   * Missing transitions all go to one fresh non-terminal sink node, which
   * loops on every symbol. If nothing needed the sink, it is trimmed away.
   *
   * @param automaton automaton to complete
   * @return total DFA
   */
  public static Automaton complete(Automaton automaton) {
    final Automaton dfa = determinize(automaton);
    final int sink = dfa.makeNode(false);
    for (int node : dfa.nodes()) {
      final Set<Character> present = dfa
        .outgoing(node)
        .stream()
        .map(Edge::symbol)
        .collect(Collectors.toSet());
      for (char symbol : dfa.alphabet()) {
        if (!present.contains(symbol)) {
          dfa.link(node, sink, String.valueOf(symbol));
        }
      }
    }
    return Trimmer.trim(dfa);
  }
}
