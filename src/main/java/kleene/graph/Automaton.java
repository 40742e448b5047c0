package kleene.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Finite automaton over a fixed alphabet, stored as a multigraph.
 *
 * <p>Nodes are addressed by {@code int} ids handed out by {@link #makeNode}.
 * Ids index into an arena and are never reused: removing a node leaves its
 * slot empty. Every node also carries a key, which is any value with a
 * sensible {@code equals}/{@code hashCode} (integers by default, lists for
 * tuples, sets for subset states). Keys are unique within an automaton and
 * can be rebound with {@link #changeKey}.
 *
 * <p>Edges are labelled with strings over the alphabet. The empty label is an
 * epsilon edge and longer labels consume several symbols at once, so the same
 * class models epsilon-NFAs, NFAs and DFAs.
 */
public final class Automaton {

  private static final class Slot {
    Object key;
    boolean terminal;
    final Set<Edge> outgoing = new LinkedHashSet<>();

    Slot(Object key, boolean terminal) {
      this.key = key;
      this.terminal = terminal;
    }
  }

  private final Alphabet alphabet;

  // Removed nodes leave a `null` slot behind
  private final List<Slot> slots = new ArrayList<>();
  private final Map<Object, Integer> lookup = new HashMap<>();
  private final Set<Edge> edges = new LinkedHashSet<>();

  private int start;
  private int nextKey = 0;
  private int liveNodes = 0;

  /**
   * Make an automaton with a single non-terminal start node.
   *
   * @param alphabet symbols edges may be labelled with
   */
  public Automaton(Alphabet alphabet) {
    this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
    this.start = makeNode(false);
  }

  public Automaton(String alphabet) {
    this(Alphabet.of(alphabet));
  }

  private Automaton(Alphabet alphabet, boolean unused) {
    this.alphabet = alphabet;
  }

  public Alphabet alphabet() {
    return alphabet;
  }

  /**
   * Make a new node.
   *
   * @param key key of the new node, or {@code null} for a fresh integer key
   * @param terminal whether the node is accepting
   * @return id of the new node
   * @throws DuplicateKeyException if another node already has the key
   */
  public int makeNode(Object key, boolean terminal) {
    final Object actualKey = key == null ? freshKey() : key;
    if (lookup.containsKey(actualKey)) {
      throw new DuplicateKeyException(actualKey);
    }
    final int id = slots.size();
    slots.add(new Slot(actualKey, terminal));
    lookup.put(actualKey, id);
    liveNodes++;
    return id;
  }

  public int makeNode(boolean terminal) {
    return makeNode(null, terminal);
  }

  public int makeNode() {
    return makeNode(null, false);
  }

  /**
   * Next integer key that is not bound to any node.
   *
   * The counter only moves forward, skipping over keys that were bound
   * explicitly.
   */
  private Integer freshKey() {
    while (lookup.containsKey(nextKey)) {
      nextKey++;
    }
    return nextKey++;
  }

  private Slot slot(int node) {
    final Slot slot = node >= 0 && node < slots.size() ? slots.get(node) : null;
    if (slot == null) {
      throw UnknownKeyException.forNode(node);
    }
    return slot;
  }

  /**
   * Find the node bound to a key.
   *
   * @param key key to look up
   * @return id of the node
   * @throws UnknownKeyException if no node has that key
   */
  public int node(Object key) {
    final Integer node = lookup.get(key);
    if (node == null) {
      throw UnknownKeyException.forKey(key);
    }
    return node;
  }

  public boolean containsKey(Object key) {
    return lookup.containsKey(key);
  }

  public boolean containsNode(int node) {
    return node >= 0 && node < slots.size() && slots.get(node) != null;
  }

  public Object key(int node) {
    return slot(node).key;
  }

  /**
   * Rebind the key of a node.
   *
   * @param node node whose key changes
   * @param key new key, or {@code null} for a fresh integer key
   * @throws DuplicateKeyException if a different node already has the key
   */
  public void changeKey(int node, Object key) {
    final Slot slot = slot(node);
    final Object actualKey = key == null ? freshKey() : key;
    final Integer bound = lookup.get(actualKey);
    if (bound != null) {
      if (bound == node) {
        return;
      }
      throw new DuplicateKeyException(actualKey);
    }
    lookup.remove(slot.key);
    lookup.put(actualKey, node);
    slot.key = actualKey;
  }

  public boolean isTerminal(int node) {
    return slot(node).terminal;
  }

  public void setTerminal(int node, boolean terminal) {
    slot(node).terminal = terminal;
  }

  public int start() {
    return start;
  }

  public void setStart(int node) {
    slot(node);
    this.start = node;
  }

  /** Number of nodes currently in the automaton. */
  public int size() {
    return liveNodes;
  }

  /** Ids of live nodes, in ascending order. */
  public List<Integer> nodes() {
    return IntStream
      .range(0, slots.size())
      .filter(i -> slots.get(i) != null)
      .boxed()
      .collect(Collectors.toUnmodifiableList());
  }

  /** Ids of terminal nodes, in ascending order. */
  public List<Integer> terminals() {
    return IntStream
      .range(0, slots.size())
      .filter(i -> slots.get(i) != null && slots.get(i).terminal)
      .boxed()
      .collect(Collectors.toUnmodifiableList());
  }

  /** All edges, in insertion order. */
  public Set<Edge> edges() {
    return Collections.unmodifiableSet(edges);
  }

  public Set<Edge> outgoing(int node) {
    return Collections.unmodifiableSet(slot(node).outgoing);
  }

  /**
   * Add an edge.
   *
   * Adding an edge that is already present is a no-op returning the same
   * (equal) edge.
   *
   * @param source node where the edge starts
   * @param target node where the edge ends
   * @param label symbols to consume, empty for an epsilon edge
   * @return the edge
   */
  public Edge link(int source, int target, String label) {
    final Slot sourceSlot = slot(source);
    slot(target);
    if (!alphabet.containsAll(label)) {
      throw new IllegalArgumentException(
        "Label '" + label + "' has symbols outside of the alphabet '" + alphabet + "'"
      );
    }
    final var edge = new Edge(source, target, label);
    if (edges.add(edge)) {
      sourceSlot.outgoing.add(edge);
    }
    return edge;
  }

  public Edge linkKeys(Object sourceKey, Object targetKey, String label) {
    return link(node(sourceKey), node(targetKey), label);
  }

  /**
   * Remove an edge.
   *
   * @param edge edge to remove
   * @throws IllegalArgumentException if the edge is not in this automaton
   */
  public void unlink(Edge edge) {
    if (!edges.remove(edge)) {
      throw new IllegalArgumentException("Edge " + edge + " is not in the automaton");
    }
    slot(edge.source()).outgoing.remove(edge);
  }

  /**
   * Remove nodes along with every edge that starts or ends at one of them.
   *
   * @param nodes ids of the nodes to remove
   * @throws IllegalArgumentException if the start node is among them
   */
  public void removeNodes(Collection<Integer> nodes) {
    final Set<Integer> removed = new HashSet<>(nodes);
    for (int node : removed) {
      slot(node);
    }
    if (removed.contains(start)) {
      throw new IllegalArgumentException("Cannot remove the start node " + key(start));
    }

    final List<Edge> touching = edges
      .stream()
      .filter(e -> removed.contains(e.source()) || removed.contains(e.target()))
      .collect(Collectors.toList());
    touching.forEach(this::unlink);

    for (int node : removed) {
      lookup.remove(slots.get(node).key);
      slots.set(node, null);
      liveNodes--;
    }
  }

  /**
   * Target of the only transition out of a node on a symbol.
   *
   * @param node source node
   * @param symbol symbol to consume
   * @return target node, or empty if there is no such transition
   * @throws NonDeterministicException if there is more than one such transition
   */
  public OptionalInt transition(int node, char symbol) {
    final String label = String.valueOf(symbol);
    OptionalInt found = OptionalInt.empty();
    for (Edge edge : slot(node).outgoing) {
      if (edge.label().equals(label)) {
        if (found.isPresent()) {
          throw new NonDeterministicException(key(node), label);
        }
        found = OptionalInt.of(edge.target());
      }
    }
    return found;
  }

  /**
   * Independent copy with the same keys, flags, edges and start.
   *
   * Node ids of the copy are compacted, so they may differ from the ids of
   * this automaton. Keys are shared, not copied.
   */
  public Automaton copy() {
    return copy(alphabet);
  }

  /**
   * Independent copy over a different alphabet.
   *
   * @param alphabet alphabet of the copy, which must cover all the labels
   */
  public Automaton copy(Alphabet alphabet) {
    final var result = new Automaton(alphabet, true);
    final int[] ids = new int[slots.size()];
    for (int i = 0; i < slots.size(); i++) {
      final Slot slot = slots.get(i);
      if (slot != null) {
        ids[i] = result.makeNode(slot.key, slot.terminal);
      }
    }
    for (Edge edge : edges) {
      result.link(ids[edge.source()], ids[edge.target()], edge.label());
    }
    result.start = ids[start];
    result.nextKey = nextKey;
    return result;
  }

  /**
   * Whether every edge consumes exactly one symbol and no node has two
   * outgoing edges on the same symbol.
   */
  public boolean isDeterministic() {
    for (Slot slot : slots) {
      if (slot == null) {
        continue;
      }
      final Set<String> labels = new HashSet<>();
      for (Edge edge : slot.outgoing) {
        if (edge.length() != 1 || !labels.add(edge.label())) {
          return false;
        }
      }
    }
    return true;
  }

  /** Whether the automaton is deterministic and has a transition for every symbol everywhere. */
  public boolean isTotal() {
    if (!isDeterministic()) {
      return false;
    }
    return slots
      .stream()
      .filter(Objects::nonNull)
      .allMatch(slot -> slot.outgoing.size() == alphabet.size());
  }

  /**
   * Check whether the automaton accepts a word.
   *
   * Works on any automaton: the simulation explores (node, offset) pairs
   * breadth-first, following epsilon and multi-symbol edges.
   *
   * @param word input to run
   * @return whether some path from the start consumes the whole word and ends
   *   in a terminal node
   */
  public boolean accepts(CharSequence word) {
    record Position(int node, int offset) { }

    final String input = word.toString();
    final Set<Position> seen = new HashSet<>();
    final ArrayDeque<Position> toVisit = new ArrayDeque<>();
    toVisit.add(new Position(start, 0));

    while (!toVisit.isEmpty()) {
      final Position position = toVisit.poll();
      if (!seen.add(position)) {
        continue;
      }
      if (position.offset() == input.length() && isTerminal(position.node())) {
        return true;
      }
      for (Edge edge : slot(position.node()).outgoing) {
        if (input.startsWith(edge.label(), position.offset())) {
          toVisit.add(new Position(edge.target(), position.offset() + edge.length()));
        }
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Automaton(alphabet='" + alphabet + "', nodes=" + liveNodes + ", edges=" + edges.size() + ")";
  }
}
