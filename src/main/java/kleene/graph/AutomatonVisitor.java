package kleene.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Breadth-first walk over the nodes of an automaton.
 *
 * <p>Each node is visited at most once, in the order it was first enqueued.
 * By default visiting a node enqueues the targets of all its outgoing edges;
 * subclasses override {@link #visitNode} to restrict or extend that.
 */
public class AutomatonVisitor {

  /**
   * Pending visit.
   *
   * @param via edge that led to the node, {@code null} for the walk's origin
   * @param node node to visit
   */
  protected record Step(Edge via, int node) { }

  protected final Automaton automaton;
  private final ArrayDeque<Step> toVisit = new ArrayDeque<>();
  private final Set<Integer> seen = new LinkedHashSet<>();

  public AutomatonVisitor(Automaton automaton) {
    this.automaton = automaton;
  }

  /** Walk from the start of the automaton. */
  public void visit() {
    visit(automaton.start());
  }

  /**
   * Walk from a given node.
   *
   * Nodes seen in an earlier walk are not visited again.
   *
   * @param origin node to start from
   */
  public void visit(int origin) {
    toVisit.add(new Step(null, origin));
    while (!toVisit.isEmpty()) {
      final Step step = toVisit.poll();
      if (seen.add(step.node())) {
        visitNode(step.via(), step.node());
      }
    }
  }

  /**
   * Called once per newly seen node.
   *
   * @param via edge that led to the node, {@code null} for the walk's origin
   * @param node node being visited
   */
  protected void visitNode(Edge via, int node) {
    for (Edge edge : automaton.outgoing(node)) {
      enqueue(edge);
    }
  }

  protected final void enqueue(Edge edge) {
    if (!seen.contains(edge.target())) {
      toVisit.add(new Step(edge, edge.target()));
    }
  }

  public boolean wasSeen(int node) {
    return seen.contains(node);
  }

  /** Nodes visited so far, in visiting order. */
  public Set<Integer> seen() {
    return Collections.unmodifiableSet(seen);
  }
}
