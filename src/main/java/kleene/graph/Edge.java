package kleene.graph;

/**
 * Labelled transition between two nodes of an {@link Automaton}.
 *
 * Edges are compared by value, so the same triple can only be stored once in
 * an automaton. Parallel edges with different labels are fine.
 *
 * @param source id of the node where the edge starts
 * @param target id of the node where the edge ends
 * @param label symbols consumed along the edge (empty for an epsilon edge)
 */
public record Edge(int source, int target, String label) {

  public Edge {
    if (label == null) {
      throw new NullPointerException("edge label");
    }
  }

  public boolean isEpsilon() {
    return label.isEmpty();
  }

  public int length() {
    return label.length();
  }

  /**
   * Symbol of a single-symbol edge.
   *
   * @return the only symbol on the edge
   */
  public char symbol() {
    if (label.length() != 1) {
      throw new IllegalStateException("edge " + this + " is not a single-symbol edge");
    }
    return label.charAt(0);
  }
}
