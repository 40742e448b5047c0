package kleene.graph;

import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Graphs which can be rendered using the DOT language.
 *
 * @param <V> vertex in the graph
 * @param <E> edge label in the graph
 */
public interface DotGraph<V, E> {

  /**
   * Vertex in the dot graph.
   *
   * @param id unique identifier for the vertex
   * @param terminal is this an accepting state?
   */
  record Vertex<V>(V id, boolean terminal) { }

  /**
   * Edge in the dot graph.
   *
   * @param from vertex where the edge starts (or the invisible start marker if {@code null})
   * @param to vertex where the edge ends
   * @param label label on the edge
   */
  record Arrow<V, E>(V from, V to, E label) { }

  /**
   * List out the vertices in the graph.
   *
   * @return all vertices
   */
  Stream<Vertex<V>> vertices();

  /**
   * List out the edges in the graph, including one from {@code null} to the
   * start vertex.
   *
   * @return all edges
   */
  Stream<Arrow<V, E>> arrows();

  /**
   * Render an edge label.
   *
   * @param arrow edge associated with the label
   * @return plain text label
   */
  default String renderEdgeLabel(Arrow<V, E> arrow) {
    final E label = arrow.label();
    return label == null ? "" : label.toString();
  }

  /**
   * Render a vertex label.
   *
   * @param vertex vertex associated with the label
   * @return plain text label
   */
  default String renderVertexLabel(Vertex<V> vertex) {
    return vertex.id().toString();
  }

  /**
   * Render the graph into its DOT source.
   *
   * @param name title given to the graph
   * @return source code for the graph
   */
  default String dotGraph(String name) {
    final var builder = new StringBuilder();
    builder.append("digraph " + escapeId(name) + " {\n");
    builder.append("  rankdir = LR;\n");
    builder.append("  " + escapeId("_start") + " [shape = none, label = <>];\n");

    final Iterable<Vertex<V>> vs = () -> vertices().iterator();
    for (Vertex<V> vertex : vs) {
      final var id = escapeId(vertex.id().toString());
      final var shape = vertex.terminal() ? "doublecircle" : "circle";
      final var label = escapeHtml(renderVertexLabel(vertex));
      builder.append("  " + id + " [shape = " + shape + ", label = <" + label + ">];\n");
    }

    final Iterable<Arrow<V, E>> es = () -> arrows().iterator();
    for (Arrow<V, E> arrow : es) {
      final var from = escapeId(arrow.from() == null ? "_start" : arrow.from().toString());
      final var to = escapeId(arrow.to().toString());
      final var label = escapeHtml(renderEdgeLabel(arrow));
      builder.append("  " + from + " -> " + to + " [label = <" + label + ">];\n");
    }

    builder.append("}\n");
    return builder.toString();
  }

  /**
   * DOT source for an automaton.
   *
   * Vertices are identified by node id and labelled with their key rendered
   * by {@code keyLabel}. Epsilon edges are labelled {@code ε}.
   *
   * @param name title given to the graph
   * @param automaton automaton to draw
   * @param keyLabel how to print a node key
   * @return source code for the graph
   */
  static String render(String name, Automaton automaton, Function<Object, String> keyLabel) {
    final DotGraph<Integer, String> graph = new DotGraph<>() {
      @Override
      public Stream<Vertex<Integer>> vertices() {
        return automaton.nodes().stream().map(n -> new Vertex<>(n, automaton.isTerminal(n)));
      }

      @Override
      public Stream<Arrow<Integer, String>> arrows() {
        final Stream<Arrow<Integer, String>> initial = Stream.of(
          new Arrow<Integer, String>(null, automaton.start(), null)
        );
        return Stream.concat(
          initial,
          automaton.edges().stream().map(e -> new Arrow<>(e.source(), e.target(), e.label()))
        );
      }

      @Override
      public String renderEdgeLabel(Arrow<Integer, String> arrow) {
        if (arrow.label() == null) {
          return "";
        }
        return arrow.label().isEmpty() ? "ε" : arrow.label();
      }

      @Override
      public String renderVertexLabel(Vertex<Integer> vertex) {
        return keyLabel.apply(automaton.key(vertex.id()));
      }
    };
    return graph.dotGraph(name);
  }

  static String render(String name, Automaton automaton) {
    return render(name, automaton, String::valueOf);
  }

  /**
   * Turn a string into a Dot ID.
   *
   * <p>As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   *
   * @param str string to escape into an ID
   */
  private static String escapeId(String str) {
    return "\"" + str.replace("\"", "\\\"") + "\"";
  }

  private static String escapeHtml(String str) {
    return str.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
  }
}
