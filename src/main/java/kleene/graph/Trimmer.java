package kleene.graph;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes nodes that cannot be reached from the start.
 */
public final class Trimmer {

  private static final Logger log = LoggerFactory.getLogger(Trimmer.class);

  private Trimmer() {
  }

  /**
   * Copy of an automaton without its unreachable nodes.
   *
   * @param automaton automaton to trim
   * @return trimmed copy
   */
  public static Automaton trim(Automaton automaton) {
    final Automaton result = automaton.copy();
    final var visitor = new AutomatonVisitor(result);
    visitor.visit();

    final List<Integer> unreachable = result
      .nodes()
      .stream()
      .filter(node -> !visitor.wasSeen(node))
      .collect(Collectors.toList());
    if (!unreachable.isEmpty()) {
      log.debug("Trimming {} unreachable nodes out of {}", unreachable.size(), result.size());
      result.removeNodes(unreachable);
    }
    return result;
  }
}
