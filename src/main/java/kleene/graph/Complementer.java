package kleene.graph;

/**
 * Complement of a language, relative to the declared alphabet.
 */
public final class Complementer {

  private Complementer() {
  }

  /**
   * Total DFA accepting exactly the words over the alphabet that the input
   * rejects.
   *
   * @param automaton automaton to complement
   * @return complement automaton
   */
  public static Automaton complement(Automaton automaton) {
    final Automaton result = Determinizer.complete(automaton);
    for (int node : result.nodes()) {
      result.setTerminal(node, !result.isTerminal(node));
    }
    return result;
  }
}
