package kleene.graph;

/**
 * Thrown by operations that need a DFA when they find two transitions for the
 * same state and symbol (or a transition that is not a single symbol).
 */
public class NonDeterministicException extends IllegalStateException {

  @java.io.Serial
  private static final long serialVersionUID = -6671985217014432288L;

  public NonDeterministicException(Object stateKey, String label) {
    super("Automaton is not deterministic at state " + stateKey + " on '" + label + "'");
  }
}
