package kleene.graph;

/**
 * Thrown when a node would be given a key that already belongs to another
 * node of the same automaton.
 */
public class DuplicateKeyException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 4120387795326671470L;

  /**
   * Key that was already bound.
   */
  public final transient Object key;

  public DuplicateKeyException(Object key) {
    super("Duplicate key detected: " + key);
    this.key = key;
  }
}
