package kleene.graph;

/**
 * Thrown when a node key cannot be written in the text format of
 * {@link AutomatonText}.
 */
public class UnserializableKeyException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = -1581652302284290917L;

  public UnserializableKeyException(Object key) {
    super("Keys of type " + key.getClass().getName() + " cannot be serialized: " + key);
  }
}
