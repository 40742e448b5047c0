package kleene.graph;

import java.util.NoSuchElementException;

/**
 * Thrown when a node is looked up by a key (or id) the automaton does not have.
 */
public class UnknownKeyException extends NoSuchElementException {

  @java.io.Serial
  private static final long serialVersionUID = -2218741950635519042L;

  public UnknownKeyException(String message) {
    super(message);
  }

  public static UnknownKeyException forKey(Object key) {
    return new UnknownKeyException("No node with key " + key);
  }

  public static UnknownKeyException forNode(int node) {
    return new UnknownKeyException("No node with id " + node);
  }
}
