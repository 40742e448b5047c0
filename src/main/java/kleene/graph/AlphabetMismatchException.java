package kleene.graph;

/**
 * Thrown when two automata combined symbol by symbol do not share a declared
 * alphabet.
 */
public class AlphabetMismatchException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 2303955541879032104L;

  public final Alphabet first;
  public final Alphabet second;

  public AlphabetMismatchException(Alphabet first, Alphabet second) {
    super("Automata have different alphabets: '" + first + "' and '" + second + "'");
    this.first = first;
    this.second = second;
  }
}
