package kleene.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Line-oriented text format for automata.
 *
 * <pre>
 *   "ab"
 *
 *   0
 *   1 T
 *
 *   0 1 "a"
 *   1 1 "b"
 * </pre>
 *
 * The first line is the alphabet, as a quoted string. After a blank line
 * come the nodes, one per line, start node first, with {@code T} after the
 * terminal ones. After another blank line come the edges: source key, target
 * key and quoted label. Keys are integers, quoted strings or parenthesized
 * tuples of keys (read back as lists).
 */
public final class AutomatonText {

  private AutomatonText() {
  }

  /**
   * Serialize an automaton.
   *
   * @param automaton automaton to write
   * @return text form of the automaton
   * @throws UnserializableKeyException if a key is not an integer, string or list
   */
  public static String write(Automaton automaton) {
    final var builder = new StringBuilder();
    writeString(builder, automaton.alphabet().toString());
    builder.append("\n\n");

    final List<Integer> nodes = new ArrayList<>();
    nodes.add(automaton.start());
    automaton.nodes().stream().filter(n -> n != automaton.start()).forEach(nodes::add);
    for (int node : nodes) {
      writeKey(builder, automaton.key(node));
      if (automaton.isTerminal(node)) {
        builder.append(" T");
      }
      builder.append('\n');
    }
    builder.append('\n');

    for (Edge edge : automaton.edges()) {
      writeKey(builder, automaton.key(edge.source()));
      builder.append(' ');
      writeKey(builder, automaton.key(edge.target()));
      builder.append(' ');
      writeString(builder, edge.label());
      builder.append('\n');
    }
    return builder.toString();
  }

  private static void writeKey(StringBuilder builder, Object key) {
    if (key instanceof Integer) {
      builder.append(key);
    } else if (key instanceof String string) {
      writeString(builder, string);
    } else if (key instanceof List<?> items) {
      builder.append('(');
      for (int i = 0; i < items.size(); i++) {
        if (i > 0) {
          builder.append(", ");
        }
        writeKey(builder, items.get(i));
      }
      if (items.size() == 1) {
        builder.append(',');
      }
      builder.append(')');
    } else {
      throw new UnserializableKeyException(key);
    }
  }

  private static void writeString(StringBuilder builder, String string) {
    builder.append('"');
    for (int i = 0; i < string.length(); i++) {
      final char c = string.charAt(i);
      switch (c) {
        case '"':
          builder.append("\\\"");
          break;
        case '\\':
          builder.append("\\\\");
          break;
        case '\n':
          builder.append("\\n");
          break;
        case '\t':
          builder.append("\\t");
          break;
        case '\r':
          builder.append("\\r");
          break;
        default:
          if (Character.isISOControl(c)) {
            builder.append(String.format("\\u%04x", (int) c));
          } else {
            builder.append(c);
          }
      }
    }
    builder.append('"');
  }

  /**
   * Read back an automaton written by {@link #write}.
   *
   * @param text text form of an automaton
   * @return the automaton
   * @throws IllegalArgumentException if the text is malformed
   */
  public static Automaton read(String text) {
    final List<String> lines = text.lines().collect(Collectors.toList());
    if (lines.isEmpty()) {
      throw new IllegalArgumentException("Missing alphabet line");
    }

    final var header = new Reader(lines.get(0), 1);
    final var automaton = new Automaton(Alphabet.of(header.readString()));
    header.expectEnd();

    int lineNumber = 1;
    if (lineNumber >= lines.size() || !lines.get(lineNumber).isBlank()) {
      throw new IllegalArgumentException("Expected a blank line after the alphabet");
    }
    lineNumber++;

    boolean first = true;
    for (; lineNumber < lines.size() && !lines.get(lineNumber).isBlank(); lineNumber++) {
      final var reader = new Reader(lines.get(lineNumber), lineNumber + 1);
      final Object key = reader.readKey();
      final boolean terminal = reader.readTerminalFlag();
      reader.expectEnd();
      if (first) {
        automaton.changeKey(automaton.start(), key);
        automaton.setTerminal(automaton.start(), terminal);
        first = false;
      } else {
        automaton.makeNode(key, terminal);
      }
    }
    if (first) {
      throw new IllegalArgumentException("Expected at least one node");
    }

    for (lineNumber++; lineNumber < lines.size(); lineNumber++) {
      if (lines.get(lineNumber).isBlank()) {
        continue;
      }
      final var reader = new Reader(lines.get(lineNumber), lineNumber + 1);
      final Object source = reader.readKey();
      final Object target = reader.readKey();
      final String label = reader.readString();
      reader.expectEnd();
      try {
        automaton.linkKeys(source, target, label);
      } catch (UnknownKeyException e) {
        throw new IllegalArgumentException("Line " + (lineNumber + 1) + ": " + e.getMessage(), e);
      }
    }
    return automaton;
  }

  /**
   * Cursor over a single line of the text format.
   */
  private static final class Reader {
    private final String line;
    private final int lineNumber;
    private int position = 0;

    Reader(String line, int lineNumber) {
      this.line = line;
      this.lineNumber = lineNumber;
    }

    private IllegalArgumentException error(String message) {
      return new IllegalArgumentException(
        "Line " + lineNumber + ", column " + (position + 1) + ": " + message
      );
    }

    private void skipSpaces() {
      while (position < line.length() && line.charAt(position) == ' ') {
        position++;
      }
    }

    private char peek() {
      skipSpaces();
      if (position >= line.length()) {
        throw error("Unexpected end of line");
      }
      return line.charAt(position);
    }

    void expectEnd() {
      skipSpaces();
      if (position < line.length()) {
        throw error("Unexpected trailing text '" + line.substring(position) + "'");
      }
    }

    boolean readTerminalFlag() {
      skipSpaces();
      if (position < line.length() && line.charAt(position) == 'T') {
        position++;
        return true;
      }
      return false;
    }

    Object readKey() {
      final char c = peek();
      if (c == '"') {
        return readString();
      } else if (c == '(') {
        return readTuple();
      } else if (c == '-' || Character.isDigit(c)) {
        return readInteger();
      } else {
        throw error("Expected a key, found '" + c + "'");
      }
    }

    private List<Object> readTuple() {
      position++;
      final List<Object> items = new ArrayList<>();
      if (peek() == ')') {
        position++;
        return List.copyOf(items);
      }
      while (true) {
        items.add(readKey());
        final char c = peek();
        position++;
        if (c == ')') {
          return List.copyOf(items);
        } else if (c != ',') {
          throw error("Expected ',' or ')' in tuple, found '" + c + "'");
        } else if (peek() == ')') {
          position++;
          return List.copyOf(items);
        }
      }
    }

    private Integer readInteger() {
      final int start = position;
      if (line.charAt(position) == '-') {
        position++;
      }
      while (position < line.length() && Character.isDigit(line.charAt(position))) {
        position++;
      }
      try {
        return Integer.valueOf(line.substring(start, position));
      } catch (NumberFormatException e) {
        throw error("Malformed integer key '" + line.substring(start, position) + "'");
      }
    }

    private char readUnicodeEscape() {
      if (position + 4 > line.length()) {
        throw error("Truncated unicode escape");
      }
      final String digits = line.substring(position, position + 4);
      try {
        final char c = (char) Integer.parseInt(digits, 16);
        position += 4;
        return c;
      } catch (NumberFormatException e) {
        throw error("Malformed unicode escape '\\u" + digits + "'");
      }
    }

    String readString() {
      if (peek() != '"') {
        throw error("Expected a quoted string");
      }
      position++;
      final var builder = new StringBuilder();
      while (true) {
        if (position >= line.length()) {
          throw error("Unterminated string");
        }
        final char c = line.charAt(position++);
        if (c == '"') {
          return builder.toString();
        } else if (c != '\\') {
          builder.append(c);
        } else if (position >= line.length()) {
          throw error("Unterminated escape");
        } else {
          final char escaped = line.charAt(position++);
          switch (escaped) {
            case 'n':
              builder.append('\n');
              break;
            case 't':
              builder.append('\t');
              break;
            case 'r':
              builder.append('\r');
              break;
            case 'u':
              builder.append(readUnicodeEscape());
              break;
            case '"':
            case '\\':
              builder.append(escaped);
              break;
            default:
              throw error("Unknown escape '\\" + escaped + "'");
          }
        }
      }
    }
  }
}
