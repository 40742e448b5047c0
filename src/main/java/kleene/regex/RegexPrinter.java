package kleene.regex;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a regex in the textual syntax accepted by the parser.
 *
 * <p>Union binds loosest, then concatenation, then star. Parentheses are only
 * added where a looser operator ends up inside a tighter one. The empty
 * concatenation prints as {@code 1} and the empty union as {@code 0}.
 */
public final class RegexPrinter implements RegexVisitor<RegexPrinter.Printed> {

  private enum Level {
    UNION,
    CONCAT,
    ATOM
  }

  /**
   * Rendered sub-expression along with its loosest top-level operator.
   */
  record Printed(String text, Level level) {
    String at(Level context) {
      return level.compareTo(context) < 0 ? "(" + text + ")" : text;
    }
  }

  private static final RegexPrinter INSTANCE = new RegexPrinter();

  private RegexPrinter() {
  }

  public static String print(Regex regex) {
    return regex.accept(INSTANCE).text();
  }

  @Override
  public Printed visitLetter(char symbol) {
    return new Printed(String.valueOf(symbol), Level.ATOM);
  }

  @Override
  public Printed visitEmptyLanguage() {
    return new Printed("0", Level.ATOM);
  }

  @Override
  public Printed visitEmptyString() {
    return new Printed("1", Level.ATOM);
  }

  @Override
  public Printed visitConcat(List<Printed> children) {
    if (children.isEmpty()) {
      return visitEmptyString();
    }
    final String text = children
      .stream()
      .map(child -> child.at(Level.CONCAT))
      .collect(Collectors.joining());
    return new Printed(text, Level.CONCAT);
  }

  @Override
  public Printed visitUnion(List<Printed> children) {
    if (children.isEmpty()) {
      return visitEmptyLanguage();
    }
    final String text = children
      .stream()
      .map(Printed::text)
      .collect(Collectors.joining("+"));
    return new Printed(text, Level.UNION);
  }

  @Override
  public Printed visitStar(Printed child) {
    return new Printed(child.at(Level.ATOM) + "*", Level.ATOM);
  }
}
