package kleene.regex;

import java.util.List;

/**
 * Visitor that rebuilds the AST it traverses.
 *
 * Handy as the target of the parsers, which report their progress through a
 * {@link RegexVisitor}.
 */
public final class RegexTreeBuilder implements RegexVisitor<Regex> {

  public static final RegexTreeBuilder INSTANCE = new RegexTreeBuilder();

  private RegexTreeBuilder() {
  }

  @Override
  public Regex visitLetter(char symbol) {
    return new Regex.Letter(symbol);
  }

  @Override
  public Regex visitEmptyLanguage() {
    return Regex.ZERO;
  }

  @Override
  public Regex visitEmptyString() {
    return Regex.ONE;
  }

  @Override
  public Regex visitConcat(List<Regex> children) {
    return new Regex.Concat(children);
  }

  @Override
  public Regex visitUnion(List<Regex> children) {
    return new Regex.Union(children);
  }

  @Override
  public Regex visitStar(Regex child) {
    return new Regex.Star(child);
  }
}
