package kleene.regex;

import java.util.List;

/**
 * Bottom-up traversal of the regular expression AST.
 *
 * @param <R> output from traversing the regex AST
 */
public interface RegexVisitor<R> {

  /**
   * Matches exactly one symbol.
   *
   * @param symbol the symbol
   */
  R visitLetter(char symbol);

  /**
   * Matches nothing at all, not even the empty string.
   */
  R visitEmptyLanguage();

  /**
   * Matches only the empty string.
   */
  R visitEmptyString();

  /**
   * Matches the patterns one after another.
   *
   * An empty list of patterns matches only the empty string.
   *
   * @param children already visited sub-patterns, in order
   */
  R visitConcat(List<R> children);

  /**
   * Matches any one of the patterns.
   *
   * An empty list of patterns matches nothing.
   *
   * @param children already visited alternatives, in order
   */
  R visitUnion(List<R> children);

  /**
   * Matches a pattern zero or more times.
   *
   * @param child already visited pattern to repeat
   */
  R visitStar(R child);
}
