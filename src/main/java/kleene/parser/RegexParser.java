package kleene.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import kleene.regex.Regex;
import kleene.regex.RegexTreeBuilder;
import kleene.regex.RegexVisitor;

/**
 * Parser for regular expressions in the usual textbook syntax.
 *
 * <pre>
 *   union   ::= concat ('+' concat)*
 *   concat  ::= postfix postfix*
 *   postfix ::= atom ('*' | '^' digits)*
 *   atom    ::= letter | '0' | '1' | '(' union ')'
 * </pre>
 *
 * {@code 0} is the empty language, {@code 1} the empty string and {@code ^N}
 * repeats the preceding atom exactly {@code N} times (with {@code N} below
 * {@link #MAX_REPETITIONS}). Whitespace is ignored everywhere.
 *
 * Like for any recursive descent parser, the results are made available
 * through a visitor instead of as an explicit AST type.
 */
public final class RegexParser<R> {

  /** Exclusive upper bound on the count of {@code ^N} repetitions. */
  public static final int MAX_REPETITIONS = 20;

  // Used when "visiting" the AST bottom up
  private final RegexVisitor<R> visitor;

  // Bookkeeping around position in source
  private final String input;
  private final int length;
  private int position = 0;

  private RegexParser(RegexVisitor<R> visitor, String input) {
    this.visitor = visitor;
    this.input = input;
    this.length = input.length();
  }

  /**
   * Parse a regular expression into its AST.
   *
   * @param input regular expression text
   * @return parsed regular expression
   */
  public static Regex parse(String input) throws RegexSyntaxException {
    return parse(RegexTreeBuilder.INSTANCE, input);
  }

  /**
   * Parse a regular expression, reporting progress to a visitor.
   *
   * @param visitor regex visitor used to accept bottom-up parsing progress
   * @param input regular expression text
   * @return parsed regular expression
   */
  public static <B> B parse(RegexVisitor<B> visitor, String input) throws RegexSyntaxException {
    final var parser = new RegexParser<B>(visitor, input);
    final B parsed = parser.parseUnion();
    parser.skipWhitespace();
    if (parser.position < parser.length) {
      throw parser.error("Expected the end of the regular expression");
    }
    return parsed;
  }

  private RegexSyntaxException error(String message) {
    return new RegexSyntaxException(message, input, position);
  }

  private void skipWhitespace() {
    while (position < length && Character.isWhitespace(input.charAt(position))) {
      position++;
    }
  }

  /**
   * Peek at the next significant character.
   *
   * @return next non-whitespace character or {@code -1} at the end of input
   */
  private int peek() {
    skipWhitespace();
    return position < length ? input.charAt(position) : -1;
  }

  private R parseUnion() {
    final List<R> alternatives = new ArrayList<>();
    alternatives.add(parseConcat());
    while (peek() == '+') {
      position++;
      alternatives.add(parseConcat());
    }
    return alternatives.size() == 1 ? alternatives.get(0) : visitor.visitUnion(alternatives);
  }

  private R parseConcat() {
    final List<R> items = new ArrayList<>();
    items.add(parsePostfix());
    while (true) {
      final int next = peek();
      if (next == -1 || next == '+' || next == ')') {
        break;
      }
      items.add(parsePostfix());
    }
    return items.size() == 1 ? items.get(0) : visitor.visitConcat(items);
  }

  private R parsePostfix() {
    R atom = parseAtom();
    while (true) {
      final int next = peek();
      if (next == '*') {
        position++;
        atom = visitor.visitStar(atom);
      } else if (next == '^') {
        position++;
        final int count = parseCount();
        atom = visitor.visitConcat(Collections.nCopies(count, atom));
      } else {
        return atom;
      }
    }
  }

  /**
   * Parse the repetition count following a {@code ^}.
   */
  private int parseCount() {
    skipWhitespace();
    final int start = position;
    int count = 0;
    while (position < length && isAsciiDigit(input.charAt(position))) {
      count = Math.min(count * 10 + (input.charAt(position) - '0'), MAX_REPETITIONS);
      position++;
    }
    if (start == position) {
      throw error("Expected a repetition count after '^'");
    }
    if (count >= MAX_REPETITIONS) {
      throw new RegexSyntaxException(
        "Repeat count too big: " + input.substring(start, position),
        input,
        start
      );
    }
    return count;
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private R parseAtom() {
    final int next = peek();
    if (next == -1) {
      throw error("Unexpected end of the regular expression");
    }
    final char c = (char) next;
    if (c == '(') {
      position++;
      final R inner = parseUnion();
      if (peek() != ')') {
        throw error("Expected ')' to close the group");
      }
      position++;
      return inner;
    } else if (c == '0') {
      position++;
      return visitor.visitEmptyLanguage();
    } else if (c == '1') {
      position++;
      return visitor.visitEmptyString();
    } else if (Character.isDigit(c)) {
      throw error(c + " is not a valid digit for regex");
    } else if (Character.isLetter(c)) {
      position++;
      return visitor.visitLetter(c);
    } else {
      throw error("Unexpected character '" + c + "'");
    }
  }
}
