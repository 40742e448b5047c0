package kleene.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import kleene.regex.Regex;
import kleene.regex.RegexTreeBuilder;
import kleene.regex.RegexVisitor;

/**
 * Parser for regular expressions in reverse Polish notation.
 *
 * Letters push themselves, {@code 1} pushes the empty string and {@code 0}
 * the empty language. {@code +} and {@code .} pop two operands and push their
 * union and concatenation, {@code *} pops one and pushes its star. Whitespace
 * is ignored. Exactly one expression must be left at the end.
 */
public final class PostfixRegexParser {

  private PostfixRegexParser() {
  }

  public static Regex parse(String input) throws RegexSyntaxException {
    return parse(RegexTreeBuilder.INSTANCE, input);
  }

  public static <R> R parse(RegexVisitor<R> visitor, String input) throws RegexSyntaxException {
    final Deque<R> stack = new ArrayDeque<>();
    for (int position = 0; position < input.length(); position++) {
      final char c = input.charAt(position);
      if (Character.isWhitespace(c)) {
        continue;
      }
      switch (c) {
        case '0':
          stack.push(visitor.visitEmptyLanguage());
          break;
        case '1':
          stack.push(visitor.visitEmptyString());
          break;
        case '*':
          requireOperands(stack, 1, input, position);
          stack.push(visitor.visitStar(stack.pop()));
          break;
        case '+':
        case '.': {
          requireOperands(stack, 2, input, position);
          final R second = stack.pop();
          final R first = stack.pop();
          final List<R> operands = List.of(first, second);
          stack.push(c == '+' ? visitor.visitUnion(operands) : visitor.visitConcat(operands));
          break;
        }
        default:
          if (!Character.isLetter(c)) {
            throw new RegexSyntaxException("Unexpected character '" + c + "'", input, position);
          }
          stack.push(visitor.visitLetter(c));
      }
    }
    if (stack.size() != 1) {
      throw new RegexSyntaxException(
        "Expected exactly one expression, found " + stack.size(),
        input,
        input.length()
      );
    }
    return stack.pop();
  }

  private static void requireOperands(Deque<?> stack, int count, String input, int position) {
    if (stack.size() < count) {
      throw new RegexSyntaxException("Not enough operands on the stack", input, position);
    }
  }
}
