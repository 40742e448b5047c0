package kleene.regex;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Regular expression AST.
 *
 * <p>Nodes are immutable and compared structurally, so two expressions are
 * equal exactly when they have the same shape (not when they denote the same
 * language). {@code toString} renders the usual textual syntax.
 */
public sealed interface Regex {

  EmptyLanguage ZERO = new EmptyLanguage();
  EmptyString ONE = new EmptyString();

  /**
   * Traverse the expression bottom-up.
   *
   * @param visitor what to compute at each node
   * @return result of the visitor at the root
   */
  <R> R accept(RegexVisitor<R> visitor);

  /**
   * The expression repeated a fixed number of times.
   *
   * @param times number of copies, zero giving the empty string
   * @return concatenation of {@code times} copies
   */
  default Regex repeat(int times) {
    if (times < 0) {
      throw new IllegalArgumentException("Negative repetition count " + times);
    }
    return new Concat(Collections.nCopies(times, this));
  }

  static Regex letter(char symbol) {
    return new Letter(symbol);
  }

  static Regex concat(Regex... children) {
    return new Concat(List.of(children));
  }

  static Regex union(Regex... children) {
    return new Union(List.of(children));
  }

  static Regex star(Regex child) {
    return new Star(child);
  }

  record Letter(char symbol) implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitLetter(symbol);
    }

    @Override
    public String toString() {
      return RegexPrinter.print(this);
    }
  }

  record EmptyLanguage() implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitEmptyLanguage();
    }

    @Override
    public String toString() {
      return RegexPrinter.print(this);
    }
  }

  record EmptyString() implements Regex {
    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitEmptyString();
    }

    @Override
    public String toString() {
      return RegexPrinter.print(this);
    }
  }

  record Concat(List<Regex> children) implements Regex {
    public Concat {
      children = List.copyOf(children);
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitConcat(
        children.stream().map(child -> child.accept(visitor)).collect(Collectors.toList())
      );
    }

    @Override
    public String toString() {
      return RegexPrinter.print(this);
    }
  }

  record Union(List<Regex> children) implements Regex {
    public Union {
      children = List.copyOf(children);
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitUnion(
        children.stream().map(child -> child.accept(visitor)).collect(Collectors.toList())
      );
    }

    @Override
    public String toString() {
      return RegexPrinter.print(this);
    }
  }

  record Star(Regex child) implements Regex {
    public Star {
      if (child == null) {
        throw new NullPointerException("star operand");
      }
    }

    @Override
    public <R> R accept(RegexVisitor<R> visitor) {
      return visitor.visitStar(child.accept(visitor));
    }

    @Override
    public String toString() {
      return RegexPrinter.print(this);
    }
  }
}
