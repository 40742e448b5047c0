package kleene.regex;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Longest run of a single letter at the end of the words of a regex.
 *
 * <p>For each sub-expression two quantities are tracked: the longest suffix
 * made only of the letter that some word can end with, and (if some word is
 * made only of the letter) the longest such word. Both may be infinite, when a
 * starred sub-expression can produce the letter.
 */
public final class SuffixAnalysis implements RegexVisitor<SuffixAnalysis.Lengths> {

  /**
   * @param suffix longest letter-only suffix of some word
   * @param full longest word made only of the letter, if there is one
   */
  record Lengths(double suffix, OptionalDouble full) {

    /**
     * Lengths of the concatenation of some {@code prefix} with this.
     */
    Lengths after(Lengths prefix) {
      if (full.isEmpty()) {
        return this;
      }
      final double whole = full.getAsDouble();
      final OptionalDouble longestFull = prefix.full.isPresent()
        ? OptionalDouble.of(whole + prefix.full.getAsDouble())
        : OptionalDouble.empty();
      return new Lengths(Math.max(suffix, whole + prefix.suffix), longestFull);
    }
  }

  private final char letter;

  private SuffixAnalysis(char letter) {
    this.letter = letter;
  }

  /**
   * Longest letter-only suffix of a word of the language.
   *
   * @param regex expression to analyse
   * @param letter letter making up the suffix
   * @return longest suffix length, possibly {@link Double#POSITIVE_INFINITY}
   * @throws IllegalArgumentException if the expression has an empty language
   *   (or empty union) anywhere in it
   */
  public static double longestSuffix(Regex regex, char letter) {
    return regex.accept(new SuffixAnalysis(letter)).suffix();
  }

  /**
   * Check whether some word of the language ends with {@code letter^k}.
   *
   * @param regex expression to analyse
   * @param letter repeated letter
   * @param k number of repetitions
   */
  public static boolean hasSuffix(Regex regex, char letter, int k) {
    if (k < 0) {
      throw new IllegalArgumentException("Negative suffix length " + k);
    }
    return longestSuffix(regex, letter) >= k;
  }

  @Override
  public Lengths visitLetter(char symbol) {
    return symbol == letter
      ? new Lengths(1, OptionalDouble.of(1))
      : new Lengths(0, OptionalDouble.empty());
  }

  @Override
  public Lengths visitEmptyLanguage() {
    throw new IllegalArgumentException("Suffixes of the empty language are undefined");
  }

  @Override
  public Lengths visitEmptyString() {
    return new Lengths(0, OptionalDouble.of(0));
  }

  @Override
  public Lengths visitConcat(List<Lengths> children) {
    Lengths result = visitEmptyString();
    for (int i = children.size() - 1; i >= 0; i--) {
      result = result.after(children.get(i));
    }
    return result;
  }

  @Override
  public Lengths visitUnion(List<Lengths> children) {
    if (children.isEmpty()) {
      return visitEmptyLanguage();
    }
    double suffix = 0;
    OptionalDouble full = OptionalDouble.empty();
    for (Lengths child : children) {
      suffix = Math.max(suffix, child.suffix());
      if (child.full().isPresent()) {
        final double length = child.full().getAsDouble();
        full = OptionalDouble.of(Math.max(full.orElse(length), length));
      }
    }
    return new Lengths(suffix, full);
  }

  @Override
  public Lengths visitStar(Lengths child) {
    if (child.full().isEmpty()) {
      return new Lengths(child.suffix(), OptionalDouble.of(0));
    } else if (child.full().getAsDouble() > 0) {
      return new Lengths(Double.POSITIVE_INFINITY, OptionalDouble.of(Double.POSITIVE_INFINITY));
    } else {
      return child;
    }
  }
}
