package kleene.regex;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cheap algebraic clean-up of a regex, applied bottom-up.
 *
 * <ul>
 *   <li>a concatenation containing {@code 0} is {@code 0}</li>
 *   <li>concatenations drop {@code 1} and absorb nested concatenations</li>
 *   <li>unions drop {@code 0}, absorb nested unions and duplicates</li>
 *   <li>{@code 0*} and {@code 1*} are {@code 1}</li>
 *   <li>an empty or single-child concatenation or union collapses</li>
 * </ul>
 *
 * The result denotes the same language as the input.
 */
public final class RegexSimplifier implements RegexVisitor<Regex> {

  private static final RegexSimplifier INSTANCE = new RegexSimplifier();

  private RegexSimplifier() {
  }

  public static Regex simplify(Regex regex) {
    return regex.accept(INSTANCE);
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
    final List<Regex> flattened = new ArrayList<>();
    for (Regex child : children) {
      if (child instanceof Regex.EmptyLanguage) {
        return Regex.ZERO;
      } else if (child instanceof Regex.Concat concat) {
        flattened.addAll(concat.children());
      } else if (!(child instanceof Regex.EmptyString)) {
        flattened.add(child);
      }
    }
    switch (flattened.size()) {
      case 0:
        return Regex.ONE;
      case 1:
        return flattened.get(0);
      default:
        return new Regex.Concat(flattened);
    }
  }

  @Override
  public Regex visitUnion(List<Regex> children) {
    final Set<Regex> flattened = new LinkedHashSet<>();
    for (Regex child : children) {
      if (child instanceof Regex.Union union) {
        flattened.addAll(union.children());
      } else if (!(child instanceof Regex.EmptyLanguage)) {
        flattened.add(child);
      }
    }
    switch (flattened.size()) {
      case 0:
        return Regex.ZERO;
      case 1:
        return flattened.iterator().next();
      default:
        return new Regex.Union(new ArrayList<>(flattened));
    }
  }

  @Override
  public Regex visitStar(Regex child) {
    if (child instanceof Regex.EmptyLanguage || child instanceof Regex.EmptyString) {
      return Regex.ONE;
    }
    return new Regex.Star(child);
  }
}
