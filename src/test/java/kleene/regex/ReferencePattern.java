package kleene.regex;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translation of a regex into a {@code java.util.regex} pattern, used as an
 * independent reference for language checks.
 */
public final class ReferencePattern implements RegexVisitor<String> {

  private static final ReferencePattern INSTANCE = new ReferencePattern();

  private ReferencePattern() {
  }

  public static Pattern of(Regex regex) {
    return Pattern.compile(regex.accept(INSTANCE));
  }

  public static boolean matches(Regex regex, String word) {
    return of(regex).matcher(word).matches();
  }

  @Override
  public String visitLetter(char symbol) {
    return Pattern.quote(String.valueOf(symbol));
  }

  @Override
  public String visitEmptyLanguage() {
    return "(?!)";
  }

  @Override
  public String visitEmptyString() {
    return "(?:)";
  }

  @Override
  public String visitConcat(List<String> children) {
    return children.stream().map(c -> "(?:" + c + ")").collect(Collectors.joining("", "(?:", ")"));
  }

  @Override
  public String visitUnion(List<String> children) {
    if (children.isEmpty()) {
      return visitEmptyLanguage();
    }
    return children.stream().map(c -> "(?:" + c + ")").collect(Collectors.joining("|", "(?:", ")"));
  }

  @Override
  public String visitStar(String child) {
    return "(?:" + child + ")*";
  }
}
