package kleene.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Malformed regular expression text.
 *
 * Carries the description of the problem, the whole pattern and the index in
 * the pattern where the problem was found.
 */
public class RegexSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = -3412875541037395212L;

  public RegexSyntaxException(String description, String regex, int index) {
    super(description, regex, index);
  }
}
