package kleene.graph;

import java.util.List;

import kleene.regex.Regex;
import kleene.regex.RegexVisitor;

/**
 * Thompson-style construction of an epsilon-NFA from a regex.
 *
 * Each sub-expression becomes a small automaton over exactly the letters it
 * mentions, and the combinators of {@link AutomatonOps} glue them together
 * with epsilon edges.
 */
public final class RegexAutomatonBuilder implements RegexVisitor<Automaton> {

  public static final RegexAutomatonBuilder INSTANCE = new RegexAutomatonBuilder();

  private RegexAutomatonBuilder() {
  }

  /**
   * Automaton accepting the language of a regex.
   *
   * @param regex regular expression
   * @return epsilon-NFA whose alphabet is the set of letters in the regex
   */
  public static Automaton build(Regex regex) {
    return regex.accept(INSTANCE);
  }

  @Override
  public Automaton visitLetter(char symbol) {
    final var result = new Automaton(Alphabet.of(String.valueOf(symbol)));
    final int end = result.makeNode(true);
    result.link(result.start(), end, String.valueOf(symbol));
    return result;
  }

  @Override
  public Automaton visitEmptyLanguage() {
    return new Automaton(Alphabet.EMPTY);
  }

  @Override
  public Automaton visitEmptyString() {
    final var result = new Automaton(Alphabet.EMPTY);
    result.setTerminal(result.start(), true);
    return result;
  }

  @Override
  public Automaton visitConcat(List<Automaton> children) {
    return AutomatonOps.concat(children);
  }

  @Override
  public Automaton visitUnion(List<Automaton> children) {
    return AutomatonOps.union(children);
  }

  @Override
  public Automaton visitStar(Automaton child) {
    return AutomatonOps.star(child);
  }
}
