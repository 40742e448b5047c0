package kleene.codegen;

/**
 * Compiled membership test for a regular language.
 */
public interface Acceptor {

  /**
   * Check whether the whole input is in the language.
   *
   * @param input word to check
   * @return whether the word is accepted
   */
  boolean accepts(CharSequence input);
}
