package kleene.codegen;

import java.util.List;

import kleene.graph.Alphabet;
import kleene.graph.Automata;
import kleene.graph.Automaton;
import kleene.graph.RegexAutomatonBuilder;
import kleene.parser.RegexParser;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.objectweb.asm.MethodTooLargeException;

public class CompiledAcceptorTest {

  private static void assertAgrees(Automaton automaton, Acceptor acceptor, String alphabet, int maxLength) {
    for (String word : Automata.words(alphabet, maxLength)) {
      Assertions.assertEquals(
        automaton.accepts(word),
        acceptor.accepts(word),
        () -> "Compiled acceptor disagrees on '" + word + "'"
      );
    }
  }

  @Test
  void fixtures() {
    for (Automaton automaton : List.of(Automata.onlyAs(), Automata.parity(), Automata.countsAgreeMod3())) {
      assertAgrees(automaton, CompiledAcceptor.compile(automaton), "ab", 7);
    }
  }

  @ParameterizedTest
  @ValueSource(longs = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10})
  void randomAutomata(long seed) {
    final Automaton automaton = Automata.random(seed, "abc", 5, 10);
    assertAgrees(automaton, CompiledAcceptor.compile(automaton), "abc", 5);
  }

  @ParameterizedTest
  @ValueSource(strings = {"0", "1", "a*b", "(a+b)^3", "((a+b)c + a(ba)* (b+ac))*", "(acb + b(abc)* (ab+ba))*a"})
  void regexes(String text) {
    final Automaton automaton = RegexAutomatonBuilder.build(RegexParser.parse(text));
    assertAgrees(automaton, CompiledAcceptor.compile(automaton), "abc", 6);
  }

  @Test
  void symbolsOutsideTheAlphabetAreRejected() {
    final Acceptor acceptor = CompiledAcceptor.compile(Automata.onlyAs());
    Assertions.assertTrue(acceptor.accepts("aaa"));
    Assertions.assertFalse(acceptor.accepts("aza"));
    Assertions.assertFalse(acceptor.accepts("\u0000"));
    Assertions.assertFalse(acceptor.accepts("A"));
  }

  @Test
  void emptyAlphabet() {
    final var accepting = new Automaton(Alphabet.EMPTY);
    accepting.setTerminal(accepting.start(), true);
    final Acceptor acceptor = CompiledAcceptor.compile(accepting);
    Assertions.assertTrue(acceptor.accepts(""));
    Assertions.assertFalse(acceptor.accepts("a"));

    final Acceptor rejecting = CompiledAcceptor.compile(new Automaton(Alphabet.EMPTY));
    Assertions.assertFalse(rejecting.accepts(""));
  }

  @Test
  void acceptsAnyCharSequence() {
    final Acceptor acceptor = CompiledAcceptor.compile(Automata.onlyAs());
    Assertions.assertTrue(acceptor.accepts(new StringBuilder("aa")));
    Assertions.assertFalse(acceptor.accepts(new StringBuilder("ab")));
  }

  @Test
  void oversizedMethodIsReported() {
    // 150 states each switching over 200 symbols is past the 64KiB code limit
    final var symbols = new StringBuilder();
    for (char c = '\u0100'; c < '\u0100' + 200; c++) {
      symbols.append(c);
    }
    final var automaton = new Automaton(symbols.toString());
    for (int i = 1; i < 150; i++) {
      automaton.makeNode(i % 7 == 0);
    }
    for (int node : automaton.nodes()) {
      for (char symbol : automaton.alphabet()) {
        automaton.link(node, (node + symbol) % 150, String.valueOf(symbol));
      }
    }
    Assertions.assertTrue(automaton.isTotal());

    final var error = Assertions.assertThrows(
      IllegalStateException.class,
      () -> CompiledAcceptor.compile(automaton)
    );
    Assertions.assertInstanceOf(MethodTooLargeException.class, error.getCause());
  }

  @Test
  void sparseAndContiguousSymbols() {
    // "ace" takes a lookupswitch, "abc" a tableswitch
    for (String alphabet : List.of("ace", "abc", "a")) {
      final Automaton automaton = RegexAutomatonBuilder.build(RegexParser.parse(
        alphabet.length() == 1 ? "a*" : "(" + String.join("+", alphabet.split("")) + ")*" + alphabet.charAt(0)
      ));
      assertAgrees(automaton, CompiledAcceptor.compile(automaton), alphabet + "z", 5);
    }
  }
}
