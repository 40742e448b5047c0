package kleene;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import kleene.graph.Automaton;
import kleene.graph.AutomatonText;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class KleeneMainTest {

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  private int run(String... args) {
    return KleeneMain.run(
      args,
      new PrintStream(out, true, StandardCharsets.UTF_8),
      new PrintStream(err, true, StandardCharsets.UTF_8)
    );
  }

  private String out() {
    return out.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  void accepts() {
    Assertions.assertEquals(KleeneMain.EXIT_OK, run("accepts", "a*b", "aab", "ba", "b"));
    Assertions.assertEquals(
      String.join(System.lineSeparator(), "aab: true", "ba: false", "b: true", ""),
      out()
    );
    Assertions.assertEquals("", err());
  }

  @Test
  void regex() {
    Assertions.assertEquals(KleeneMain.EXIT_OK, run("regex", "a"));
    Assertions.assertEquals("a", out().strip());
  }

  @Test
  void text() {
    Assertions.assertEquals(KleeneMain.EXIT_OK, run("text", "(a+b)*b"));
    final Automaton automaton = AutomatonText.read(out());
    Assertions.assertEquals(2, automaton.size());
    Assertions.assertTrue(automaton.accepts("abb"));
    Assertions.assertFalse(automaton.accepts("ba"));
  }

  @Test
  void dot() {
    Assertions.assertEquals(KleeneMain.EXIT_OK, run("dot", "ab"));
    Assertions.assertTrue(out().startsWith("digraph \"ab\" {\n"));
    Assertions.assertTrue(out().contains("doublecircle"));
  }

  @Test
  void invalidRegex() {
    Assertions.assertEquals(KleeneMain.EXIT_INVALID_REGEX, run("dot", "a+"));
    Assertions.assertTrue(err().contains("Unexpected end of the regular expression"));
    Assertions.assertEquals("", out());
  }

  @Test
  void usageErrors() {
    Assertions.assertEquals(KleeneMain.EXIT_USAGE, run());
    Assertions.assertEquals(KleeneMain.EXIT_USAGE, run("dot"));
    Assertions.assertEquals(KleeneMain.EXIT_USAGE, run("draw", "a"));
    Assertions.assertEquals(KleeneMain.EXIT_USAGE, run("accepts", "a"));
    Assertions.assertEquals(KleeneMain.EXIT_USAGE, run("regex", "a", "b"));
    Assertions.assertTrue(err().contains("usage: kleene"));
    Assertions.assertEquals("", out());
  }
}
