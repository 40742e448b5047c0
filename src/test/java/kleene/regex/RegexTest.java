package kleene.regex;

import java.util.ArrayList;
import java.util.List;

import kleene.parser.RegexParser;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class RegexTest {

  private static final Regex A_BC_STAR_D = Regex.concat(
    Regex.letter('a'),
    Regex.star(Regex.union(Regex.letter('b'), Regex.letter('c'))),
    Regex.letter('d')
  );

  @Test
  void structuralEquality() {
    Assertions.assertEquals(A_BC_STAR_D, RegexParser.parse("a(b+c)*d"));
    Assertions.assertNotEquals(A_BC_STAR_D, RegexParser.parse("a((b+1)^2d)*"));
    Assertions.assertNotEquals(RegexParser.parse("a(b+c)*d"), RegexParser.parse("a((b+1)^2d)*"));

    // Same language, different shape
    Assertions.assertNotEquals(RegexParser.parse("a+b"), RegexParser.parse("b+a"));
  }

  @Test
  void repeat() {
    final Regex a = Regex.letter('a');
    Assertions.assertEquals(new Regex.Concat(List.of(a, a, a)), a.repeat(3));
    Assertions.assertEquals(new Regex.Concat(List.of()), a.repeat(0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> a.repeat(-1));
  }

  @Test
  void childrenAreImmutable() {
    final var concat = new Regex.Concat(new ArrayList<>(List.of(Regex.ONE)));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> concat.children().add(Regex.ZERO));
  }

  @Test
  void toStringPrints() {
    Assertions.assertEquals("a(b+c)*d", A_BC_STAR_D.toString());
  }
}
