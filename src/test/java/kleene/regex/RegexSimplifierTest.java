package kleene.regex;

import java.util.List;

import kleene.parser.RegexParser;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class RegexSimplifierTest {

  @ParameterizedTest
  @CsvSource({
    "a0b,           0",
    "a1b,           ab",
    "1,             1",
    "11,            1",
    "0*,            1",
    "1*,            1",
    "a+0,           a",
    "0+0,           0",
    "a+b+a,         a+b",
    "(a+b)+(c+a),   a+b+c",
    "a(bc)d,        abcd",
    "(a+0)^2*,      (aa)*",
    "(a1)*,         a*",
    "a^0,           1",
    "(0+1)(a+0),    a"
  })
  void simplify(String text, String simplified) {
    Assertions.assertEquals(simplified, RegexPrinter.print(RegexSimplifier.simplify(RegexParser.parse(text))));
  }

  @Test
  void emptyNodesCollapse() {
    Assertions.assertEquals(Regex.ONE, RegexSimplifier.simplify(new Regex.Concat(List.of())));
    Assertions.assertEquals(Regex.ZERO, RegexSimplifier.simplify(new Regex.Union(List.of())));
  }

  @Test
  void preservesLanguage() {
    for (String text : List.of("(a+0)^2*", "a(1+b)*0+c", "((a+b)c + a(ba)* (b+ac))*", "(1+a)(b+1)^3")) {
      final Regex regex = RegexParser.parse(text);
      final Regex simplified = RegexSimplifier.simplify(regex);
      for (String word : List.of("", "a", "aa", "ab", "ac", "abc", "bc", "abab", "acac", "bbb", "abbb")) {
        Assertions.assertEquals(
          ReferencePattern.matches(regex, word),
          ReferencePattern.matches(simplified, word),
          text + " on '" + word + "'"
        );
      }
    }
  }
}
