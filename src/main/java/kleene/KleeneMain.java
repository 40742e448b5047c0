package kleene;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

import kleene.codegen.Acceptor;
import kleene.codegen.CompiledAcceptor;
import kleene.graph.Automaton;
import kleene.graph.AutomatonText;
import kleene.graph.DotGraph;
import kleene.graph.Minimizer;
import kleene.graph.RegexAutomatonBuilder;
import kleene.graph.StateElimination;
import kleene.parser.RegexParser;
import kleene.parser.RegexSyntaxException;
import kleene.regex.Regex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <pre>
 *   kleene dot &lt;regex&gt;                minimal DFA as DOT source
 *   kleene text &lt;regex&gt;               minimal DFA in the text format
 *   kleene regex &lt;regex&gt;              regex rebuilt from its automaton
 *   kleene accepts &lt;regex&gt; &lt;word&gt;...   membership of each word
 * </pre>
 */
public final class KleeneMain {

  private static final Logger log = LoggerFactory.getLogger(KleeneMain.class);

  static final int EXIT_OK = 0;
  static final int EXIT_INVALID_REGEX = 1;
  static final int EXIT_USAGE = 2;

  private static final String USAGE = String.join(
    "\n",
    "usage: kleene <command> <regex> [<word>...]",
    "",
    "commands:",
    "  dot <regex>               print the minimal DFA as DOT source",
    "  text <regex>              print the minimal DFA in the text format",
    "  regex <regex>             print the regex rebuilt from its automaton",
    "  accepts <regex> <word>... print whether each word is accepted"
  );

  private KleeneMain() {
  }

  public static void main(String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  /**
   * Run a command.
   *
   * @param args command line arguments
   * @param out where results are printed
   * @param err where usage and errors are printed
   * @return process exit code
   */
  static int run(String[] args, PrintStream out, PrintStream err) {
    if (args.length < 2) {
      err.println(USAGE);
      return EXIT_USAGE;
    }

    final String command = args[0];
    final List<String> words = Arrays.asList(args).subList(2, args.length);
    if (!List.of("dot", "text", "regex", "accepts").contains(command)) {
      err.println("unknown command: " + command);
      err.println(USAGE);
      return EXIT_USAGE;
    }
    if (command.equals("accepts") && words.isEmpty()) {
      err.println("missing words to check");
      err.println(USAGE);
      return EXIT_USAGE;
    }
    if (!command.equals("accepts") && !words.isEmpty()) {
      err.println("unexpected arguments: " + String.join(" ", words));
      err.println(USAGE);
      return EXIT_USAGE;
    }

    final Regex regex;
    try {
      regex = RegexParser.parse(args[1]);
    } catch (RegexSyntaxException e) {
      err.println(e.getMessage());
      return EXIT_INVALID_REGEX;
    }
    log.debug("Running '{}' on {}", command, regex);

    final Automaton automaton = RegexAutomatonBuilder.build(regex);
    switch (command) {
      case "dot":
        out.print(DotGraph.render(args[1], Minimizer.minimize(automaton)));
        break;
      case "text":
        out.print(AutomatonText.write(Minimizer.minimize(automaton)));
        break;
      case "regex":
        out.println(StateElimination.toRegex(automaton));
        break;
      default:
        final Acceptor acceptor = CompiledAcceptor.compile(automaton);
        for (String word : words) {
          out.println(word + ": " + acceptor.accepts(word));
        }
    }
    return EXIT_OK;
  }
}
