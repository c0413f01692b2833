package dev.slox;

import dev.slox.errors.ErrorState;
import dev.slox.errors.SloxException;
import dev.slox.parsing.IndentedAstPrinter;
import dev.slox.parsing.Parser;
import dev.slox.parsing.Scanner;
import dev.slox.parsing.Stmt;
import dev.slox.parsing.Token;
import dev.slox.runtime.Interpreter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.jline.reader.Completer;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.AggregateCompleter;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "slox", mixinStandardHelpOptions = true, version = "slox 1.0",
    description = "Runs a slox script, or starts a REPL when none is given."
)
public class Slox implements Callable<Integer> {
  // exit codes, following sysexits.h
  static final int EXIT_OK = 0;
  static final int EXIT_DATA_ERROR = 65;
  static final int EXIT_NO_INPUT = 66;
  static final int EXIT_SOFTWARE = 70;

  private static final Logger logger = LoggerFactory.getLogger(Slox.class);

  @Parameters(
      index = "0", arity = "0..1", paramLabel = "FILE",
      description = "Script to run."
  )
  private Path script;

  @Option(
      names = {"--debug-ast"},
      description = "Print the syntax tree of every statement before running it."
  )
  private boolean debugAst;

  private final PrintStream out;
  private final PrintStream err;
  private final Interpreter interpreter;

  public Slox() { this(System.out, System.err); }

  Slox(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
    this.interpreter = new Interpreter(out);
  }

  public static void main(String[] args) {
    CommandLine commandLine = new CommandLine(new Slox());
    System.exit(commandLine.execute(args));
  }

  @Override
  public Integer call() throws IOException {
    if (script != null) {
      return runFile(script);
    }
    runPrompt();
    return EXIT_OK;
  }

  private int runFile(Path path) {
    String source;
    try {
      source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      logger.debug("failed to read {}", path, e);
      err.println(String.format("could not read %s: %s", path, e.getMessage()));
      return EXIT_NO_INPUT;
    }

    try {
      run(source, /* startingLine: */ 1);
      return EXIT_OK;
    } catch (SloxException e) {
      err.println(e.state.render());
      err.flush();
      return e.state.kind() == ErrorState.Kind.RUNTIME ? EXIT_SOFTWARE
                                                      : EXIT_DATA_ERROR;
    }
  }

  private void runPrompt() throws IOException {
    try (Terminal terminal = TerminalBuilder.builder().build()) {
      showBanner(terminal);

      LineReader reader = createReplReader(terminal);
      int lineNumber = 0;
      while (true) {
        try {
          String line = reader.readLine("> ");
          lineNumber++;
          line = line.trim();
          if (line.equals("quit"))
            break;

          if (line.isEmpty())
            continue;

          // bare expressions are fine at the prompt
          if (!line.endsWith(";")) {
            line += ";";
          }
          run(line, lineNumber);

        } catch (SloxException e) {
          // if the user makes a mistake, we don't kill the session
          terminal.writer().println(e.state.render());
          terminal.writer().flush();
        } catch (UserInterruptException e) {
          break;
        } catch (EndOfFileException e) {
          break;
        }
      }
      logger.debug("REPL session ended after {} lines", lineNumber);
    }
  }

  // Scans, parses and runs `source`; every phase throws a `SloxException`
  // when it fails, which also stops the phases after it.
  void run(String source, int startingLine) {
    List<Token> tokens = Scanner.scan(source, startingLine);
    List<Stmt> statements = new Parser(tokens).parse();

    if (!debugAst) {
      interpreter.interpret(statements);
      return;
    }

    // each tree is shown right before its statement runs, so nothing is
    // printed for statements after a runtime error
    IndentedAstPrinter printer = new IndentedAstPrinter();
    for (Stmt statement : statements) {
      out.print(printer.print(statement));
      interpreter.interpret(List.of(statement));
    }
  }

  private static void showBanner(Terminal terminal) {
    String banner =
        new AttributedStringBuilder()
            .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW))
            .style(AttributedStyle.BOLD)
            .append("slox")
            .style(AttributedStyle.DEFAULT)
            .append(" - type \"quit\" to quit (or use «ctrl-d»)")
            .toAnsi(terminal);
    terminal.writer().println(banner);
    terminal.writer().println("- Use «tab» for keyword completion");
    terminal.writer().println("- Use «ctrl-r» to search the history");
    terminal.writer().println();
    terminal.writer().flush();
  }

  private static LineReader createReplReader(Terminal terminal) {
    // provide completions (triggered via TAB) for all keywords
    Completer completer = new AggregateCompleter(
        new StringsCompleter("quit"),
        new StringsCompleter(Scanner.keywords.keySet())
    );

    return LineReaderBuilder.builder()
        .terminal(terminal)
        .parser(new DefaultParser())
        .completer(completer)
        .build();
  }
}
