package dev.slox;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class SloxTest {
  @TempDir Path directory;

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;
  private CommandLine commandLine;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    commandLine = new CommandLine(new Slox(
        new PrintStream(out, /* autoFlush: */ true, StandardCharsets.UTF_8),
        new PrintStream(err, /* autoFlush: */ true, StandardCharsets.UTF_8)
    ));
  }

  private Path script(String source) throws IOException {
    Path path = directory.resolve("script.slox");
    Files.write(path, source.getBytes(StandardCharsets.UTF_8));
    return path;
  }

  private String stdout() { return out.toString(StandardCharsets.UTF_8); }

  private String stderr() { return err.toString(StandardCharsets.UTF_8); }

  @Test
  void commandIsNamedAfterTheLanguage() {
    assertEquals("slox", commandLine.getCommandName());
  }

  @Test
  void runsAScript() throws IOException {
    Path path = script("var x = 1;\nprint x + 1;\nprint \"done\";\n");

    int exitCode = commandLine.execute(path.toString());

    assertEquals(Slox.EXIT_OK, exitCode);
    assertEquals(String.format("2%ndone%n"), stdout());
    assertEquals("", stderr());
  }

  @Test
  void reportsEverySyntaxErrorAndRunsNothing() throws IOException {
    Path path = script("print \"before\";\n1 + ;\nprint (2;\n");

    int exitCode = commandLine.execute(path.toString());

    assertEquals(Slox.EXIT_DATA_ERROR, exitCode);
    assertEquals("", stdout());
    assertEquals(
        String.format(
            "[2]: expected expression, found ';'\n"
            + "[3]: expected ')' after expression, found ';'%n"
        ),
        stderr()
    );
  }

  @Test
  void reportsScanErrors() throws IOException {
    Path path = script("print 1;\nvar a = @;\n");

    int exitCode = commandLine.execute(path.toString());

    assertEquals(Slox.EXIT_DATA_ERROR, exitCode);
    assertThat(stderr(), startsWith("[2]: unexpected character: @"));
  }

  @Test
  void stopsAtTheFirstRuntimeError() throws IOException {
    Path path = script("print 1;\nprint nope;\nprint 3;\n");

    int exitCode = commandLine.execute(path.toString());

    assertEquals(Slox.EXIT_SOFTWARE, exitCode);
    assertEquals(String.format("1%n"), stdout());
    assertEquals(String.format("[2]: undefined variable: nope%n"), stderr());
  }

  @Test
  void complainsAboutMissingScripts() {
    int exitCode =
        commandLine.execute(directory.resolve("missing.slox").toString());

    assertEquals(Slox.EXIT_NO_INPUT, exitCode);
    assertThat(stderr(), containsString("could not read"));
  }

  @Test
  void canPrintTheTreeBeforeRunning() throws IOException {
    Path path = script("print 1 + 2;\nprint 4;");

    int exitCode = commandLine.execute("--debug-ast", path.toString());

    assertEquals(Slox.EXIT_OK, exitCode);
    assertEquals(
        String.format("print\n        1\n    +\n        2\n3%nprint\n    4\n4%n"),
        stdout()
    );
  }

  @Test
  void noTreeIsPrintedAfterARuntimeError() throws IOException {
    Path path = script("print 1;\nprint -nil;\nprint 3;");

    int exitCode = commandLine.execute("--debug-ast", path.toString());

    assertEquals(Slox.EXIT_SOFTWARE, exitCode);
    assertEquals(
        String.format("print\n    1\n1%nprint\n    -\n        nil\n"),
        stdout()
    );
    assertEquals(
        String.format("[2]: - can only be applied to numbers%n"), stderr()
    );
  }
}
