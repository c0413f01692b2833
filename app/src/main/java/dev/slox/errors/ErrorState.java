package dev.slox.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Errors collected by one phase of the pipeline.
 *
 * <p>Scanning and parsing keep going after an error so they can report as
 * many as possible; their states accumulate. A runtime state is created with
 * its one error and can't take more.
 */
public class ErrorState {
  public enum Kind { SCAN, PARSE, RUNTIME }

  private final Kind kind;
  private final List<Diagnostic> diagnostics = new ArrayList<>();

  private ErrorState(Kind kind) { this.kind = kind; }

  public static ErrorState scanErrors() { return new ErrorState(Kind.SCAN); }

  public static ErrorState parseErrors() { return new ErrorState(Kind.PARSE); }

  public static ErrorState runtimeError(Diagnostic diagnostic) {
    ErrorState state = new ErrorState(Kind.RUNTIME);
    state.diagnostics.add(diagnostic);
    return state;
  }

  public void add(Diagnostic diagnostic) {
    if (kind == Kind.RUNTIME) {
      throw new IllegalStateException(
          "a runtime error state holds exactly one error"
      );
    }
    diagnostics.add(diagnostic);
  }

  public void add(String message, int line) {
    add(new Diagnostic(message, line));
  }

  public Kind kind() { return kind; }

  public boolean isEmpty() { return diagnostics.isEmpty(); }

  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }

  // one line per error, in the order they were recorded
  public String render() {
    return diagnostics.stream()
        .map(Diagnostic::toString)
        .collect(Collectors.joining("\n"));
  }

  @Override
  public String toString() {
    return render();
  }
}
