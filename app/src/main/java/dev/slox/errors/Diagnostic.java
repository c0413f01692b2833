package dev.slox.errors;

import java.util.Objects;

// A single error message tied to the source line that produced it.
public class Diagnostic {
  public final String message;
  public final int line;

  public Diagnostic(String message, int line) {
    this.message = message;
    this.line = line;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other)
      return true;
    if (!(other instanceof Diagnostic))
      return false;
    Diagnostic that = (Diagnostic)other;
    return line == that.line && message.equals(that.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(message, line);
  }

  @Override
  public String toString() {
    return String.format("[%d]: %s", line, message);
  }
}
