package dev.slox.errors;

// Thrown when a phase of the pipeline finishes with errors.
public class SloxException extends RuntimeException {
  public final ErrorState state;

  public SloxException(ErrorState state) {
    super(state.render());
    this.state = state;
  }
}
