package com.github.automaton;

/**
 * Wraps the first {@link TransitionException} hit by a simulator operation. The code mirrors the
 * wrapped error so callers can switch on it directly.
 */
public final class SimulationException extends AutomatonException {
  private static final long serialVersionUID = 1L;
  private final TransitionException transitionError;

  public SimulationException(final TransitionException transitionError) {
    super(transitionError.getCode(), transitionError.getMessage(), transitionError);
    this.transitionError = transitionError;
  }

  public TransitionException getTransitionError() {
    return transitionError;
  }
}
