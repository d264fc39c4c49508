package com.github.automaton;

/**
 * Raised when an automaton definition, an accepting-state override or a configuration is not
 * well-formed. Never recovered automatically; the caller has to fix the definition.
 */
public final class ValidationException extends AutomatonException {
  private static final long serialVersionUID = 1L;

  public ValidationException(final Code code) {
    super(code);
  }

  public ValidationException(final Code code, final String message) {
    super(code, message);
  }

  public ValidationException(final Code code, final String message, final Throwable throwable) {
    super(code, message, throwable);
  }
}
