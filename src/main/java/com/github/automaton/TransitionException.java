package com.github.automaton;

/**
 * Raised by the {@link TransitionEngine} when delta cannot be applied. Carries the offending state
 * and symbol so callers can report exactly where the automaton is undefined.
 */
public final class TransitionException extends AutomatonException {
  private static final long serialVersionUID = 1L;
  private final String state;
  private final Character symbol;

  public TransitionException(final Code code, final String state, final Character symbol) {
    super(code, describe(code, state, symbol));
    this.state = state;
    this.symbol = symbol;
  }

  public String getState() {
    return state;
  }

  /**
   * Null when the state was rejected before any symbol was consumed.
   */
  public Character getSymbol() {
    return symbol;
  }

  private static String describe(final Code code, final String state,
      final Character symbol) {
    switch (code) {
      case UNKNOWN_STATE:
        return "Unknown state '" + state + "'";
      case UNKNOWN_SYMBOL:
        return "Symbol '" + symbol + "' is not in the alphabet";
      case MISSING_TRANSITION:
        return "No transition defined from " + state + " on symbol '" + symbol + "'";
      default:
        return code.getDescription();
    }
  }
}
