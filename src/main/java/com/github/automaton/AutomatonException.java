package com.github.automaton;

/**
 * Unified coded exception for everything that can go wrong while defining, loading or running an
 * automaton. The code enum encapsulates the various error conditions; the subclasses only exist so
 * callers can catch validation problems separately from simulation problems.
 */
public class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomatonException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Category {
    VALIDATION, TRANSITION, LOADING;
  }

  public static enum Code {
    // 1.
    EMPTY_STATES(Category.VALIDATION, "Set of states cannot be empty"),
    // 2.
    EMPTY_ALPHABET(Category.VALIDATION, "Alphabet cannot be empty"),
    // 3.
    UNKNOWN_INITIAL_STATE(Category.VALIDATION, "Initial state is not a member of the states"),
    // 4.
    UNKNOWN_ACCEPTING_STATE(Category.VALIDATION, "Accepting state is not a member of the states"),
    // 5.
    INVALID_TRANSITION_DOMAIN(Category.VALIDATION,
        "Transition is keyed on a state or symbol outside of the automaton"),
    // 6.
    INVALID_TRANSITION_TARGET(Category.VALIDATION,
        "Transition leads to a state outside of the automaton"),
    // 7.
    INVALID_SYMBOL(Category.VALIDATION, "Symbol must be exactly one character"),
    // 8.
    NONDETERMINISTIC_TRANSITION(Category.VALIDATION,
        "A (state, symbol) pair was mapped to more than one successor"),
    // 9.
    INCOMPLETE_TRANSITION_FUNCTION(Category.VALIDATION,
        "Transition function is not defined for every (state, symbol) pair"),
    // 10.
    INVALID_CONFIGURATION(Category.VALIDATION, "Simulator configuration is invalid"),
    // 11.
    UNKNOWN_STATE(Category.TRANSITION, "State is not a member of the automaton"),
    // 12.
    UNKNOWN_SYMBOL(Category.TRANSITION, "Symbol is not a member of the alphabet"),
    // 13.
    MISSING_TRANSITION(Category.TRANSITION,
        "The automaton is not defined for this (state, symbol) pair"),
    // 14.
    MALFORMED_DEFINITION(Category.LOADING,
        "Automaton definition could not be read. Check exception stacktrace for details.");

    private final Category category;
    private final String description;

    private Code(final Category category, final String description) {
      this.category = category;
      this.description = description;
    }

    public Category getCategory() {
      return category;
    }

    public String getDescription() {
      return description;
    }
  }

}
