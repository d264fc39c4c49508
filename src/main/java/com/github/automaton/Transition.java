package com.github.automaton;

import java.util.Objects;

import com.github.automaton.AutomatonException.Code;

/**
 * A single (from, symbol, to) triple of the transition function. This is the shape every loader
 * normalizes its file format into before the definition is built.
 */
public final class Transition {
  private final String fromState;
  private final char symbol;
  private final String toState;

  public Transition(final String fromState, final char symbol, final String toState) {
    this.fromState = Objects.requireNonNull(fromState, "fromState");
    this.symbol = symbol;
    this.toState = Objects.requireNonNull(toState, "toState");
  }

  /**
   * Builds a triple out of plain labels, as read from a file or typed by a user. The symbol label
   * has to be exactly one {@code char}. Symbols outside the Basic Multilingual Plane take two chars
   * in a Java string and are refused with {@link Code#INVALID_SYMBOL}.
   */
  public static Transition of(final String fromState, final String symbol, final String toState)
      throws ValidationException {
    return new Transition(fromState, toSymbol(symbol), toState);
  }

  static char toSymbol(final String label) throws ValidationException {
    if (label != null && label.length() == 2 && Character.isSurrogatePair(label.charAt(0),
        label.charAt(1))) {
      throw new ValidationException(Code.INVALID_SYMBOL, "Symbol '" + label
          + "' lies outside the Basic Multilingual Plane, only single-char symbols are supported");
    }
    if (label == null || label.length() != 1) {
      throw new ValidationException(Code.INVALID_SYMBOL,
          "Symbol must be exactly one character, got '" + label + "'");
    }
    return label.charAt(0);
  }

  public String getFromState() {
    return fromState;
  }

  public char getSymbol() {
    return symbol;
  }

  public String getToState() {
    return toState;
  }

  public TransitionKey key() {
    return TransitionKey.of(fromState, symbol);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition other = (Transition) obj;
    return symbol == other.symbol && fromState.equals(other.fromState)
        && toState.equals(other.toState);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, symbol, toState);
  }

  @Override
  public String toString() {
    return "δ(" + fromState + ", " + symbol + ") = " + toState;
  }
}
