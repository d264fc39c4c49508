package com.github.automaton;

import java.util.Objects;

/**
 * Composite (state, symbol) key of the transition table.
 */
public final class TransitionKey {
  private final String state;
  private final char symbol;

  private TransitionKey(final String state, final char symbol) {
    this.state = state;
    this.symbol = symbol;
  }

  public static TransitionKey of(final String state, final char symbol) {
    return new TransitionKey(Objects.requireNonNull(state, "state"), symbol);
  }

  public String getState() {
    return state;
  }

  public char getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionKey)) {
      return false;
    }
    TransitionKey key = (TransitionKey) o;
    return symbol == key.symbol && state.equals(key.state);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, symbol);
  }

  @Override
  public String toString() {
    return "(" + state + ", " + symbol + ")";
  }
}
