package com.github.automaton;

import java.util.Objects;

/**
 * One step of a derivation: the state the automaton was in, the symbol it consumed and the state
 * it moved to.
 */
public final class DerivationStep {
  private final String fromState;
  private final char symbol;
  private final String toState;

  public DerivationStep(final String fromState, final char symbol, final String toState) {
    this.fromState = fromState;
    this.symbol = symbol;
    this.toState = toState;
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

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof DerivationStep)) {
      return false;
    }
    DerivationStep other = (DerivationStep) obj;
    return symbol == other.symbol && Objects.equals(fromState, other.fromState)
        && Objects.equals(toState, other.toState);
  }

  @Override
  public int hashCode() {
    return Objects.hash(fromState, symbol, toState);
  }

  @Override
  public String toString() {
    return "(" + fromState + ", " + symbol + ", " + toState + ")";
  }
}
