package com.github.automaton;

import java.util.Optional;

import com.github.automaton.AutomatonException.Code;

/**
 * Applies delta to a single (state, symbol) pair. This is the only place that decides what state
 * comes next; it never substitutes a default successor.
 */
public final class TransitionEngine {
  private static final TransitionEngine instance = new TransitionEngine();

  public static TransitionEngine getInstance() {
    return instance;
  }

  /**
   * Returns delta(state, symbol).
   *
   * @throws TransitionException with {@link Code#UNKNOWN_STATE} if state is not in Q,
   *         {@link Code#UNKNOWN_SYMBOL} if symbol is not in Sigma and {@link Code#MISSING_TRANSITION}
   *         if delta has no entry for the pair
   */
  public String transition(final AutomatonDefinition definition, final String state,
      final char symbol) throws TransitionException {
    if (!definition.hasState(state)) {
      throw new TransitionException(Code.UNKNOWN_STATE, state, symbol);
    }
    if (!definition.hasSymbol(symbol)) {
      throw new TransitionException(Code.UNKNOWN_SYMBOL, state, symbol);
    }
    final Optional<String> next = definition.lookup(state, symbol);
    if (!next.isPresent()) {
      throw new TransitionException(Code.MISSING_TRANSITION, state, symbol);
    }
    return next.get();
  }

  private TransitionEngine() {}
}
