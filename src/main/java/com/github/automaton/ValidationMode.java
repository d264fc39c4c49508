package com.github.automaton;

/**
 * How thoroughly an automaton definition is checked before it is used.
 */
public enum ValidationMode {
  // membership of q0, F and every delta key and value in Q and Sigma
  STRUCTURAL,
  // structural checks plus determinism and totality of delta over Q x Sigma
  STRICT;
}
