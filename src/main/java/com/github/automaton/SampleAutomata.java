package com.github.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The bundled worked examples.
 */
public final class SampleAutomata {

  public static final List<String> ENDS_IN_01_WORDS =
      Collections.unmodifiableList(Arrays.asList("01", "001", "101", "1101", "10", "11", "00"));

  public static final List<String> EVEN_A_WORDS = Collections
      .unmodifiableList(Arrays.asList("", "a", "aa", "ab", "ba", "aba", "aab", "baba"));

  /**
   * Binary strings ending in "01".
   */
  public static AutomatonDefinition endsIn01() throws ValidationException {
    return AutomatonDefinition.newBuilder().states("q0", "q1", "q2").alphabet('0', '1')
        .initialState("q0").acceptingStates("q2")
        .transition("q0", '0', "q1").transition("q0", '1', "q0")
        .transition("q1", '0', "q1").transition("q1", '1', "q2")
        .transition("q2", '0', "q1").transition("q2", '1', "q0")
        .build();
  }

  /**
   * Strings over {a, b} with an even number of 'a'.
   */
  public static AutomatonDefinition evenNumberOfA() throws ValidationException {
    return AutomatonDefinition.newBuilder().states("par", "impar").alphabet('a', 'b')
        .initialState("par").acceptingStates("par")
        .transition("par", 'a', "impar").transition("par", 'b', "par")
        .transition("impar", 'a', "par").transition("impar", 'b', "impar")
        .build();
  }

  private SampleAutomata() {}
}
