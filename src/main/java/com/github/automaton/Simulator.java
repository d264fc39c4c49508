package com.github.automaton;

import java.util.Collection;
import java.util.List;

/**
 * Runs a deterministic finite automaton over whole input strings.
 *
 * Notes for users:<br>
 * 1. a simulator instance is stateless and thread-safe. The same instance can serve any number of
 * definitions and threads at once<br>
 *
 * 2. input strings are consumed left to right, one char per step. Cycles in delta are legal and
 * simply revisited<br>
 *
 * 3. a run that gets stuck (unknown state, unknown symbol, missing transition) is reported as a
 * {@link SimulationException} wrapping the underlying {@link TransitionException}. Getting stuck is
 * never conflated with rejection<br>
 *
 * 4. when the configuration asks for it, every operation re-validates the definition first and may
 * fail with a {@link ValidationException}<br>
 *
 * @see SimulatorBuilder
 */
public interface Simulator {

  /**
   * Returns the state reached from the given state after consuming all of the input. The empty
   * input returns the start state unchanged once its membership in Q is confirmed.
   */
  String finalState(final AutomatonDefinition definition, final String state, final String input)
      throws ValidationException, SimulationException;

  /**
   * {@link #finalState(AutomatonDefinition, String, String)} from the initial state.
   */
  String finalState(final AutomatonDefinition definition, final String input)
      throws ValidationException, SimulationException;

  /**
   * Returns one {@link DerivationStep} per consumed symbol in consumption order. All or nothing:
   * no partial trace is ever returned.
   */
  List<DerivationStep> derivation(final AutomatonDefinition definition, final String state,
      final String input) throws ValidationException, SimulationException;

  List<DerivationStep> derivation(final AutomatonDefinition definition, final String input)
      throws ValidationException, SimulationException;

  /**
   * Returns true iff the state reached after consuming the input is accepting.
   */
  boolean accepted(final AutomatonDefinition definition, final String state, final String input)
      throws ValidationException, SimulationException;

  /**
   * Same as {@link #accepted(AutomatonDefinition, String, String)} but checks membership in the
   * given accepting states instead of the definition's, for this call only. A null override falls
   * back to the definition's accepting states; an override naming states outside of Q is rejected.
   */
  boolean accepted(final AutomatonDefinition definition, final String state, final String input,
      final Collection<String> acceptingStatesOverride)
      throws ValidationException, SimulationException;

  boolean accepted(final AutomatonDefinition definition, final String input)
      throws ValidationException, SimulationException;

  /**
   * Returns the config that this simulator is wired with.
   */
  SimulatorConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build simulators.
   */
  public final static class SimulatorBuilder {
    private SimulatorConfiguration config;

    public static SimulatorBuilder newBuilder() {
      return new SimulatorBuilder();
    }

    public SimulatorBuilder config(final SimulatorConfiguration config) {
      this.config = config;
      return this;
    }

    public Simulator build() {
      return new SimulatorImpl(config == null ? SimulatorConfiguration.defaults() : config);
    }

    private SimulatorBuilder() {}
  }

}
