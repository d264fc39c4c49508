package com.github.automaton;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import com.github.automaton.Simulator.SimulatorBuilder;

@State(Scope.Benchmark)
public class SimulatorBenchmark {
  private Simulator simulator;
  private AutomatonDefinition endsIn01;
  private String input;

  @Setup
  public void setUp() throws ValidationException {
    simulator = SimulatorBuilder.newBuilder().build();
    endsIn01 = SampleAutomata.endsIn01();
    final StringBuilder builder = new StringBuilder();
    for (int i = 0; i < 1024; i++) {
      builder.append(i % 3 == 0 ? '0' : '1');
    }
    input = builder.append("01").toString();
  }

  @Benchmark
  public boolean testAccepted() throws AutomatonException {
    return simulator.accepted(endsIn01, input);
  }

  @Benchmark
  public int testDerivation() throws AutomatonException {
    return simulator.derivation(endsIn01, input).size();
  }

  public static void main(String args[]) throws AutomatonException {
    SimulatorBenchmark benchmark = new SimulatorBenchmark();
    benchmark.setUp();
    benchmark.testAccepted();
    benchmark.testDerivation();
  }

}
