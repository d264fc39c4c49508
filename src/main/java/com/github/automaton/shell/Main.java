package com.github.automaton.shell;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;

import com.github.automaton.Simulator.SimulatorBuilder;

/**
 * Console entry point for the {@link AutomatonShell}.
 */
public final class Main {

  public static void main(String args[]) {
    final BufferedReader in =
        new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
    new AutomatonShell(in, System.out, Paths.get("").toAbsolutePath(),
        SimulatorBuilder.newBuilder().build()).run();
  }

  private Main() {}
}
