package com.github.automaton.shell;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonDefinition;
import com.github.automaton.AutomatonException;
import com.github.automaton.AutomatonException.Code;
import com.github.automaton.DerivationStep;
import com.github.automaton.SampleAutomata;
import com.github.automaton.SimulationException;
import com.github.automaton.Simulator;
import com.github.automaton.Transition;
import com.github.automaton.TransitionException;
import com.github.automaton.TransitionKey;
import com.github.automaton.ValidationException;
import com.github.automaton.loader.AutomatonFormat;
import com.github.automaton.loader.ExampleFileWriter;

/**
 * Interactive menu over the simulator: run the bundled examples, load or hand-build an automaton,
 * write the example files and test strings against the current automaton.
 *
 * Failures are printed and the menu carries on. End of input behaves like choosing exit.
 */
public final class AutomatonShell {
  private static final Logger logger = LogManager.getLogger(AutomatonShell.class.getSimpleName());

  private static final String RULE =
      "============================================================";

  private final BufferedReader in;
  private final PrintStream out;
  private final Path workingDirectory;
  private final Simulator simulator;

  private AutomatonDefinition current;

  public AutomatonShell(final BufferedReader in, final PrintStream out,
      final Path workingDirectory, final Simulator simulator) {
    this.in = in;
    this.out = out;
    this.workingDirectory = workingDirectory;
    this.simulator = simulator;
  }

  public AutomatonDefinition getCurrent() {
    return current;
  }

  public void run() {
    while (true) {
      out.println();
      out.println(RULE);
      out.println("          DETERMINISTIC FINITE AUTOMATON SIMULATOR");
      out.println(RULE);
      out.println("1. Run bundled examples");
      out.println("2. Load automaton from file");
      out.println("3. Build automaton manually");
      out.println("4. Write example files");
      if (current != null) {
        out.println("5. Test strings against the current automaton");
        out.println("6. Show the current automaton");
      }
      out.println("0. Exit");
      out.println(current != null ? "Current automaton loaded" : "No automaton loaded");

      final String option = trimmed(prompt("Select an option: "));
      if (option == null || option.equals("0")) {
        out.println("Goodbye!");
        return;
      }
      switch (option) {
        case "1":
          runExamples();
          break;
        case "2":
          loadFromFile();
          break;
        case "3":
          buildManually();
          break;
        case "4":
          writeExampleFiles();
          break;
        case "5":
          if (current != null) {
            testStrings(current);
            break;
          }
          out.println("Invalid option. Try again.");
          break;
        case "6":
          if (current != null) {
            out.println(current);
            break;
          }
          out.println("Invalid option. Try again.");
          break;
        default:
          out.println("Invalid option. Try again.");
      }
    }
  }

  void runExamples() {
    out.println("Which example?");
    out.println("1. Strings over {0,1} ending in '01'");
    out.println("2. Strings over {a,b} with an even number of 'a'");
    out.println("3. Both");
    final String option = trimmed(prompt("Select (1-3): "));
    if (option == null) {
      return;
    }
    try {
      switch (option) {
        case "1":
          runExample("Strings ending in '01'", SampleAutomata.endsIn01(),
              SampleAutomata.ENDS_IN_01_WORDS);
          break;
        case "2":
          runExample("Even number of 'a'", SampleAutomata.evenNumberOfA(),
              SampleAutomata.EVEN_A_WORDS);
          break;
        case "3":
          runExample("Strings ending in '01'", SampleAutomata.endsIn01(),
              SampleAutomata.ENDS_IN_01_WORDS);
          out.println(RULE);
          runExample("Even number of 'a'", SampleAutomata.evenNumberOfA(),
              SampleAutomata.EVEN_A_WORDS);
          break;
        default:
          out.println("Invalid option.");
      }
    } catch (ValidationException problem) {
      // bundled examples are well-formed, anything else is a bug
      throw new IllegalStateException("Bundled example failed validation", problem);
    }
  }

  private void runExample(final String title, final AutomatonDefinition definition,
      final List<String> words) {
    out.println("=== EXAMPLE: " + title + " ===");
    out.println(definition);
    for (final String word : words) {
      report(definition, word);
    }
  }

  void loadFromFile() {
    while (true) {
      out.println("Supported formats:");
      out.println("1. JSON (.json)");
      out.println("2. YAML (.yaml/.yml)");
      out.println("3. XML (.xml)");
      out.println("4. Back to main menu");
      final String option = trimmed(prompt("Select the format (1-4): "));
      if (option == null || option.equals("4")) {
        return;
      }
      final AutomatonFormat format;
      switch (option) {
        case "1":
          format = AutomatonFormat.JSON;
          break;
        case "2":
          format = AutomatonFormat.YAML;
          break;
        case "3":
          format = AutomatonFormat.XML;
          break;
        default:
          out.println("Invalid option. Try again.");
          continue;
      }
      final String fileName = trimmed(prompt("File name (with extension): "));
      if (fileName == null) {
        return;
      }
      final Path path = workingDirectory.resolve(fileName);
      try {
        current = format.newSerializer().load(path);
        logger.info("Loaded automaton from " + path);
        out.println("Automaton loaded from " + fileName);
        out.println(current);
        return;
      } catch (NoSuchFileException missing) {
        out.println("Error: file '" + fileName + "' not found");
      } catch (IOException problem) {
        out.println("Error: could not read '" + fileName + "': " + problem.getMessage());
      } catch (ValidationException problem) {
        out.println("Error: invalid automaton definition: " + problem.getMessage());
      }
    }
  }

  void buildManually() {
    out.println("=== BUILD AUTOMATON MANUALLY ===");
    final List<String> states = splitLabels(prompt("States, comma separated (e.g. q0,q1,q2): "));
    if (states.isEmpty()) {
      out.println("Error: at least one state is required.");
      return;
    }
    final List<String> symbolLabels =
        splitLabels(prompt("Alphabet symbols, comma separated (e.g. 0,1): "));
    if (symbolLabels.isEmpty()) {
      out.println("Error: at least one symbol is required.");
      return;
    }
    final Set<Character> alphabet = new LinkedHashSet<>();
    for (final String label : symbolLabels) {
      if (label.length() != 1) {
        out.println("Error: symbol '" + label + "' must be a single character.");
        return;
      }
      alphabet.add(label.charAt(0));
    }

    final String initialState = trimmed(prompt("Initial state " + states + ": "));
    if (initialState == null || !states.contains(initialState)) {
      out.println("Error: '" + initialState + "' is not one of the states.");
      return;
    }

    final List<String> accepting = new ArrayList<>();
    for (final String state : splitLabels(prompt("Accepting states, comma separated " + states
        + ": "))) {
      if (states.contains(state)) {
        accepting.add(state);
      } else {
        out.println("Ignoring unknown accepting state '" + state + "'");
      }
    }

    out.println("Transitions as from,symbol,to. Empty line to finish.");
    final Map<TransitionKey, String> delta = new LinkedHashMap<>();
    while (true) {
      final String line = trimmed(prompt("Transition: "));
      if (line == null || line.isEmpty()) {
        break;
      }
      final String[] parts = line.split(",", -1);
      if (parts.length != 3) {
        out.println("Error: expected from,symbol,to");
        continue;
      }
      final String from = parts[0].trim();
      final String symbol = parts[1].trim();
      final String to = parts[2].trim();
      if (!states.contains(from)) {
        out.println("Error: state '" + from + "' does not exist.");
        continue;
      }
      if (symbol.length() != 1 || !alphabet.contains(symbol.charAt(0))) {
        out.println("Error: symbol '" + symbol + "' is not in the alphabet.");
        continue;
      }
      if (!states.contains(to)) {
        out.println("Error: state '" + to + "' does not exist.");
        continue;
      }
      final TransitionKey key = TransitionKey.of(from, symbol.charAt(0));
      if (delta.containsKey(key)) {
        out.println("Warning: a transition for " + key + " already exists. Overwriting.");
      }
      delta.put(key, to);
      out.println("Added " + new Transition(from, symbol.charAt(0), to));
    }
    if (delta.isEmpty()) {
      out.println("Warning: no transitions were defined.");
    }

    try {
      current = AutomatonDefinition.newBuilder().states(states).alphabet(alphabet)
          .initialState(initialState).acceptingStates(accepting).transitions(delta).build();
      logger.info("Built automaton with " + states.size() + " states by hand");
      out.println("Automaton created:");
      out.println(current);
    } catch (ValidationException problem) {
      out.println("Error: invalid automaton definition: " + problem.getMessage());
    }
  }

  void writeExampleFiles() {
    try {
      final List<Path> written = ExampleFileWriter.writeExamples(workingDirectory);
      out.println("Example files written:");
      for (final Path path : written) {
        out.println("  - " + path.getFileName());
      }
      out.println("Load them with option 2.");
    } catch (IOException problem) {
      out.println("Error: could not write example files: " + problem.getMessage());
    } catch (ValidationException problem) {
      throw new IllegalStateException("Bundled example failed validation", problem);
    }
  }

  void testStrings(final AutomatonDefinition definition) {
    out.println("=== TESTING STRINGS ===");
    out.println("Alphabet: " + definition.getAlphabet());
    out.println("Enter strings to test (empty line to stop).");
    while (true) {
      final String word = trimmed(prompt("String to test: "));
      if (word == null) {
        return;
      }
      if (word.isEmpty()) {
        final String answer = trimmed(prompt("Test the empty string? (y/n): "));
        if (answer == null || !answer.equalsIgnoreCase("y")) {
          return;
        }
      }
      report(definition, word);
    }
  }

  private void report(final AutomatonDefinition definition, final String word) {
    out.println("String '" + word + "':");
    try {
      out.println("  Final state: " + simulator.finalState(definition, word));
      if (!word.isEmpty()) {
        final List<DerivationStep> steps = simulator.derivation(definition, word);
        out.println("  Derivation: " + steps);
      }
      out.println("  Accepted: " + (simulator.accepted(definition, word) ? "YES" : "NO"));
    } catch (SimulationException stuck) {
      out.println("  Error: " + describe(stuck.getTransitionError()));
    } catch (AutomatonException problem) {
      out.println("  Error: " + problem.getMessage());
    }
  }

  static String describe(final TransitionException stuck) {
    if (stuck.getCode() == Code.MISSING_TRANSITION) {
      return "the automaton is not defined for state " + stuck.getState() + " on symbol '"
          + stuck.getSymbol() + "' and rejects this input";
    }
    return stuck.getMessage();
  }

  private String prompt(final String message) {
    out.print(message);
    out.flush();
    try {
      return in.readLine();
    } catch (IOException problem) {
      throw new UncheckedIOException(problem);
    }
  }

  private static String trimmed(final String line) {
    return line == null ? null : line.trim();
  }

  private static List<String> splitLabels(final String line) {
    final List<String> labels = new ArrayList<>();
    if (line == null) {
      return labels;
    }
    for (final String part : line.split(",")) {
      final String label = part.trim();
      if (!label.isEmpty() && !labels.contains(label)) {
        labels.add(label);
      }
    }
    return labels;
  }
}
