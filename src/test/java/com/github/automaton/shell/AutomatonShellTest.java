package com.github.automaton.shell;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.automaton.AutomatonDefinition;
import com.github.automaton.SampleAutomata;
import com.github.automaton.Simulator.SimulatorBuilder;

/**
 * Drives the interactive shell with scripted input.
 */
public class AutomatonShellTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private Path workingDirectory;
  private AutomatonShell shell;
  private ByteArrayOutputStream output;

  @Before
  public void setUp() throws Exception {
    workingDirectory = folder.newFolder("cwd").toPath();
  }

  @Test
  public void testBundledExamples() {
    final String printed = run("1\n3\n0\n");

    assertTrue(printed.contains("=== EXAMPLE: Strings ending in '01' ==="));
    assertTrue(printed.contains("=== EXAMPLE: Even number of 'a' ==="));
    assertTrue(printed.contains("String '01':\n  Final state: q2\n"
        + "  Derivation: [(q0, 0, q1), (q1, 1, q2)]\n  Accepted: YES"));
    assertTrue(printed.contains("String '10':\n  Final state: q1"));
    // empty word prints no derivation
    assertTrue(printed.contains("String '':\n  Final state: par\n  Accepted: YES"));
    assertTrue(printed.endsWith("Goodbye!\n"));
    assertNull(shell.getCurrent());
  }

  @Test
  public void testBuildManuallyThenTestStrings() {
    final String script = "3\n" // build
        + "q0, q1\n" // states
        + "a,b\n" // alphabet
        + "q0\n" // initial
        + "q1,qz\n" // accepting, qz ignored
        + "q0,a,q1\n"
        + "q0,a\n" // malformed
        + "q9,a,q0\n" // unknown state
        + "q0,c,q0\n" // unknown symbol
        + "q1,b,q0\n"
        + "q1,b,q1\n" // overwrite
        + "\n" // done
        + "5\n" // test strings
        + "a\n" + "ab\n" + "aa\n"
        + "\n" + "y\n" // empty string
        + "\n" + "n\n" // back
        + "6\n" + "0\n";
    final String printed = run(script);

    final AutomatonDefinition built = shell.getCurrent();
    assertNotNull(built);
    assertEquals(2, built.getTransitions().size());
    assertEquals("q1", built.lookup("q1", 'b').get());
    assertEquals(1, built.getAcceptingStates().size());

    assertTrue(printed.contains("Ignoring unknown accepting state 'qz'"));
    assertTrue(printed.contains("Error: expected from,symbol,to"));
    assertTrue(printed.contains("Error: state 'q9' does not exist."));
    assertTrue(printed.contains("Error: symbol 'c' is not in the alphabet."));
    assertTrue(printed.contains("Warning: a transition for (q1, b) already exists. Overwriting."));

    assertTrue(printed.contains("String 'a':\n  Final state: q1\n"
        + "  Derivation: [(q0, a, q1)]\n  Accepted: YES"));
    assertTrue(printed.contains("String 'ab':\n  Final state: q1"));
    assertTrue(printed.contains("String 'aa':\n  Error: the automaton is not defined for state q1"
        + " on symbol 'a' and rejects this input"));
    assertTrue(printed.contains("String '':\n  Final state: q0\n  Accepted: NO"));
    assertTrue(printed.contains("Initial state (q0): q0"));
  }

  @Test
  public void testBuildManuallyRejectsBadInitialState() {
    final String printed = run("3\nq0,q1\n0,1\nq7\n0\n");
    assertTrue(printed.contains("Error: 'q7' is not one of the states."));
    assertNull(shell.getCurrent());
  }

  @Test
  public void testBuildManuallyRejectsLongSymbol() {
    final String printed = run("3\nq0\nab\n0\n");
    assertTrue(printed.contains("Error: symbol 'ab' must be a single character."));
    assertNull(shell.getCurrent());
  }

  @Test
  public void testWriteExamplesThenLoad() throws Exception {
    final String printed = run("4\n2\n1\nafd_ejemplo.json\n0\n");

    assertTrue(Files.exists(workingDirectory.resolve("afd_ejemplo.json")));
    assertTrue(Files.exists(workingDirectory.resolve("afd_ejemplo.yaml")));
    assertTrue(Files.exists(workingDirectory.resolve("afd_ejemplo.xml")));
    assertTrue(printed.contains("Automaton loaded from afd_ejemplo.json"));
    assertEquals(SampleAutomata.endsIn01(), shell.getCurrent());
  }

  @Test
  public void testLoadFailuresKeepTheMenuAlive() throws Exception {
    Files.write(workingDirectory.resolve("broken.yaml"),
        "Q: [q0]\nSigma: [a]\nq0: q5\nF: []\ndelta: []\n".getBytes(StandardCharsets.UTF_8));
    final String printed = run("2\n1\nmissing.json\n2\nbroken.yaml\n7\n4\n0\n");

    assertTrue(printed.contains("Error: file 'missing.json' not found"));
    assertTrue(printed.contains("Error: invalid automaton definition: Initial state 'q5'"));
    assertTrue(printed.contains("Invalid option. Try again."));
    assertNull(shell.getCurrent());
  }

  @Test
  public void testOptionsNeedingAnAutomaton() {
    final String printed = run("5\n6\n9\n0\n");
    assertFalse(printed.contains("=== TESTING STRINGS ==="));
    assertTrue(printed.contains("No automaton loaded"));
    assertEquals(3, count(printed, "Invalid option. Try again."));
  }

  @Test
  public void testEndOfInputExits() {
    assertTrue(run("").endsWith("Goodbye!\n"));
    assertTrue(run("3\nq0\n").endsWith("Goodbye!\n"));
  }

  private String run(final String script) {
    output = new ByteArrayOutputStream();
    final PrintStream out = new PrintStream(output, true, StandardCharsets.UTF_8);
    shell = new AutomatonShell(new BufferedReader(new StringReader(script)), out,
        workingDirectory, SimulatorBuilder.newBuilder().build());
    shell.run();
    out.flush();
    return new String(output.toByteArray(), StandardCharsets.UTF_8).replace("\r\n", "\n");
  }

  private static int count(final String text, final String needle) {
    int count = 0;
    int from = 0;
    while ((from = text.indexOf(needle, from)) >= 0) {
      count++;
      from += needle.length();
    }
    return count;
  }
}
