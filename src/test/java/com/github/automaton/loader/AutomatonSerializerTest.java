package com.github.automaton.loader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.automaton.AutomatonDefinition;
import com.github.automaton.AutomatonException;
import com.github.automaton.AutomatonException.Category;
import com.github.automaton.AutomatonException.Code;
import com.github.automaton.SampleAutomata;
import com.github.automaton.Simulator;
import com.github.automaton.Simulator.SimulatorBuilder;
import com.github.automaton.ValidationException;

/**
 * Loading automata out of JSON, YAML and XML, and writing them back.
 */
public class AutomatonSerializerTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testLoadEachFormat() throws Exception {
    final AutomatonDefinition expected = SampleAutomata.endsIn01();
    assertEquals(expected, load(new JsonAutomatonSerializer(), "/automata/ends_in_01.json"));
    assertEquals(expected, load(new YamlAutomatonSerializer(), "/automata/ends_in_01.yaml"));
    assertEquals(expected, load(new XmlAutomatonSerializer(), "/automata/ends_in_01.xml"));
  }

  @Test
  public void testLoadedAutomatonRuns() throws Exception {
    final AutomatonDefinition evenA = load(AutomatonFormat.serializerFor(Paths.get("even_a.yml")),
        "/automata/even_a.yml");
    final Simulator simulator = SimulatorBuilder.newBuilder().build();
    assertTrue(simulator.accepted(evenA, "abab"));
    assertEquals("impar", simulator.finalState(evenA, "bab"));
  }

  @Test
  public void testFormatFromPath() {
    assertEquals(AutomatonFormat.JSON, AutomatonFormat.fromPath(Paths.get("dir", "a.json")));
    assertEquals(AutomatonFormat.YAML, AutomatonFormat.fromPath(Paths.get("a.YML")));
    assertEquals(AutomatonFormat.YAML, AutomatonFormat.fromPath(Paths.get("a.yaml")));
    assertEquals(AutomatonFormat.XML, AutomatonFormat.fromPath(Paths.get("a.Xml")));
    try {
      AutomatonFormat.fromPath(Paths.get("a.txt"));
      fail();
    } catch (IllegalArgumentException expected) {
    }
  }

  @Test
  public void testMalformedJson() throws IOException {
    final JsonAutomatonSerializer json = new JsonAutomatonSerializer();
    assertRejected(json, "{ \"Q\": [\"q0\"", Code.MALFORMED_DEFINITION);
    assertRejected(json, "", Code.MALFORMED_DEFINITION);
    assertRejected(json, "null", Code.MALFORMED_DEFINITION);
    // F is missing
    assertRejected(json, "{\"Q\":[\"q0\"],\"Sigma\":[\"a\"],\"q0\":\"q0\",\"delta\":[]}",
        Code.MALFORMED_DEFINITION);
    // transition with two elements
    assertRejected(json,
        "{\"Q\":[\"q0\"],\"Sigma\":[\"a\"],\"q0\":\"q0\",\"F\":[],\"delta\":[[\"q0\",\"a\"]]}",
        Code.MALFORMED_DEFINITION);
  }

  @Test
  public void testExtraKeysAreIgnored() throws Exception {
    final AutomatonDefinition fromJson = new JsonAutomatonSerializer().load(stream(
        "{\"description\":\"loops on a\",\"Q\":[\"q0\"],\"Sigma\":[\"a\"],\"q0\":\"q0\","
            + "\"F\":[\"q0\"],\"delta\":[[\"q0\",\"a\",\"q0\"]],\"author\":{\"name\":\"x\"}}"));
    final AutomatonDefinition fromYaml = new YamlAutomatonSerializer().load(stream(
        "description: loops on a\nQ: [q0]\nSigma: [a]\nq0: q0\nF: [q0]\n"
            + "delta:\n  - [q0, a, q0]\ntags: [demo, tiny]\n"));
    final AutomatonDefinition expected = AutomatonDefinition.newBuilder().states("q0")
        .alphabet('a').initialState("q0").acceptingStates("q0").transition("q0", 'a', "q0")
        .build();
    assertEquals(expected, fromJson);
    assertEquals(expected, fromYaml);
  }

  @Test
  public void testIllFormedAutomatonSurfacesValidationCode() throws Exception {
    final JsonAutomatonSerializer json = new JsonAutomatonSerializer();
    try (InputStream in = getClass().getResourceAsStream("/automata/unknown_accepting.json")) {
      json.load(in);
      fail();
    } catch (ValidationException expected) {
      assertEquals(Code.UNKNOWN_ACCEPTING_STATE, expected.getCode());
    }
    assertRejected(json,
        "{\"Q\":[\"q0\"],\"Sigma\":[\"ab\"],\"q0\":\"q0\",\"F\":[],\"delta\":[]}",
        Code.INVALID_SYMBOL);
    assertRejected(json,
        "{\"Q\":[\"q0\"],\"Sigma\":[\"a\"],\"q0\":\"q0\",\"F\":[],\"delta\":[[\"q0\",\"b\",\"q0\"]]}",
        Code.INVALID_TRANSITION_DOMAIN);
    assertRejected(new YamlAutomatonSerializer(),
        "Q: [q0]\nSigma: [a]\nq0: q1\nF: []\ndelta: []\n", Code.UNKNOWN_INITIAL_STATE);
  }

  @Test
  public void testMalformedXml() throws IOException {
    final XmlAutomatonSerializer xml = new XmlAutomatonSerializer();
    assertRejected(xml, "<AFD><Q>", Code.MALFORMED_DEFINITION);
    assertRejected(xml, "<Automaton/>", Code.MALFORMED_DEFINITION);
    // no delta element
    assertRejected(xml, "<AFD><Q><state>q0</state></Q><Sigma><symbol>a</symbol></Sigma>"
        + "<q0>q0</q0><F/></AFD>", Code.MALFORMED_DEFINITION);
    // transition without a target
    assertRejected(xml, "<AFD><Q><state>q0</state></Q><Sigma><symbol>a</symbol></Sigma>"
        + "<q0>q0</q0><F/><delta><transition><from>q0</from><symbol>a</symbol></transition>"
        + "</delta></AFD>", Code.MALFORMED_DEFINITION);
    assertRejected(xml, "<?xml version=\"1.0\"?><!DOCTYPE AFD [<!ENTITY x SYSTEM \"file:///\">]>"
        + "<AFD>&x;</AFD>", Code.MALFORMED_DEFINITION);
  }

  @Test
  public void testStoreThenLoad() throws Exception {
    // blank symbol and a label with surrounding spaces survive every format
    final AutomatonDefinition spaced = AutomatonDefinition.newBuilder().states("s", " t ")
        .alphabet(' ', 'a').initialState("s").acceptingStates(" t ")
        .transition("s", ' ', " t ").transition("s", 'a', "s").transition(" t ", ' ', "s")
        .build();
    for (final AutomatonDefinition definition : new AutomatonDefinition[] {
        SampleAutomata.evenNumberOfA(), spaced}) {
      for (final AutomatonFormat format : AutomatonFormat.values()) {
        final AutomatonSerializer serializer = format.newSerializer();
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.store(definition, out);
        assertEquals(format.toString(), definition,
            serializer.load(new ByteArrayInputStream(out.toByteArray())));
      }
    }
    assertTrue(SimulatorBuilder.newBuilder().build().accepted(spaced, "a "));
  }

  @Test
  public void testXmlLeafTextIsVerbatim() throws Exception {
    final AutomatonDefinition loaded = new XmlAutomatonSerializer().load(stream(
        "<AFD>\n  <Q>\n    <state>s</state>\n  </Q>\n"
            + "  <Sigma>\n    <symbol> </symbol>\n  </Sigma>\n  <q0>s</q0>\n  <F/>\n"
            + "  <delta>\n    <transition><from>s</from><symbol> </symbol><to>s</to></transition>\n"
            + "  </delta>\n</AFD>\n"));
    assertEquals(1, loaded.getAlphabet().size());
    assertTrue(loaded.hasSymbol(' '));
    assertEquals("s", loaded.lookup("s", ' ').get());

    // padded labels are not silently trimmed
    assertRejected(new XmlAutomatonSerializer(), "<AFD><Q><state>s</state></Q>"
        + "<Sigma><symbol>a</symbol></Sigma><q0> s </q0><F/><delta/></AFD>",
        Code.UNKNOWN_INITIAL_STATE);
  }

  @Test
  public void testExampleFiles() throws Exception {
    final Path directory = folder.newFolder("examples").toPath();
    final List<Path> written = ExampleFileWriter.writeExamples(directory);

    assertEquals(3, written.size());
    assertEquals(directory.resolve("afd_ejemplo.json"), written.get(0));
    assertEquals(directory.resolve("afd_ejemplo.yaml"), written.get(1));
    assertEquals(directory.resolve("afd_ejemplo.xml"), written.get(2));
    for (final Path path : written) {
      assertTrue(Files.size(path) > 0);
      assertEquals(path.toString(), SampleAutomata.endsIn01(),
          AutomatonFormat.serializerFor(path).load(path));
    }
    final String xml = new String(Files.readAllBytes(written.get(2)), StandardCharsets.UTF_8);
    assertTrue(xml.contains("<AFD>\n    <Q>\n        <state>q0</state>"));
    assertTrue(xml.contains("<from>q1</from>"));
  }

  @Test
  public void testMissingFile() throws AutomatonException {
    final Path missing = folder.getRoot().toPath().resolve("nope.json");
    try {
      new JsonAutomatonSerializer().load(missing);
      fail();
    } catch (NoSuchFileException expected) {
    } catch (IOException unexpected) {
      fail(unexpected.toString());
    }
  }

  private AutomatonDefinition load(final AutomatonSerializer serializer, final String resource)
      throws IOException, ValidationException {
    try (InputStream in = getClass().getResourceAsStream(resource)) {
      return serializer.load(in);
    }
  }

  private static InputStream stream(final String content) {
    return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
  }

  private static void assertRejected(final AutomatonSerializer serializer, final String content,
      final Code code) throws IOException {
    try {
      serializer.load(stream(content));
      fail("expected " + code + " for " + content);
    } catch (ValidationException expected) {
      assertEquals(code, expected.getCode());
      if (code == Code.MALFORMED_DEFINITION) {
        assertEquals(Category.LOADING, expected.getCode().getCategory());
      }
    }
  }
}
