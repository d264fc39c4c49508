package com.github.automaton.loader;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.github.automaton.AutomatonDefinition;
import com.github.automaton.AutomatonException.Code;
import com.github.automaton.Transition;
import com.github.automaton.ValidationException;

/**
 * XML format:
 *
 * <pre>
 * &lt;AFD&gt;
 *   &lt;Q&gt;&lt;state&gt;q0&lt;/state&gt;...&lt;/Q&gt;
 *   &lt;Sigma&gt;&lt;symbol&gt;0&lt;/symbol&gt;...&lt;/Sigma&gt;
 *   &lt;q0&gt;q0&lt;/q0&gt;
 *   &lt;F&gt;&lt;state&gt;q2&lt;/state&gt;...&lt;/F&gt;
 *   &lt;delta&gt;
 *     &lt;transition&gt;&lt;from&gt;q0&lt;/from&gt;&lt;symbol&gt;0&lt;/symbol&gt;&lt;to&gt;q1&lt;/to&gt;&lt;/transition&gt;
 *   &lt;/delta&gt;
 * &lt;/AFD&gt;
 * </pre>
 *
 * Text of the leaf elements is taken verbatim, so a {@code <symbol> </symbol>} is the blank symbol
 * and labels keep any surrounding spaces. Whitespace between elements is layout only. External
 * entities and DTDs are refused.
 */
public final class XmlAutomatonSerializer implements AutomatonSerializer {
  static final String ROOT = "AFD";
  private static final String INDENT = "    ";

  @Override
  public AutomatonDefinition load(final InputStream in) throws IOException, ValidationException {
    final Document document;
    try {
      document = newDocumentBuilder().parse(in);
    } catch (SAXException problem) {
      throw new ValidationException(Code.MALFORMED_DEFINITION,
          "Failed to parse XML automaton: " + problem.getMessage(), problem);
    }
    final Element root = document.getDocumentElement();
    if (!ROOT.equals(root.getTagName())) {
      throw new ValidationException(Code.MALFORMED_DEFINITION,
          "Expected root element <" + ROOT + "> but found <" + root.getTagName() + ">");
    }

    final AutomatonDefinition.AutomatonDefinitionBuilder builder = AutomatonDefinition.newBuilder()
        .states(texts(requiredChild(root, "Q"), "state"))
        .alphabetLabels(texts(requiredChild(root, "Sigma"), "symbol"))
        .initialState(text(requiredChild(root, "q0")))
        .acceptingStates(texts(requiredChild(root, "F"), "state"));
    for (final Element transition : children(requiredChild(root, "delta"), "transition")) {
      builder.transition(Transition.of(text(requiredChild(transition, "from")),
          text(requiredChild(transition, "symbol")), text(requiredChild(transition, "to"))));
    }
    return builder.build();
  }

  @Override
  public void store(final AutomatonDefinition definition, final OutputStream out)
      throws IOException {
    try {
      final Document document = newDocumentBuilder().newDocument();
      final Element root = document.createElement(ROOT);
      document.appendChild(root);

      final Element states = append(document, root, "Q", null);
      for (final String state : definition.getStates()) {
        append(document, states, "state", state);
      }
      final Element alphabet = append(document, root, "Sigma", null);
      for (final Character symbol : definition.getAlphabet()) {
        append(document, alphabet, "symbol", String.valueOf(symbol));
      }
      append(document, root, "q0", definition.getInitialState());
      final Element accepting = append(document, root, "F", null);
      for (final String state : definition.getAcceptingStates()) {
        append(document, accepting, "state", state);
      }
      final Element delta = append(document, root, "delta", null);
      for (final Transition transition : definition.toTransitionList()) {
        final Element element = append(document, delta, "transition", null);
        append(document, element, "from", transition.getFromState());
        append(document, element, "symbol", String.valueOf(transition.getSymbol()));
        append(document, element, "to", transition.getToState());
      }

      layout(document, root, 1);
      final TransformerFactory factory = TransformerFactory.newInstance();
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
      factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
      final Transformer transformer = factory.newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
      // the serializer's own indenting may drop whitespace-only text, which is a valid symbol
      transformer.setOutputProperty(OutputKeys.INDENT, "no");
      transformer.transform(new DOMSource(document), new StreamResult(out));
    } catch (TransformerException problem) {
      throw new IOException("Failed to write XML automaton", problem);
    }
  }

  @Override
  public AutomatonFormat getFormat() {
    return AutomatonFormat.XML;
  }

  private static DocumentBuilder newDocumentBuilder() throws IOException {
    try {
      final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      return factory.newDocumentBuilder();
    } catch (ParserConfigurationException problem) {
      throw new IOException("XML parser is not available", problem);
    }
  }

  private static Element append(final Document document, final Element parent, final String name,
      final String text) {
    final Element element = document.createElement(name);
    if (text != null) {
      element.setTextContent(text);
    }
    parent.appendChild(element);
    return element;
  }

  /**
   * Indents container elements with whitespace text nodes, leaving leaf text untouched.
   */
  private static void layout(final Document document, final Element element, final int depth) {
    final List<Element> elements = children(element, null);
    if (elements.isEmpty()) {
      return;
    }
    for (final Element child : elements) {
      element.insertBefore(document.createTextNode("\n" + INDENT.repeat(depth)), child);
      layout(document, child, depth + 1);
    }
    element.appendChild(document.createTextNode("\n" + INDENT.repeat(depth - 1)));
  }

  private static Element requiredChild(final Element parent, final String name)
      throws ValidationException {
    final List<Element> matches = children(parent, name);
    if (matches.isEmpty()) {
      throw new ValidationException(Code.MALFORMED_DEFINITION,
          "Missing <" + name + "> inside <" + parent.getTagName() + ">");
    }
    return matches.get(0);
  }

  /**
   * Child elements in document order, restricted to the given tag name unless it is null.
   */
  private static List<Element> children(final Element parent, final String name) {
    final List<Element> matches = new ArrayList<>();
    final NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      final Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE
          && (name == null || name.equals(node.getNodeName()))) {
        matches.add((Element) node);
      }
    }
    return matches;
  }

  private static List<String> texts(final Element parent, final String name) {
    final List<String> values = new ArrayList<>();
    for (final Element child : children(parent, name)) {
      values.add(text(child));
    }
    return values;
  }

  private static String text(final Element element) {
    return element.getTextContent();
  }
}
