package com.github.automaton.loader;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.automaton.AutomatonDefinition;
import com.github.automaton.AutomatonException.Code;
import com.github.automaton.ValidationException;

/**
 * Jackson-backed serializer for the tree formats that share {@link AutomatonDocument}. Keys other
 * than Q, Sigma, q0, F and delta are ignored.
 */
abstract class JacksonAutomatonSerializer implements AutomatonSerializer {
  private final ObjectMapper mapper;

  JacksonAutomatonSerializer(final ObjectMapper mapper) {
    this.mapper = mapper;
    this.mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    this.mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  @Override
  public AutomatonDefinition load(final InputStream in) throws IOException, ValidationException {
    final AutomatonDocument document;
    try {
      document = mapper.readValue(in, AutomatonDocument.class);
    } catch (JsonProcessingException problem) {
      throw new ValidationException(Code.MALFORMED_DEFINITION,
          "Failed to parse " + getFormat() + " automaton: " + problem.getOriginalMessage(),
          problem);
    }
    if (document == null) {
      throw new ValidationException(Code.MALFORMED_DEFINITION,
          "Empty " + getFormat() + " document");
    }
    return document.toDefinition();
  }

  @Override
  public void store(final AutomatonDefinition definition, final OutputStream out)
      throws IOException {
    mapper.writerWithDefaultPrettyPrinter().writeValue(out, AutomatonDocument.from(definition));
  }
}
