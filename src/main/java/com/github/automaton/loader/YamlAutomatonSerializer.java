package com.github.automaton.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * YAML flavour of the JSON schema. Unquoted scalars such as 0 and 1 are coerced to their text.
 */
public final class YamlAutomatonSerializer extends JacksonAutomatonSerializer {

  public YamlAutomatonSerializer() {
    super(new ObjectMapper(new YAMLFactory()));
  }

  @Override
  public AutomatonFormat getFormat() {
    return AutomatonFormat.YAML;
  }
}
