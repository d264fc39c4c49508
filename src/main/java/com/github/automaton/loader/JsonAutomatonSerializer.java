package com.github.automaton.loader;

import com.fasterxml.jackson.databind.ObjectMapper;

public final class JsonAutomatonSerializer extends JacksonAutomatonSerializer {

  public JsonAutomatonSerializer() {
    super(new ObjectMapper());
  }

  @Override
  public AutomatonFormat getFormat() {
    return AutomatonFormat.JSON;
  }
}
