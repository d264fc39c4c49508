package com.github.automaton.loader;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonDefinition;
import com.github.automaton.ValidationException;

/**
 * Reads and writes automaton definitions in one file format. Implementations normalize their
 * schema into the (from, symbol, to) triple list before the definition is built and validated, so
 * a malformed file surfaces as a {@link ValidationException} no matter which format produced it.
 */
public interface AutomatonSerializer {

  /**
   * @throws IOException if the stream cannot be read
   * @throws ValidationException if the content cannot be parsed, has the wrong shape or describes
   *         an ill-formed automaton
   */
  AutomatonDefinition load(final InputStream in) throws IOException, ValidationException;

  void store(final AutomatonDefinition definition, final OutputStream out) throws IOException;

  AutomatonFormat getFormat();

  default AutomatonDefinition load(final Path path) throws IOException, ValidationException {
    try (InputStream in = Files.newInputStream(path)) {
      final AutomatonDefinition definition = load(in);
      Holder.logger.info("Loaded " + getFormat() + " automaton from " + path);
      return definition;
    }
  }

  default void store(final AutomatonDefinition definition, final Path path) throws IOException {
    try (OutputStream out = Files.newOutputStream(path)) {
      store(definition, out);
    }
    Holder.logger.info("Wrote " + getFormat() + " automaton to " + path);
  }

  final static class Holder {
    private static final Logger logger =
        LogManager.getLogger(AutomatonSerializer.class.getSimpleName());

    private Holder() {}
  }
}
