package com.github.automaton.loader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automaton.AutomatonDefinition;
import com.github.automaton.SampleAutomata;
import com.github.automaton.ValidationException;

/**
 * Writes the "ends in 01" sample automaton once per supported format so users have something to
 * load and edit.
 */
public final class ExampleFileWriter {
  private static final Logger logger = LogManager.getLogger(ExampleFileWriter.class.getSimpleName());

  public static final String BASE_NAME = "afd_ejemplo";

  /**
   * Writes afd_ejemplo.json, afd_ejemplo.yaml and afd_ejemplo.xml into the directory, creating it
   * if needed, and returns the written paths in that order. Existing files are overwritten.
   */
  public static List<Path> writeExamples(final Path directory)
      throws IOException, ValidationException {
    Files.createDirectories(directory);
    final AutomatonDefinition example = SampleAutomata.endsIn01();
    final List<Path> written = new ArrayList<>();
    for (final AutomatonFormat format : AutomatonFormat.values()) {
      final Path target = directory.resolve(BASE_NAME + format.getExtensions().get(0));
      format.newSerializer().store(example, target);
      written.add(target);
    }
    logger.info("Wrote " + written.size() + " example automaton files to " + directory);
    return written;
  }

  private ExampleFileWriter() {}
}
