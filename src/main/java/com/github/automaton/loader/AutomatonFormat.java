package com.github.automaton.loader;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Supported file formats, keyed by file extension.
 */
public enum AutomatonFormat {
  JSON(".json"),
  YAML(".yaml", ".yml"),
  XML(".xml");

  private final List<String> extensions;

  private AutomatonFormat(final String... extensions) {
    this.extensions = Collections.unmodifiableList(Arrays.asList(extensions));
  }

  public List<String> getExtensions() {
    return extensions;
  }

  public AutomatonSerializer newSerializer() {
    switch (this) {
      case JSON:
        return new JsonAutomatonSerializer();
      case YAML:
        return new YamlAutomatonSerializer();
      case XML:
        return new XmlAutomatonSerializer();
      default:
        throw new IllegalStateException("Unsupported format " + this);
    }
  }

  /**
   * Picks the format from the file name's extension, case-insensitively.
   *
   * @throws IllegalArgumentException if the extension is not recognised
   */
  public static AutomatonFormat fromPath(final Path path) {
    final Path fileName = path.getFileName();
    final String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    for (final AutomatonFormat format : values()) {
      for (final String extension : format.extensions) {
        if (name.endsWith(extension)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported automaton file extension: " + path);
  }

  /**
   * The serializer matching the file's extension.
   */
  public static AutomatonSerializer serializerFor(final Path path) {
    return fromPath(path).newSerializer();
  }
}
