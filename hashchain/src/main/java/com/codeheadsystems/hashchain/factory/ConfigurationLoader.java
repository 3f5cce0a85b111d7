package com.codeheadsystems.hashchain.factory;

import com.codeheadsystems.hashchain.model.Configuration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link Configuration} from YAML.
 */
public class ConfigurationLoader {

  private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Configuration loader.
   */
  public ConfigurationLoader() {
    this(new ObjectMapper(new YAMLFactory()));
  }

  /**
   * Instantiates a new Configuration loader.
   *
   * @param objectMapper a mapper that understands YAML
   */
  public ConfigurationLoader(final ObjectMapper objectMapper) {
    log.info("ConfigurationLoader({})", objectMapper);
    this.objectMapper = objectMapper;
  }

  /**
   * Load configuration.
   *
   * @param path the path
   * @return the configuration
   */
  public Configuration load(final Path path) {
    log.trace("load({})", path);
    try (InputStream inputStream = Files.newInputStream(path)) {
      return load(inputStream);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read configuration " + path, e);
    }
  }

  /**
   * Load configuration. The stream is not closed.
   *
   * @param inputStream the input stream
   * @return the configuration
   */
  public Configuration load(final InputStream inputStream) {
    log.trace("load(stream)");
    try {
      return objectMapper.readValue(inputStream, Configuration.class);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to parse configuration", e);
    }
  }

}
