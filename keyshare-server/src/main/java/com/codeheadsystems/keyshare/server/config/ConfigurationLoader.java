package com.codeheadsystems.keyshare.server.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@link KeyshareGateConfiguration} from YAML and validates it. Close the loader to
 * release its validator factory.
 */
public class ConfigurationLoader implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

  private final ObjectMapper yamlMapper;
  private final ValidatorFactory validatorFactory;
  private final Validator validator;

  /**
   * Instantiates a new Configuration loader.
   */
  public ConfigurationLoader() {
    this.yamlMapper = new ObjectMapper(new YAMLFactory())
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.validatorFactory = Validation.byDefaultProvider()
        .configure()
        .messageInterpolator(new ParameterMessageInterpolator())
        .buildValidatorFactory();
    this.validator = validatorFactory.getValidator();
  }

  /**
   * Loads a configuration file.
   *
   * @param path the YAML file
   * @return the validated configuration
   * @throws IOException if the file cannot be read or parsed
   */
  public KeyshareGateConfiguration load(final Path path) throws IOException {
    log.info("load({})", path);
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  /**
   * Loads a configuration from a stream.
   *
   * @param in the YAML stream
   * @return the validated configuration
   * @throws IOException if the stream cannot be parsed
   */
  public KeyshareGateConfiguration load(final InputStream in) throws IOException {
    final KeyshareGateConfiguration configuration = yamlMapper.readValue(in, KeyshareGateConfiguration.class);
    return validate(configuration);
  }

  /**
   * Validates a configuration.
   *
   * @param configuration the configuration
   * @return the same configuration
   * @throws IllegalArgumentException listing every violation
   */
  public KeyshareGateConfiguration validate(final KeyshareGateConfiguration configuration) {
    final Set<ConstraintViolation<KeyshareGateConfiguration>> violations = validator.validate(configuration);
    if (!violations.isEmpty()) {
      final String details = violations.stream()
          .map(v -> v.getPropertyPath() + " " + v.getMessage())
          .sorted(Comparator.naturalOrder())
          .collect(Collectors.joining(", "));
      throw new IllegalArgumentException("Invalid configuration: " + details);
    }
    return configuration;
  }

  @Override
  public void close() {
    validatorFactory.close();
  }
}
