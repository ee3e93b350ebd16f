package com.gentoro.morphie;

import com.gentoro.morphie.exception.ConfigException;
import com.gentoro.morphie.exception.SerializationException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration of a run and exposes it as a Commons Configuration instance.
 *
 * <p>Locations: {@code classpath:<resource>}, a {@code file:} URI, or a filesystem path. Values
 * may use {@code ${env:NAME}}; a variable missing from the environment is looked up in a {@code
 * .env.local} file ({@code NAME=value} lines) in the working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String CLASSPATH_PREFIX = "classpath:";
  static final String DEFAULT_LOCATION = CLASSPATH_PREFIX + "application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    this.configuration = withEnvLookup(load(loc));
  }

  public Configuration config() {
    return configuration;
  }

  private static Configuration load(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
    }
    if (location.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return fromFile(new File(URI.create(location)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + location, e);
      }
    }
    return fromFile(new File(location));
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    YAMLConfiguration config = new YAMLConfiguration();
    InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.warn("Configuration resource '{}' not found, using defaults", resource);
      return config;
    }
    log.debug("Loading configuration from classpath resource {}", resource);
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      config.read(reader);
      return config;
    } catch (ConfigurationException | IOException e) {
      throw new SerializationException("Failed to read YAML resource: " + resource, e);
    }
  }

  private static YAMLConfiguration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file);
    }
    log.debug("Loading configuration from {}", file.getAbsolutePath());
    try {
      return new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
          .configure(new Parameters().fileBased().setFile(file))
          .getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration withEnvLookup(Configuration config) {
    config.getInterpolator().registerLookup("env", new FallbackEnvLookup(Paths.get(".env.local")));
    return config;
  }

  /** Environment variables first, then the {@code .env.local} file, read on first miss. */
  static final class FallbackEnvLookup implements Lookup {
    private final Path fallbackFile;
    private volatile Configuration fallback;

    FallbackEnvLookup(Path fallbackFile) {
      this.fallbackFile = fallbackFile;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      String local = fallback().getString(key, null);
      return local == null ? null : unquote(local.trim());
    }

    private Configuration fallback() {
      if (fallback == null) {
        synchronized (this) {
          if (fallback == null) {
            fallback = readFallback();
          }
        }
      }
      return fallback;
    }

    private Configuration readFallback() {
      PropertiesConfiguration properties = new PropertiesConfiguration();
      if (!Files.isRegularFile(fallbackFile)) {
        log.debug("No {} found", fallbackFile.toAbsolutePath());
        return properties;
      }
      log.info("Reading environment fallback {}", fallbackFile.toAbsolutePath());
      try (Reader reader = Files.newBufferedReader(fallbackFile, StandardCharsets.UTF_8)) {
        properties.read(reader);
      } catch (ConfigurationException | IOException e) {
        log.warn("Failed to read {}", fallbackFile.toAbsolutePath(), e);
      }
      return properties;
    }

    private static String unquote(String value) {
      if (value.length() >= 2
          && (value.startsWith("\"") && value.endsWith("\"")
              || value.startsWith("'") && value.endsWith("'"))) {
        return value.substring(1, value.length() - 1);
      }
      return value;
    }
  }
}
