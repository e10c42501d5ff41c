package com.gentoro.onellm;

import com.gentoro.onellm.exception.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the YAML configuration into an Apache Commons Configuration instance.
 *
 * <p>Locations: {@code classpath:application.yaml}, {@code file:/etc/onellm.yaml} or a plain
 * filesystem path. {@code ${env:NAME}} resolves from the process environment first and then from
 * a {@code .env.local} file in the working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this(location, Path.of(".env.local"));
  }

  ConfigurationProvider(String location, Path envFile) {
    String resolved = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (Reader reader = open(resolved)) {
      yaml.read(reader);
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException("Failed to read configuration from " + resolved, e);
    }
    yaml.getInterpolator().registerLookup("env", new EnvLookup(envFile));
    this.configuration = yaml;
    log.info("Loaded configuration from {}", resolved);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Reader open(String location) throws IOException {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      String resource = location.substring(CLASSPATH_PREFIX.length());
      InputStream input =
          ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
      if (input == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + resource);
      }
      return new InputStreamReader(input, StandardCharsets.UTF_8);
    }
    Path path = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return Files.newBufferedReader(path, StandardCharsets.UTF_8);
  }

  /** Environment lookup that falls back to {@code KEY=value} lines of a local env file. */
  static final class EnvLookup implements Lookup {
    private final Path envFile;
    private volatile Map<String, String> fileValues;

    EnvLookup(Path envFile) {
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      Map<String, String> values = fileValues;
      if (values == null) {
        synchronized (this) {
          if (fileValues == null) {
            fileValues = readEnvFile();
          }
          values = fileValues;
        }
      }
      return values.get(key);
    }

    private Map<String, String> readEnvFile() {
      Map<String, String> values = new HashMap<>();
      if (envFile == null || !Files.isRegularFile(envFile)) {
        return values;
      }
      log.info("Reading environment fallback from {}", envFile.toAbsolutePath());
      try {
        for (String line : Files.readAllLines(envFile, StandardCharsets.UTF_8)) {
          String trimmed = line.strip();
          int eq = trimmed.indexOf('=');
          if (trimmed.startsWith("#") || eq <= 0) {
            continue;
          }
          values.put(trimmed.substring(0, eq).strip(), unquote(trimmed.substring(eq + 1).strip()));
        }
      } catch (IOException e) {
        log.warn("Could not read {}; only the process environment is used", envFile, e);
      }
      return values;
    }

    private static String unquote(String value) {
      boolean quoted =
          value.length() >= 2
              && (value.startsWith("\"") && value.endsWith("\"")
                  || value.startsWith("'") && value.endsWith("'"));
      return quoted ? value.substring(1, value.length() - 1) : value;
    }
  }
}
