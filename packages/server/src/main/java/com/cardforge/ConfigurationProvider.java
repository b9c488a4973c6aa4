package com.cardforge;

import com.cardforge.exception.ConfigurationException;
import com.cardforge.logging.LoggingService;
import java.io.File;
import java.net.URL;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.io.FileHandler;
import org.slf4j.Logger;

/**
 * Loads the YAML application configuration.
 *
 * <p>The location is either {@code classpath:<resource>} or a file system path. Values may refer to
 * environment variables with {@code ${env:NAME}}; keys whose placeholder cannot be resolved are
 * removed, so an unset variable reads as an absent key.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final YAMLConfiguration config;

  public ConfigurationProvider(String location) {
    this.config = load(location == null ? DEFAULT_LOCATION : location);
    dropUnresolvedPlaceholders(config);
  }

  public Configuration config() {
    return config;
  }

  private static YAMLConfiguration load(String location) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    FileHandler handler = new FileHandler(yaml);
    try {
      if (location.startsWith(CLASSPATH_PREFIX)) {
        String resource = location.substring(CLASSPATH_PREFIX.length());
        URL url = ConfigurationProvider.class.getClassLoader().getResource(resource);
        if (url == null) {
          throw new ConfigurationException("Configuration resource not found: " + resource);
        }
        handler.load(url);
      } else {
        File file = new File(location);
        if (!file.isFile()) {
          throw new ConfigurationException("Configuration file not found: " + location);
        }
        handler.load(file);
      }
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Failed to load configuration from " + location, e);
    }
    log.info("Loaded configuration from {}", location);
    return yaml;
  }

  private static void dropUnresolvedPlaceholders(YAMLConfiguration config) {
    List<String> unresolved = new ArrayList<>();
    for (Iterator<String> it = config.getKeys(); it.hasNext(); ) {
      String key = it.next();
      Object value = config.getProperty(key);
      if (!(value instanceof String)) {
        continue;
      }
      String interpolated = config.getString(key);
      if (interpolated != null && interpolated.contains("${")) {
        unresolved.add(key);
      }
    }
    for (String key : unresolved) {
      log.debug("Ignoring configuration key {} with an unresolved placeholder", key);
      config.clearProperty(key);
    }
  }
}
