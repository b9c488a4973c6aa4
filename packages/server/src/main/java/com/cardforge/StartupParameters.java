package com.cardforge;

import com.cardforge.exception.ValidationException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Command line arguments in {@code --key=value} form. A bare {@code --flag} is stored as {@code
 * "true"}; arguments that do not start with {@code --} are rejected.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    for (String arg : args == null ? new String[0] : args) {
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ValidationException("Unrecognized argument: " + arg);
      }
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        parameters.put(body, "true");
      } else {
        parameters.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public boolean has(String name) {
    return parameters.containsKey(name);
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }

  public String getParameter(String name, String defaultValue) {
    return parameters.getOrDefault(name, defaultValue);
  }

  /** Typed lookup for String, Integer and Boolean parameters. */
  public <T> T getParameter(String name, Class<T> type) {
    String raw = parameters.get(name);
    if (raw == null) {
      return null;
    }
    if (type == String.class) {
      return type.cast(raw);
    }
    if (type == Integer.class) {
      try {
        return type.cast(Integer.valueOf(raw.trim()));
      } catch (NumberFormatException e) {
        throw new ValidationException("--" + name + " must be an integer, got '" + raw + "'");
      }
    }
    if (type == Boolean.class) {
      return type.cast(Boolean.valueOf(raw.trim()));
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  /** Comma separated list parameter; blank entries are dropped. */
  public List<String> getList(String name) {
    String raw = parameters.get(name);
    if (StringUtils.isBlank(raw)) {
      return List.of();
    }
    return Arrays.stream(raw.split(","))
        .map(String::trim)
        .filter(StringUtils::isNotEmpty)
        .toList();
  }

  /** Location of the configuration file; {@code classpath:application.yaml} by default. */
  public String configFile() {
    return parameters.getOrDefault("config", ConfigurationProvider.DEFAULT_LOCATION);
  }
}
