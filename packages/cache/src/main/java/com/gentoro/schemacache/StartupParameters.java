package com.gentoro.schemacache;

import com.gentoro.schemacache.document.SchemaParsers;
import com.gentoro.schemacache.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line options of {@link SchemaCacheApp}, given as {@code --name value} pairs. */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("list", "load", "help");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("mode", "list");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }
    String config = parameters.get("config");
    if (config == null || config.isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
    if ("load".equals(mode) && getOptionalParameter("key").isEmpty()) {
      throw new IllegalArgumentException("Mode 'load' requires --key");
    }
    if (parameters.containsKey("format")) {
      try {
        SchemaParsers.forFormat(getOptionalParameter("format").orElse(""));
      } catch (ValidationException e) {
        throw new IllegalArgumentException(e.getMessage(), e);
      }
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:schema-cache.yaml",
   * "/etc/schema-cache.yaml", "config/local.yaml".
   */
  public String configFile() {
    return parameters.get("config");
  }

  public String mode() {
    return parameters.get("mode");
  }

  public Optional<String> getOptionalParameter(String name) {
    String value = parameters.get(name);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }
}
