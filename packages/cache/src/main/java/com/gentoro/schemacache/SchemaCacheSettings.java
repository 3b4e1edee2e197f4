package com.gentoro.schemacache;

import com.gentoro.schemacache.document.SchemaIdExtractor;
import com.gentoro.schemacache.document.SchemaParsers;
import com.gentoro.schemacache.exception.ConfigException;
import com.gentoro.schemacache.exception.ValidationException;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Typed, immutable view over the {@code schemacache.*} configuration keys.
 *
 * <pre>
 * schemacache:
 *   id-field: id
 *   http:
 *     connect-timeout-seconds: 10
 *     read-timeout-seconds: 20
 *   preload:
 *     format: json
 *     paths:
 *       - /etc/schemas
 * </pre>
 */
public final class SchemaCacheSettings {
  public static final int DEFAULT_CONNECT_TIMEOUT_SECONDS = 10;
  public static final int DEFAULT_READ_TIMEOUT_SECONDS = 20;
  public static final String DEFAULT_PRELOAD_FORMAT = "json";

  private final String idField;
  private final int connectTimeoutSeconds;
  private final int readTimeoutSeconds;
  private final List<String> preloadPaths;
  private final String preloadFormat;

  public SchemaCacheSettings(
      String idField,
      int connectTimeoutSeconds,
      int readTimeoutSeconds,
      List<String> preloadPaths,
      String preloadFormat) {
    if (idField == null || idField.isBlank()) {
      throw new ConfigException("schemacache.id-field must not be blank");
    }
    if (connectTimeoutSeconds <= 0 || readTimeoutSeconds <= 0) {
      throw new ConfigException(
          "HTTP timeouts must be positive, got connect="
              + connectTimeoutSeconds
              + "s read="
              + readTimeoutSeconds
              + "s");
    }
    try {
      SchemaParsers.forFormat(preloadFormat);
    } catch (ValidationException e) {
      throw new ConfigException("Invalid schemacache.preload.format: " + preloadFormat, e);
    }
    this.idField = idField.trim();
    this.connectTimeoutSeconds = connectTimeoutSeconds;
    this.readTimeoutSeconds = readTimeoutSeconds;
    this.preloadPaths = preloadPaths == null ? List.of() : List.copyOf(preloadPaths);
    this.preloadFormat = preloadFormat;
  }

  public static SchemaCacheSettings defaults() {
    return new SchemaCacheSettings(
        SchemaIdExtractor.DEFAULT_ID_FIELD,
        DEFAULT_CONNECT_TIMEOUT_SECONDS,
        DEFAULT_READ_TIMEOUT_SECONDS,
        List.of(),
        DEFAULT_PRELOAD_FORMAT);
  }

  public static SchemaCacheSettings from(Configuration cfg) {
    if (cfg == null) return defaults();
    try {
      List<String> paths =
          cfg.getList(String.class, "schemacache.preload.paths", List.of()).stream()
              .filter(p -> p != null && !p.isBlank())
              .map(String::trim)
              .collect(Collectors.toList());
      return new SchemaCacheSettings(
          cfg.getString("schemacache.id-field", SchemaIdExtractor.DEFAULT_ID_FIELD),
          cfg.getInt("schemacache.http.connect-timeout-seconds", DEFAULT_CONNECT_TIMEOUT_SECONDS),
          cfg.getInt("schemacache.http.read-timeout-seconds", DEFAULT_READ_TIMEOUT_SECONDS),
          paths,
          cfg.getString("schemacache.preload.format", DEFAULT_PRELOAD_FORMAT));
    } catch (ConversionException e) {
      throw new ConfigException("Invalid schemacache configuration", e);
    }
  }

  public String idField() {
    return idField;
  }

  public int connectTimeoutSeconds() {
    return connectTimeoutSeconds;
  }

  public int readTimeoutSeconds() {
    return readTimeoutSeconds;
  }

  /** Directories loaded by {@link SchemaCache#preload()}. */
  public List<String> preloadPaths() {
    return preloadPaths;
  }

  public String preloadFormat() {
    return preloadFormat;
  }
}
