package com.gentoro.schemacache.document;

import com.gentoro.schemacache.exception.ValidationException;
import com.gentoro.schemacache.utility.JacksonUtility;
import java.util.Locale;

/** Stock {@link SchemaParser}s backed by the shared Jackson mappers. */
public final class SchemaParsers {
  private SchemaParsers() {}

  public static SchemaParser json() {
    return raw -> JacksonUtility.getJsonMapper().readTree(raw);
  }

  public static SchemaParser yaml() {
    return raw -> JacksonUtility.getYamlMapper().readTree(raw);
  }

  /** Resolves a parser from its format name ({@code json} or {@code yaml}). */
  public static SchemaParser forFormat(String format) {
    String f = format == null ? "json" : format.trim().toLowerCase(Locale.ROOT);
    switch (f) {
      case "json":
        return json();
      case "yaml":
      case "yml":
        return yaml();
      default:
        throw new ValidationException("Unsupported schema format: " + format);
    }
  }
}
