package com.gentoro.schemacache.exception;

import java.util.Map;

/** Raw schema bytes could not be turned into a document. */
public class SchemaParseException extends SchemaCacheException {
  public SchemaParseException(String key, Throwable cause) {
    super(
        SchemaCacheErrorCode.SERIALIZATION_ERROR,
        "Failed to parse schema: " + key,
        Map.of("key", key),
        cause);
  }
}
