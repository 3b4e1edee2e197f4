package com.gentoro.schemacache.exception;

import java.util.Map;

/** Neither a source key nor a declared identifier matched the requested key. */
public class SchemaNotFoundException extends SchemaCacheException {
  private final String key;

  public SchemaNotFoundException(String key) {
    super(SchemaCacheErrorCode.NOT_FOUND, "Schema not found: " + key, Map.of("key", key));
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
