package com.gentoro.schemacache.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends SchemaCacheException {
  public ConfigException(String message) {
    super(SchemaCacheErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SchemaCacheErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
