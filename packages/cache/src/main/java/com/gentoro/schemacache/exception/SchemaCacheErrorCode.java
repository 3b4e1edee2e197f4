package com.gentoro.schemacache.exception;

/**
 * Canonical error codes for the schema cache. Codes are stable and suitable for downstream
 * services and logs. Prefer choosing the most specific code that reflects the failure origin.
 */
public enum SchemaCacheErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  NETWORK_ERROR,

  // Domain specific
  UNKNOWN_URI_SCHEME,
}
