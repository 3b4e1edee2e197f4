package com.gentoro.schemacache.exception;

import java.util.Map;

/** Network-level communication error (HTTP status, sockets, timeouts). */
public class NetworkException extends SchemaCacheException {
  public NetworkException(String message, Map<String, ?> context) {
    super(SchemaCacheErrorCode.NETWORK_ERROR, message, context);
  }

  public NetworkException(String message, Map<String, ?> context, Throwable cause) {
    super(SchemaCacheErrorCode.NETWORK_ERROR, message, context, cause);
  }
}
