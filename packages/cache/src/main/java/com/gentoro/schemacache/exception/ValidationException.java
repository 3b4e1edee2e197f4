package com.gentoro.schemacache.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends SchemaCacheException {
  public ValidationException(String message) {
    super(SchemaCacheErrorCode.INVALID_ARGUMENT, message);
  }
}
