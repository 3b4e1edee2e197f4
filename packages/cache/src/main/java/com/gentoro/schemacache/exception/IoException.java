package com.gentoro.schemacache.exception;

import java.util.Map;

/** I/O operation failed (filesystem, classpath, directory walk). */
public class IoException extends SchemaCacheException {
  public IoException(String message) {
    super(SchemaCacheErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(SchemaCacheErrorCode.IO_ERROR, message, cause);
  }

  public IoException(String message, Map<String, ?> context, Throwable cause) {
    super(SchemaCacheErrorCode.IO_ERROR, message, context, cause);
  }
}
