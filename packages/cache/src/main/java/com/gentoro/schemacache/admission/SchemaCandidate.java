package com.gentoro.schemacache.admission;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * A schema on its way into the store: either a parsed document, or the reason it could not be
 * read or parsed. Failed candidates travel through the batch so that they are reported alongside
 * rejected ones instead of aborting it.
 */
public final class SchemaCandidate {
  private final String sourceKey;
  private final long mtime;
  private final JsonNode document;
  private final FailureReason failure;
  private final Throwable cause;

  private SchemaCandidate(
      String sourceKey, long mtime, JsonNode document, FailureReason failure, Throwable cause) {
    this.sourceKey = Objects.requireNonNull(sourceKey, "sourceKey");
    this.mtime = mtime;
    this.document = document;
    this.failure = failure;
    this.cause = cause;
  }

  public static SchemaCandidate parsed(String sourceKey, long mtime, JsonNode document) {
    return new SchemaCandidate(
        sourceKey, mtime, Objects.requireNonNull(document, "document"), null, null);
  }

  public static SchemaCandidate failed(
      String sourceKey, long mtime, FailureReason reason, Throwable cause) {
    return new SchemaCandidate(
        sourceKey, mtime, null, Objects.requireNonNull(reason, "reason"), cause);
  }

  public String getSourceKey() {
    return sourceKey;
  }

  public long getMtime() {
    return mtime;
  }

  public Optional<JsonNode> getDocument() {
    return Optional.ofNullable(document);
  }

  public Optional<FailureReason> getFailure() {
    return Optional.ofNullable(failure);
  }

  public Throwable getCause() {
    return cause;
  }
}
