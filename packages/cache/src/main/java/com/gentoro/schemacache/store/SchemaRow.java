package com.gentoro.schemacache.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;
import java.util.Optional;

/**
 * One cached schema: the canonical source key it was loaded from, the identifier declared inside
 * the document (if any), the modification time observed at admission and the document itself.
 *
 * <p>{@code mtime} is expressed in epoch milliseconds; {@code 0} marks rows that never become
 * stale (documents added programmatically, or HTTP resources without {@code Last-Modified}).
 */
public final class SchemaRow {
  public static final long NEVER_STALE = 0L;

  private final String sourceKey;
  private final String idKey;
  private final long mtime;
  private final JsonNode document;

  public SchemaRow(String sourceKey, String idKey, long mtime, JsonNode document) {
    this.sourceKey = Objects.requireNonNull(sourceKey, "sourceKey");
    this.idKey = idKey;
    this.mtime = mtime;
    this.document = Objects.requireNonNull(document, "document");
  }

  public String getSourceKey() {
    return sourceKey;
  }

  public Optional<String> getIdKey() {
    return Optional.ofNullable(idKey);
  }

  public long getMtime() {
    return mtime;
  }

  public JsonNode getDocument() {
    return document;
  }

  boolean hasIdKey(String key) {
    return idKey != null && idKey.equals(key);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SchemaRow)) return false;
    SchemaRow that = (SchemaRow) o;
    return mtime == that.mtime
        && sourceKey.equals(that.sourceKey)
        && Objects.equals(idKey, that.idKey)
        && document.equals(that.document);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceKey, idKey, mtime, document);
  }

  @Override
  public String toString() {
    return "SchemaRow{sourceKey='" + sourceKey + "', idKey=" + idKey + ", mtime=" + mtime + '}';
  }
}
