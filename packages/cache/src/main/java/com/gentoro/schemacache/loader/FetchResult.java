package com.gentoro.schemacache.loader;

import java.util.Objects;

/** Raw bytes of a schema together with the modification time observed when fetching it. */
public final class FetchResult {
  private final String sourceKey;
  private final long mtime;
  private final byte[] body;

  public FetchResult(String sourceKey, long mtime, byte[] body) {
    this.sourceKey = Objects.requireNonNull(sourceKey, "sourceKey");
    this.mtime = mtime;
    this.body = Objects.requireNonNull(body, "body");
  }

  public String getSourceKey() {
    return sourceKey;
  }

  public long getMtime() {
    return mtime;
  }

  public byte[] getBody() {
    return body;
  }

  @Override
  public String toString() {
    return "FetchResult{sourceKey='"
        + sourceKey
        + "', mtime="
        + mtime
        + ", bytes="
        + body.length
        + '}';
  }
}
