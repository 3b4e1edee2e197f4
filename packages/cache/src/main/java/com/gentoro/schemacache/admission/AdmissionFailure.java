package com.gentoro.schemacache.admission;

import java.util.Objects;

/** A candidate that did not make it into the store, with enough context to retry or report. */
public final class AdmissionFailure {
  private final String sourceKey;
  private final long mtime;
  private final FailureReason reason;
  private final Throwable cause;

  public AdmissionFailure(String sourceKey, long mtime, FailureReason reason, Throwable cause) {
    this.sourceKey = Objects.requireNonNull(sourceKey, "sourceKey");
    this.mtime = mtime;
    this.reason = Objects.requireNonNull(reason, "reason");
    this.cause = cause;
  }

  public String getSourceKey() {
    return sourceKey;
  }

  public long getMtime() {
    return mtime;
  }

  public FailureReason getReason() {
    return reason;
  }

  /** Underlying read or parse error; {@code null} for validation rejections. */
  public Throwable getCause() {
    return cause;
  }

  @Override
  public String toString() {
    return "AdmissionFailure{sourceKey='"
        + sourceKey
        + "', mtime="
        + mtime
        + ", reason="
        + reason
        + (cause == null ? "" : ", cause=" + cause)
        + '}';
  }
}
