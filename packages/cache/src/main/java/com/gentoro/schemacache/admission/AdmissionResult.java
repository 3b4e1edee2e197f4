package com.gentoro.schemacache.admission;

import java.util.List;

/** Outcome of a batch admission: ok, or the non-empty list of candidates that failed. */
public final class AdmissionResult {
  private static final AdmissionResult OK = new AdmissionResult(List.of());

  private final List<AdmissionFailure> failures;

  private AdmissionResult(List<AdmissionFailure> failures) {
    this.failures = failures;
  }

  public static AdmissionResult ok() {
    return OK;
  }

  public static AdmissionResult of(List<AdmissionFailure> failures) {
    return failures.isEmpty() ? OK : new AdmissionResult(List.copyOf(failures));
  }

  public boolean isOk() {
    return failures.isEmpty();
  }

  /** Failed candidates in input order; empty when {@link #isOk()}. */
  public List<AdmissionFailure> failures() {
    return failures;
  }

  @Override
  public String toString() {
    return isOk() ? "AdmissionResult{ok}" : "AdmissionResult{failures=" + failures + '}';
  }
}
