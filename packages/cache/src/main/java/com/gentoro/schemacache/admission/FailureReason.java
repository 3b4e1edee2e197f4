package com.gentoro.schemacache.admission;

/** Why a candidate was kept out of the store. */
public enum FailureReason {
  /** The backing file could not be read. */
  READ_ERROR,
  /** The parser could not produce a document. */
  PARSE_ERROR,
  /** The validation predicate returned {@code false}. */
  VALIDATION_REJECTED,
}
