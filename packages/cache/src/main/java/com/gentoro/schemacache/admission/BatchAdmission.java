package com.gentoro.schemacache.admission;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.schemacache.document.SchemaIdExtractor;
import com.gentoro.schemacache.store.SchemaRow;
import com.gentoro.schemacache.store.SchemaStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Validates candidates one by one and inserts the admissible ones into the store. A rejected or
 * unreadable candidate is reported and never stops the rest of the batch; rows are inserted
 * independently of each other, in input order. A validator that throws rejects the document it
 * was given, with the exception as cause.
 */
public class BatchAdmission {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(BatchAdmission.class);

  private final SchemaStore store;
  private final SchemaIdExtractor idExtractor;

  public BatchAdmission(SchemaStore store, SchemaIdExtractor idExtractor) {
    this.store = Objects.requireNonNull(store, "store");
    this.idExtractor = Objects.requireNonNull(idExtractor, "idExtractor");
  }

  public AdmissionResult admit(List<SchemaCandidate> candidates, Predicate<JsonNode> validate) {
    Objects.requireNonNull(validate, "validate");
    List<AdmissionFailure> failures = new ArrayList<>();
    for (SchemaCandidate candidate : candidates) {
      AdmissionFailure failure = admitOne(candidate, validate);
      if (failure != null) {
        log.warn("Schema {} not admitted: {}", candidate.getSourceKey(), failure.getReason());
        failures.add(failure);
      }
    }
    log.debug(
        "Admitted {} of {} candidate(s)", candidates.size() - failures.size(), candidates.size());
    return AdmissionResult.of(failures);
  }

  private AdmissionFailure admitOne(SchemaCandidate candidate, Predicate<JsonNode> validate) {
    if (candidate.getFailure().isPresent()) {
      return new AdmissionFailure(
          candidate.getSourceKey(),
          candidate.getMtime(),
          candidate.getFailure().get(),
          candidate.getCause());
    }
    JsonNode document = candidate.getDocument().orElseThrow();
    boolean valid;
    try {
      valid = validate.test(document);
    } catch (RuntimeException e) {
      return new AdmissionFailure(
          candidate.getSourceKey(), candidate.getMtime(), FailureReason.VALIDATION_REJECTED, e);
    }
    if (!valid) {
      return new AdmissionFailure(
          candidate.getSourceKey(), candidate.getMtime(), FailureReason.VALIDATION_REJECTED, null);
    }
    SchemaRow row =
        new SchemaRow(
            candidate.getSourceKey(),
            idExtractor.extract(document).orElse(null),
            candidate.getMtime(),
            document);
    store.insert(row);
    log.debug("Admitted schema {}", row);
    return null;
  }
}
