package com.gentoro.schemacache.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads, and when missing injects, the identifier a schema declares about itself. The field name
 * is configurable ({@code id} by default, {@code $id} for newer drafts).
 */
public class SchemaIdExtractor {
  public static final String DEFAULT_ID_FIELD = "id";

  private final String idField;

  public SchemaIdExtractor() {
    this(DEFAULT_ID_FIELD);
  }

  public SchemaIdExtractor(String idField) {
    this.idField = Objects.requireNonNull(idField, "idField");
  }

  public String idField() {
    return idField;
  }

  /** The declared identifier, absent when the field is missing, blank or not a string. */
  public Optional<String> extract(JsonNode document) {
    if (document == null || !document.isObject()) return Optional.empty();
    JsonNode id = document.get(idField);
    if (id == null || !id.isTextual() || id.asText().isBlank()) return Optional.empty();
    return Optional.of(id.asText());
  }

  /**
   * Returns {@code document} with its identifier set to {@code sourceKey} when it declares none,
   * so that anonymous schemas remain reachable by identifier. Non-object documents and documents
   * that already carry the field (whatever its value) are returned unchanged.
   */
  public JsonNode injectIfMissing(JsonNode document, String sourceKey) {
    if (document == null || !document.isObject() || document.has(idField)) {
      return document;
    }
    ObjectNode copy = ((ObjectNode) document).deepCopy();
    copy.put(idField, sourceKey);
    return copy;
  }
}
