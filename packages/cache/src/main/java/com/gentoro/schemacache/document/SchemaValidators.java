package com.gentoro.schemacache.document;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.Predicate;

public final class SchemaValidators {
  private SchemaValidators() {}

  /** Admits only JSON objects; the container check applied to every URI load. */
  public static Predicate<JsonNode> isJsonObject() {
    return document -> document != null && document.isObject();
  }

  public static Predicate<JsonNode> any() {
    return document -> document != null;
  }
}
