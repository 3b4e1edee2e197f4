package com.gentoro.schemacache.document;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.schemacache.exception.ValidationException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class SchemaIdExtractorTest {

  private static JsonNode json(String text) throws Exception {
    return SchemaParsers.json().parse(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void extractsDeclaredIdentifier() throws Exception {
    SchemaIdExtractor ids = new SchemaIdExtractor();
    assertEquals("http://x/s#", ids.extract(json("{\"id\":\"http://x/s#\"}")).orElseThrow());
  }

  @Test
  void identifierIsAbsentWhenMissingBlankOrNotAString() throws Exception {
    SchemaIdExtractor ids = new SchemaIdExtractor();
    assertTrue(ids.extract(json("{\"type\":\"object\"}")).isEmpty());
    assertTrue(ids.extract(json("{\"id\":\"  \"}")).isEmpty());
    assertTrue(ids.extract(json("{\"id\":42}")).isEmpty());
    assertTrue(ids.extract(json("[1,2]")).isEmpty());
    assertTrue(ids.extract(null).isEmpty());
  }

  @Test
  void honoursConfiguredField() throws Exception {
    SchemaIdExtractor ids = new SchemaIdExtractor("$id");
    JsonNode doc = json("{\"id\":\"old\",\"$id\":\"new\"}");
    assertEquals("new", ids.extract(doc).orElseThrow());
  }

  @Test
  void injectsSourceKeyIntoAnonymousObjects() throws Exception {
    SchemaIdExtractor ids = new SchemaIdExtractor();
    JsonNode original = json("{\"type\":\"string\"}");

    JsonNode injected = ids.injectIfMissing(original, "file:///tmp/a.json");

    assertEquals("file:///tmp/a.json", injected.get("id").asText());
    assertFalse(original.has("id"), "the input document is not modified");
  }

  @Test
  void leavesDeclaredAndNonObjectDocumentsAlone() throws Exception {
    SchemaIdExtractor ids = new SchemaIdExtractor();
    JsonNode declared = json("{\"id\":\"mine\"}");
    JsonNode numeric = json("{\"id\":7}");
    JsonNode array = json("[]");

    assertSame(declared, ids.injectIfMissing(declared, "k"));
    assertSame(numeric, ids.injectIfMissing(numeric, "k"));
    assertSame(array, ids.injectIfMissing(array, "k"));
  }

  @Test
  void parsersByFormat() throws Exception {
    byte[] raw = "id: y\ntype: object\n".getBytes(StandardCharsets.UTF_8);
    JsonNode yaml = SchemaParsers.forFormat("YAML").parse(raw);
    assertEquals("y", yaml.get("id").asText());
    assertThrows(ValidationException.class, () -> SchemaParsers.forFormat("xml"));
  }

  @Test
  void jsonObjectValidator() throws Exception {
    assertTrue(SchemaValidators.isJsonObject().test(json("{}")));
    assertFalse(SchemaValidators.isJsonObject().test(json("\"text\"")));
    assertFalse(SchemaValidators.isJsonObject().test(null));
  }
}
