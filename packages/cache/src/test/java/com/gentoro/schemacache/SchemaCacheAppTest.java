package com.gentoro.schemacache;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.schemacache.key.KeyCanonicalizer;
import com.gentoro.schemacache.utility.JacksonUtility;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchemaCacheAppTest {

  @TempDir Path dir;

  private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
  private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

  private String output() {
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(0, SchemaCacheApp.run(new String[] {"--mode", "help"}, out));
    assertTrue(output().startsWith("Usage: schema-cache"));
  }

  @Test
  void invalidArgumentsExitWithTwo() {
    assertEquals(2, SchemaCacheApp.run(new String[] {"--mode", "load"}, out));
    assertTrue(output().contains("Usage"));
  }

  @Test
  void listSummarizesRowsAndFailures() throws Exception {
    Path good = dir.resolve("good.json");
    Files.writeString(good, "{\"id\":\"urn:good\"}");
    Path bad = dir.resolve("bad.json");
    Files.writeString(bad, "{ nope");

    int code = SchemaCacheApp.run(new String[] {"--path", dir.toString()}, out);

    assertEquals(0, code);
    JsonNode summary = JacksonUtility.getJsonMapper().readTree(output());
    assertEquals(1, summary.get("schemas").size());
    JsonNode row = summary.get("schemas").get(0);
    assertEquals(KeyCanonicalizer.fileKey(good), row.get("sourceKey").asText());
    assertEquals("urn:good", row.get("id").asText());
    assertEquals(Files.getLastModifiedTime(good).toMillis(), row.get("mtime").asLong());
    JsonNode failure = summary.get("failures").get(0);
    assertEquals(KeyCanonicalizer.fileKey(bad), failure.get("sourceKey").asText());
    assertEquals("PARSE_ERROR", failure.get("reason").asText());
  }

  @Test
  void yamlFormatAppliesToPath() throws Exception {
    Files.writeString(dir.resolve("s.yaml"), "type: object\n");

    int code =
        SchemaCacheApp.run(new String[] {"--path", dir.toString(), "--format", "yaml"}, out);

    assertEquals(0, code);
    JsonNode summary = JacksonUtility.getJsonMapper().readTree(output());
    assertEquals(1, summary.get("schemas").size());
    assertEquals(0, summary.get("failures").size());
  }

  @Test
  void loadPrintsTheSchema() throws Exception {
    Path schema = dir.resolve("s.json");
    Files.writeString(schema, "{\"type\":\"object\"}");

    int code =
        SchemaCacheApp.run(new String[] {"--mode", "load", "--key", schema.toString()}, out);

    assertEquals(1, code, "bare paths are opaque keys with no scheme");

    bytes.reset();
    code =
        SchemaCacheApp.run(
            new String[] {"--mode", "load", "--key", KeyCanonicalizer.fileKey(schema)}, out);
    assertEquals(0, code);
    JsonNode printed = JacksonUtility.getJsonMapper().readTree(output());
    assertEquals("object", printed.get("type").asText());
    assertEquals(KeyCanonicalizer.fileKey(schema), printed.get("id").asText());
  }

  @Test
  void missingConfigurationExitsWithOne() {
    String config = dir.resolve("missing.yaml").toString();
    assertEquals(1, SchemaCacheApp.run(new String[] {"--config", config}, out));
  }

  @Test
  void unknownFormatIsAnArgumentError() {
    assertEquals(
        2,
        SchemaCacheApp.run(new String[] {"--path", dir.toString(), "--format", "xml"}, out));
    assertTrue(output().contains("Usage"));
  }
}
