package com.gentoro.schemacache.loader;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.schemacache.SchemaCacheSettings;
import com.gentoro.schemacache.exception.NetworkException;
import java.nio.charset.StandardCharsets;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpSchemaFetcherTest {

  private SchemaHttpServer server;
  private HttpSchemaFetcher fetcher;

  @BeforeEach
  void setUp() throws Exception {
    server = new SchemaHttpServer();
    fetcher = new HttpSchemaFetcher(OkHttpFactory.create(SchemaCacheSettings.defaults()));
  }

  @AfterEach
  void tearDown() {
    server.close();
  }

  @Test
  void lastModifiedHeaderBecomesMtime() {
    String date = "Wed, 21 Oct 2015 07:28:00 GMT";
    long expected =
        ZonedDateTime.parse(date, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant().toEpochMilli();
    server.serve("/s.json", 200, "{\"type\":\"object\"}", date);

    FetchResult result = fetcher.fetch(server.url("/s.json"));

    assertEquals(expected, result.getMtime());
    assertEquals("{\"type\":\"object\"}", new String(result.getBody(), StandardCharsets.UTF_8));
    assertEquals(server.url("/s.json"), result.getSourceKey());
  }

  @Test
  void missingOrGarbledLastModifiedGivesZero() {
    server.serve("/none.json", 200, "{}", null);
    server.serve("/garbled.json", 200, "{}", "yesterday-ish");

    assertEquals(0L, fetcher.fetch(server.url("/none.json")).getMtime());
    assertEquals(0L, fetcher.fetch(server.url("/garbled.json")).getMtime());
  }

  @Test
  void nonOkStatusFails() {
    server.serve("/gone.json", 404, "not here", null);

    NetworkException e =
        assertThrows(NetworkException.class, () -> fetcher.fetch(server.url("/gone.json")));
    assertEquals(404, e.getContext().get("status"));
    assertEquals(server.url("/gone.json"), e.getContext().get("key"));
  }

  @Test
  void otherSuccessStatusesAlsoFail() {
    server.serve("/accepted.json", 202, "{}", null);
    assertThrows(NetworkException.class, () -> fetcher.fetch(server.url("/accepted.json")));
  }

  @Test
  void unreachableHostFails() {
    String url = server.url("/s.json");
    server.close();
    assertThrows(NetworkException.class, () -> fetcher.fetch(url));
  }
}
