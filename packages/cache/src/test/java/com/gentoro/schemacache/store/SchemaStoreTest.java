package com.gentoro.schemacache.store;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaStoreTest {

  private SchemaStore store;

  @BeforeEach
  void setUp() {
    store = new SchemaStore();
  }

  private static JsonNode doc(String title) {
    return JsonNodeFactory.instance.objectNode().put("title", title);
  }

  @Test
  void readsOnMissingTableAreEmpty() {
    assertFalse(store.tableExists());
    assertTrue(store.lookupBySource("k").isEmpty());
    assertTrue(store.lookupById("k").isEmpty());
    assertTrue(store.listAll().isEmpty());

    store.deleteBySource("k");
    store.deleteById("k");
    assertFalse(store.tableExists(), "reads and deletes must not create the table");
  }

  @Test
  void ensureTableIsIdempotent() {
    Map<String, SchemaRow> first = store.ensureTable();
    Map<String, SchemaRow> second = store.ensureTable();
    assertSame(first, second);
    assertTrue(store.tableExists());
  }

  @Test
  void concurrentFirstUseCreatesSingleTable() throws Exception {
    int threads = 16;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    Set<Map<String, SchemaRow>> seen = ConcurrentHashMap.newKeySet();
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  seen.add(store.ensureTable());
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, seen.size());
  }

  @Test
  void insertOverwritesBySourceKey() {
    store.insert(new SchemaRow("k", "id-1", 0, doc("one")));
    store.insert(new SchemaRow("k", "id-2", 5, doc("two")));

    assertEquals(1, store.listAll().size());
    SchemaRow row = store.lookupBySource("k").orElseThrow();
    assertEquals("two", row.getDocument().get("title").asText());
    assertEquals(5, row.getMtime());
    assertTrue(store.lookupById("id-1").isEmpty());
    assertTrue(store.lookupById("id-2").isPresent());
  }

  @Test
  void rowsWithoutIdAreOnlyReachableBySource() {
    store.insert(new SchemaRow("k", null, 0, doc("anonymous")));
    assertTrue(store.lookupBySource("k").isPresent());
    assertTrue(store.lookupById("k").isEmpty());
  }

  @Test
  void deleteByIdRemovesEveryRowSharingTheId() {
    store.insert(new SchemaRow("a", "shared", 0, doc("a")));
    store.insert(new SchemaRow("b", "shared", 0, doc("b")));
    store.insert(new SchemaRow("c", "other", 0, doc("c")));

    store.deleteById("shared");

    assertEquals(1, store.listAll().size());
    assertTrue(store.lookupBySource("c").isPresent());
  }

  @Test
  void deleteBySourceLeavesOtherRows() {
    store.insert(new SchemaRow("a", null, 0, doc("a")));
    store.insert(new SchemaRow("b", null, 0, doc("b")));

    store.deleteBySource("a");
    store.deleteBySource("missing");

    assertTrue(store.lookupBySource("a").isEmpty());
    assertTrue(store.lookupBySource("b").isPresent());
  }

  @Test
  void listAllIsASnapshot() {
    store.insert(new SchemaRow("a", null, 0, doc("a")));
    List<SchemaRow> snapshot = store.listAll();
    store.insert(new SchemaRow("b", null, 0, doc("b")));
    assertEquals(1, snapshot.size());
  }
}
