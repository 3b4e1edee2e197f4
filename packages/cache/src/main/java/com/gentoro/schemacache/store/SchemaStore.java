package com.gentoro.schemacache.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Concurrent table of {@link SchemaRow}s, one row per source key.
 *
 * <p>The backing map is created lazily on first insert; until then every read behaves as if the
 * table were empty and {@link #tableExists()} reports {@code false}, which the directory refresh
 * uses to treat the very first population as a full load. Rows are independent: no operation
 * takes a lock spanning more than one key, and two concurrent inserts for the same source key
 * resolve as last-writer-wins.
 */
public class SchemaStore {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(SchemaStore.class);

  private final AtomicReference<Map<String, SchemaRow>> table = new AtomicReference<>();

  /** Creates the backing table if absent; at most one table is ever installed. */
  public Map<String, SchemaRow> ensureTable() {
    Map<String, SchemaRow> current = table.get();
    if (current != null) return current;
    if (table.compareAndSet(null, new ConcurrentHashMap<>())) {
      log.debug("SchemaStore: table created");
    }
    return table.get();
  }

  public boolean tableExists() {
    return table.get() != null;
  }

  public Optional<SchemaRow> lookupBySource(String sourceKey) {
    Map<String, SchemaRow> rows = table.get();
    if (rows == null) return Optional.empty();
    return Optional.ofNullable(rows.get(sourceKey));
  }

  /** First row whose declared identifier equals {@code idKey}; identifiers are not unique. */
  public Optional<SchemaRow> lookupById(String idKey) {
    Map<String, SchemaRow> rows = table.get();
    if (rows == null) return Optional.empty();
    return rows.values().stream().filter(row -> row.hasIdKey(idKey)).findFirst();
  }

  public void insert(SchemaRow row) {
    ensureTable().put(row.getSourceKey(), row);
    log.trace("SchemaStore: insert {}", row);
  }

  public void deleteBySource(String sourceKey) {
    Map<String, SchemaRow> rows = table.get();
    if (rows != null && rows.remove(sourceKey) != null) {
      log.trace("SchemaStore: deleted source {}", sourceKey);
    }
  }

  public void deleteById(String idKey) {
    Map<String, SchemaRow> rows = table.get();
    if (rows != null && rows.values().removeIf(row -> row.hasIdKey(idKey))) {
      log.trace("SchemaStore: deleted id {}", idKey);
    }
  }

  public List<SchemaRow> listAll() {
    Map<String, SchemaRow> rows = table.get();
    if (rows == null) return List.of();
    return new ArrayList<>(rows.values());
  }
}
