package com.gentoro.schemacache.refresh;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.gentoro.schemacache.key.KeyCanonicalizer;
import com.gentoro.schemacache.store.SchemaRow;
import com.gentoro.schemacache.store.SchemaStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FreshnessCheckerTest {

  private static final long T0 = 1_600_000_000_000L;

  @TempDir Path dir;

  private SchemaStore store;
  private FreshnessChecker checker;

  @BeforeEach
  void setUp() {
    store = new SchemaStore();
    checker = new FreshnessChecker(store, new DirectoryScanner());
  }

  private Path file(String name, long mtime) throws Exception {
    Path p = Files.writeString(dir.resolve(name), "{}");
    Files.setLastModifiedTime(p, FileTime.fromMillis(mtime));
    return p;
  }

  private void cache(Path file, long mtime) {
    store.insert(
        new SchemaRow(
            KeyCanonicalizer.fileKey(file), null, mtime, JsonNodeFactory.instance.objectNode()));
  }

  @Test
  void uncachedFileIsOutdated() throws Exception {
    assertTrue(checker.isOutdated(file("a.json", T0)));
  }

  @Test
  void equalMtimeIsFresh() throws Exception {
    Path a = file("a.json", T0);
    cache(a, T0);
    assertFalse(checker.isOutdated(a));
  }

  @Test
  void olderMtimeIsFresh() throws Exception {
    Path a = file("a.json", T0 - 1000);
    cache(a, T0);
    assertFalse(checker.isOutdated(a));
  }

  @Test
  void strictlyNewerMtimeIsOutdated() throws Exception {
    Path a = file("a.json", T0 + 1000);
    cache(a, T0);
    assertTrue(checker.isOutdated(a));
  }

  @Test
  void rowsWithZeroMtimeNeverGoStale() throws Exception {
    Path a = file("a.json", T0);
    cache(a, SchemaRow.NEVER_STALE);
    assertFalse(checker.isOutdated(a));
  }

  @Test
  void firstPopulationListsEveryFile() throws Exception {
    file("a.json", T0);
    file("b.json", T0);
    assertFalse(store.tableExists());
    assertEquals(2, checker.listOutdated(dir).size());
  }

  @Test
  void laterScansListOnlyOutdatedFiles() throws Exception {
    Path a = file("a.json", T0);
    Path b = file("b.json", T0 + 5000);
    Path c = file("c.json", T0);
    cache(a, T0);
    cache(b, T0);

    assertEquals(List.of(b.toAbsolutePath(), c.toAbsolutePath()), checker.listOutdated(dir));
  }
}
