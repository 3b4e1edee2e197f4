package com.gentoro.schemacache.refresh;

import com.gentoro.schemacache.key.KeyCanonicalizer;
import com.gentoro.schemacache.loader.FileSchemaFetcher;
import com.gentoro.schemacache.store.SchemaRow;
import com.gentoro.schemacache.store.SchemaStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides which files under a directory must be (re)loaded.
 *
 * <p>A file is outdated when it has no row yet, or when its current modification time is
 * strictly greater than the one stored with its row. Equal timestamps are not refreshed. Rows
 * stored with mtime {@code 0} are never outdated.
 */
public class FreshnessChecker {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(FreshnessChecker.class);

  private final SchemaStore store;
  private final DirectoryScanner scanner;

  public FreshnessChecker(SchemaStore store, DirectoryScanner scanner) {
    this.store = Objects.requireNonNull(store, "store");
    this.scanner = Objects.requireNonNull(scanner, "scanner");
  }

  public boolean isOutdated(Path file) {
    Optional<SchemaRow> row = store.lookupBySource(KeyCanonicalizer.fileKey(file));
    if (row.isEmpty()) return true;

    long stored = row.get().getMtime();
    if (stored == SchemaRow.NEVER_STALE) return false;
    try {
      return FileSchemaFetcher.lastModified(file) > stored;
    } catch (IOException e) {
      // vanished since the scan; the subsequent read reports it
      log.debug("Cannot stat {}: {}", file, e.getMessage());
      return true;
    }
  }

  /**
   * Files under {@code root} that need loading. Before the store has ever been populated every
   * file is a candidate.
   */
  public List<Path> listOutdated(Path root) {
    List<Path> files = scanner.listFiles(root);
    if (files.isEmpty() || !store.tableExists()) {
      return files;
    }
    List<Path> outdated = files.stream().filter(this::isOutdated).collect(Collectors.toList());
    log.debug("{} of {} file(s) under {} are outdated", outdated.size(), files.size(), root);
    return outdated;
  }
}
