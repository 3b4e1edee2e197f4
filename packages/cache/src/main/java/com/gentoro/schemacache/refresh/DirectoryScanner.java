package com.gentoro.schemacache.refresh;

import com.gentoro.schemacache.exception.IoException;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/** Recursively lists the regular files below a root directory, whatever their extension. */
public class DirectoryScanner {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(DirectoryScanner.class);

  /**
   * Absolute, normalized paths of every regular file under {@code root}, sorted. A root that is
   * itself a regular file yields just that file; a missing root yields nothing. Entries that
   * cannot be visited (unreadable directories, symbolic link cycles) are logged and skipped.
   */
  public List<Path> listFiles(Path root) {
    Path dir = root.toAbsolutePath().normalize();
    if (Files.isRegularFile(dir)) {
      return List.of(dir);
    }
    if (!Files.isDirectory(dir)) {
      log.debug("Nothing to scan at {}", dir);
      return List.of();
    }
    Collector collector = new Collector();
    try {
      Files.walkFileTree(
          dir, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, collector);
    } catch (IOException e) {
      throw new IoException("Failed to scan directory: " + dir, e);
    }
    List<Path> files = collector.files;
    Collections.sort(files);
    log.debug("Found {} file(s) under {}", files.size(), dir);
    return files;
  }

  static final class Collector extends SimpleFileVisitor<Path> {
    final List<Path> files = new ArrayList<>();

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      if (attrs.isRegularFile()) {
        files.add(file.toAbsolutePath().normalize());
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException e) {
      log.warn("Skipping {}: {}", file, e.toString());
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException e) {
      if (e != null) {
        log.warn("Listing of {} stopped early: {}", dir, e.toString());
      }
      return FileVisitResult.CONTINUE;
    }
  }
}
