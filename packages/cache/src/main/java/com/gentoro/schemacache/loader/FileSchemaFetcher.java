package com.gentoro.schemacache.loader;

import com.gentoro.schemacache.exception.IoException;
import com.gentoro.schemacache.key.KeyCanonicalizer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/** Reads {@code file://} keys from the local filesystem. */
public class FileSchemaFetcher implements SchemaFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(FileSchemaFetcher.class);

  @Override
  public FetchResult fetch(String sourceKey) {
    if (!sourceKey.startsWith(KeyCanonicalizer.FILE_PREFIX)) {
      throw new IllegalArgumentException("Not a file key: " + sourceKey);
    }
    return fetch(Paths.get(sourceKey.substring(KeyCanonicalizer.FILE_PREFIX.length())));
  }

  public FetchResult fetch(Path file) {
    String sourceKey = KeyCanonicalizer.fileKey(file);
    try {
      // mtime first: a write racing with the read leaves the row looking stale, never fresh
      long mtime = lastModified(file);
      byte[] body = Files.readAllBytes(file);
      log.debug("Read {} bytes from {}", body.length, file);
      return new FetchResult(sourceKey, mtime, body);
    } catch (IOException e) {
      throw new IoException("Failed to read schema file: " + file, Map.of("key", sourceKey), e);
    }
  }

  /** Current modification time of {@code file} in epoch milliseconds. */
  public static long lastModified(Path file) throws IOException {
    return Files.getLastModifiedTime(file).toMillis();
  }
}
