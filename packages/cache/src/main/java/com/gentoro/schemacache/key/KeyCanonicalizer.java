package com.gentoro.schemacache.key;

import com.gentoro.schemacache.exception.ValidationException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Normalizes caller supplied keys into canonical source keys.
 *
 * <ul>
 *   <li>{@code file://} keys get an absolute, normalized path ({@code .} and {@code ..} removed);
 *       {@code file:/path} is accepted as the same key as {@code file:///path}
 *   <li>keys with any other scheme are returned as given
 *   <li>keys without scheme become {@code file://<absolute path>} when the default scheme is
 *       {@code file}, and are kept as opaque keys when no default scheme is given
 * </ul>
 */
public final class KeyCanonicalizer {
  public static final String FILE_SCHEME = "file";
  public static final String FILE_PREFIX = "file://";

  private static final String SCHEME_SEPARATOR = "://";

  private KeyCanonicalizer() {}

  public static String canonicalize(String rawKey, String defaultScheme) {
    if (rawKey == null || rawKey.isBlank()) {
      throw new ValidationException("Schema key must not be blank");
    }
    String key = rawKey.trim();

    String scheme = schemeOf(key);
    if (scheme != null) {
      if (FILE_SCHEME.equals(scheme)) {
        return toFileKey(key.substring(FILE_PREFIX.length()));
      }
      return key;
    }
    if (key.regionMatches(true, 0, "file:", 0, 5)) {
      // file:/abs/path, the single-slash form of a file URI
      String path = key.substring(5);
      if (!path.startsWith("/")) {
        throw new ValidationException("File URI must carry an absolute path: " + key);
      }
      return toFileKey(path);
    }
    if (FILE_SCHEME.equals(defaultScheme)) {
      return toFileKey(key);
    }
    return key;
  }

  /** Builds the source key a file on disk is cached under. */
  public static String fileKey(Path file) {
    return FILE_PREFIX + file.toAbsolutePath().normalize();
  }

  /** Lower-cased scheme of {@code key}, or {@code null} when the key carries none. */
  public static String schemeOf(String key) {
    int idx = key.indexOf(SCHEME_SEPARATOR);
    if (idx <= 0) return null;
    String candidate = key.substring(0, idx);
    if (!Character.isLetter(candidate.charAt(0))) return null;
    for (int i = 1; i < candidate.length(); i++) {
      char c = candidate.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '+' && c != '-' && c != '.') return null;
    }
    return candidate.toLowerCase(Locale.ROOT);
  }

  private static String toFileKey(String path) {
    if (path.isEmpty()) {
      throw new ValidationException("File key has an empty path");
    }
    try {
      return fileKey(Paths.get(path));
    } catch (InvalidPathException e) {
      throw new ValidationException("Invalid file path in key: " + path);
    }
  }
}
