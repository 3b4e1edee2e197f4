package com.gentoro.schemacache.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/** The key uses a scheme the loader cannot fetch (only file, http and https are supported). */
public class UnknownUriSchemeException extends SchemaCacheException {
  private final String key;

  public UnknownUriSchemeException(String key, String scheme) {
    super(
        SchemaCacheErrorCode.UNKNOWN_URI_SCHEME,
        "Unknown URI scheme for key: " + key,
        context(key, scheme));
    this.key = key;
  }

  public String getKey() {
    return key;
  }

  private static Map<String, Object> context(String key, String scheme) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("key", key);
    if (scheme != null) m.put("scheme", scheme);
    return m;
  }
}
