package com.gentoro.schemacache.loader;

import com.gentoro.schemacache.exception.NetworkException;
import java.io.IOException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Fetches {@code http://} and {@code https://} keys with a single GET. Anything but a 200
 * response fails the fetch; there are no retries. The modification time comes from the
 * {@code Last-Modified} header, or is {@code 0} when the header is absent or unparseable.
 */
public class HttpSchemaFetcher implements SchemaFetcher {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(HttpSchemaFetcher.class);

  private final OkHttpClient client;

  public HttpSchemaFetcher(OkHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public FetchResult fetch(String sourceKey) {
    Request request;
    try {
      request = new Request.Builder().url(sourceKey).get().build();
    } catch (IllegalArgumentException e) {
      throw new NetworkException("Invalid HTTP URL: " + sourceKey, Map.of("key", sourceKey), e);
    }

    try (Response response = client.newCall(request).execute()) {
      if (response.code() != 200) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("key", sourceKey);
        ctx.put("status", response.code());
        throw new NetworkException(
            "Unexpected HTTP status " + response.code() + " fetching " + sourceKey, ctx);
      }
      ResponseBody body = response.body();
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      long mtime = lastModified(response);
      log.debug("Fetched {} bytes from {} (mtime {})", bytes.length, sourceKey, mtime);
      return new FetchResult(sourceKey, mtime, bytes);
    } catch (IOException e) {
      throw new NetworkException("Failed to fetch " + sourceKey, Map.of("key", sourceKey), e);
    }
  }

  private static long lastModified(Response response) {
    Date date = response.headers().getDate("Last-Modified");
    return date == null ? 0L : date.getTime();
  }
}
