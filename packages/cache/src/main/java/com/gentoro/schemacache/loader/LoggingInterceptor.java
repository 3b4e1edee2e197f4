package com.gentoro.schemacache.loader;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs every schema request and its outcome at DEBUG. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), request.url());

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received {} for {} in {} ms (Last-Modified: {})",
        response.code(),
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.header("Last-Modified", "-"));
    return response;
  }
}
