package com.gentoro.schemacache.loader;

import com.gentoro.schemacache.SchemaCacheSettings;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(SchemaCacheSettings settings) {
    return new OkHttpClient.Builder()
        .connectTimeout(settings.connectTimeoutSeconds(), TimeUnit.SECONDS)
        .readTimeout(settings.readTimeoutSeconds(), TimeUnit.SECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
