package com.gentoro.schemacache.loader;

/** Fetches the raw content of one canonical source key. */
public interface SchemaFetcher {
  FetchResult fetch(String sourceKey);
}
