package com.gentoro.schemacache.loader;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.schemacache.admission.SchemaCandidate;
import com.gentoro.schemacache.document.SchemaIdExtractor;
import com.gentoro.schemacache.document.SchemaParser;
import com.gentoro.schemacache.document.SchemaParsers;
import com.gentoro.schemacache.exception.SchemaParseException;
import com.gentoro.schemacache.exception.UnknownUriSchemeException;
import com.gentoro.schemacache.key.KeyCanonicalizer;
import java.util.Map;
import java.util.Objects;

/**
 * Dispatches a canonical source key to the fetcher registered for its scheme ({@code file},
 * {@code http}, {@code https}) and turns the fetched bytes into an admission candidate.
 */
public class UriLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(UriLoader.class);

  private final Map<String, SchemaFetcher> fetchers;
  private final SchemaParser parser;
  private final SchemaIdExtractor idExtractor;

  public UriLoader(
      SchemaFetcher fileFetcher, SchemaFetcher httpFetcher, SchemaIdExtractor idExtractor) {
    this.fetchers =
        Map.of(
            KeyCanonicalizer.FILE_SCHEME, Objects.requireNonNull(fileFetcher, "fileFetcher"),
            "http", Objects.requireNonNull(httpFetcher, "httpFetcher"),
            "https", httpFetcher);
    this.parser = SchemaParsers.json();
    this.idExtractor = Objects.requireNonNull(idExtractor, "idExtractor");
  }

  /**
   * Fetches the raw content of {@code sourceKey}.
   *
   * @throws UnknownUriSchemeException when the key has no supported scheme
   */
  public FetchResult fetch(String sourceKey) {
    String scheme = KeyCanonicalizer.schemeOf(sourceKey);
    SchemaFetcher fetcher = scheme == null ? null : fetchers.get(scheme);
    if (fetcher == null) {
      throw new UnknownUriSchemeException(sourceKey, scheme);
    }
    log.debug("Fetching {} via {}", sourceKey, fetcher.getClass().getSimpleName());
    return fetcher.fetch(sourceKey);
  }

  /**
   * Fetches and parses {@code sourceKey}. Documents without a declared identifier get one derived
   * from the source key.
   *
   * @throws SchemaParseException when the fetched content is not a parseable document
   */
  public SchemaCandidate load(String sourceKey) {
    FetchResult fetched = fetch(sourceKey);
    JsonNode document;
    try {
      document = parser.parse(fetched.getBody());
    } catch (Exception e) {
      throw new SchemaParseException(sourceKey, e);
    }
    if (document == null || document.isMissingNode()) {
      throw new SchemaParseException(sourceKey, new IllegalStateException("empty document"));
    }
    return SchemaCandidate.parsed(
        sourceKey, fetched.getMtime(), idExtractor.injectIfMissing(document, sourceKey));
  }
}
