package com.gentoro.schemacache;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.schemacache.admission.AdmissionResult;
import com.gentoro.schemacache.admission.BatchAdmission;
import com.gentoro.schemacache.admission.FailureReason;
import com.gentoro.schemacache.admission.SchemaCandidate;
import com.gentoro.schemacache.document.SchemaIdExtractor;
import com.gentoro.schemacache.document.SchemaParser;
import com.gentoro.schemacache.document.SchemaParsers;
import com.gentoro.schemacache.document.SchemaValidators;
import com.gentoro.schemacache.exception.IoException;
import com.gentoro.schemacache.exception.SchemaNotFoundException;
import com.gentoro.schemacache.exception.ValidationException;
import com.gentoro.schemacache.key.KeyCanonicalizer;
import com.gentoro.schemacache.loader.FetchResult;
import com.gentoro.schemacache.loader.FileSchemaFetcher;
import com.gentoro.schemacache.loader.HttpSchemaFetcher;
import com.gentoro.schemacache.loader.OkHttpFactory;
import com.gentoro.schemacache.loader.SchemaFetcher;
import com.gentoro.schemacache.loader.UriLoader;
import com.gentoro.schemacache.refresh.DirectoryScanner;
import com.gentoro.schemacache.refresh.FreshnessChecker;
import com.gentoro.schemacache.store.SchemaRow;
import com.gentoro.schemacache.store.SchemaStore;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Runtime cache of schema definitions, addressable both by the location they were loaded from
 * (source key) and by the identifier they declare about themselves.
 *
 * <p>File-backed schemas remember the modification time of their file; {@link #addPath} only
 * re-reads files whose modification time has advanced since they were cached. Schemas added with
 * {@link #add} carry mtime {@code 0} and are never refreshed by a directory scan; the only way to
 * update them is to add them again.
 *
 * <p>All operations are safe to call concurrently. Concurrent admissions of the same source key
 * resolve as last-writer-wins.
 */
public class SchemaCache {
  private static final org.slf4j.Logger log =
      com.gentoro.schemacache.logging.LoggingService.getLogger(SchemaCache.class);

  private static volatile SchemaCache DEFAULT;

  private final SchemaCacheSettings settings;
  private final SchemaStore store;
  private final SchemaIdExtractor idExtractor;
  private final FileSchemaFetcher fileFetcher;
  private final UriLoader loader;
  private final FreshnessChecker freshness;
  private final BatchAdmission admission;

  public SchemaCache() {
    this(SchemaCacheSettings.defaults());
  }

  public SchemaCache(SchemaCacheSettings settings) {
    this(
        settings,
        new SchemaStore(),
        new HttpSchemaFetcher(OkHttpFactory.create(Objects.requireNonNull(settings, "settings"))));
  }

  /** Wires a cache over an explicit store and HTTP fetcher. */
  public SchemaCache(SchemaCacheSettings settings, SchemaStore store, SchemaFetcher httpFetcher) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.store = Objects.requireNonNull(store, "store");
    this.idExtractor = new SchemaIdExtractor(settings.idField());
    this.fileFetcher = new FileSchemaFetcher();
    this.loader = new UriLoader(fileFetcher, httpFetcher, idExtractor);
    this.freshness = new FreshnessChecker(store, new DirectoryScanner());
    this.admission = new BatchAdmission(store, idExtractor);
  }

  /**
   * The process-wide cache, created on first use from {@code classpath:schema-cache.yaml} (or
   * defaults when that resource is absent). At most one instance is ever created.
   */
  public static SchemaCache getDefault() {
    SchemaCache cache = DEFAULT;
    if (cache == null) {
      synchronized (SchemaCache.class) {
        cache = DEFAULT;
        if (cache == null) {
          ConfigurationProvider provider =
              new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION);
          cache = new SchemaCache(SchemaCacheSettings.from(provider.config()));
          DEFAULT = cache;
        }
      }
    }
    return cache;
  }

  public SchemaCacheSettings settings() {
    return settings;
  }

  /**
   * Stores {@code document} under {@code key}, replacing any schema previously stored under the
   * same key. The document is admitted only if {@code validate} accepts it.
   */
  public AdmissionResult add(String key, JsonNode document, Predicate<JsonNode> validate) {
    if (document == null) {
      throw new ValidationException("Schema document must not be null");
    }
    String sourceKey = KeyCanonicalizer.canonicalize(key, null);
    return admission.admit(
        List.of(SchemaCandidate.parsed(sourceKey, SchemaRow.NEVER_STALE, document)), validate);
  }

  /**
   * Fetches the schema at {@code key} ({@code file:}, {@code http:} or {@code https:}) and stores
   * it if it is a JSON object. Fetch and parse errors are thrown, nothing is stored in that case.
   */
  public AdmissionResult addUri(String key) {
    String sourceKey = KeyCanonicalizer.canonicalize(key, null);
    SchemaCandidate candidate = loader.load(sourceKey);
    return admission.admit(List.of(candidate), SchemaValidators.isJsonObject());
  }

  /**
   * Loads every outdated file under {@code path}, parsing each with {@code parse} and storing
   * those accepted by {@code validate}. Files that cannot be read or parsed, and rejected
   * documents, are reported in the result without interrupting the scan.
   */
  public AdmissionResult addPath(String path, SchemaParser parse, Predicate<JsonNode> validate) {
    Objects.requireNonNull(parse, "parse");
    String rootKey = KeyCanonicalizer.canonicalize(path, KeyCanonicalizer.FILE_SCHEME);
    if (!rootKey.startsWith(KeyCanonicalizer.FILE_PREFIX)) {
      throw new ValidationException("Not a filesystem path: " + path);
    }
    Path root = Paths.get(rootKey.substring(KeyCanonicalizer.FILE_PREFIX.length()));

    List<SchemaCandidate> candidates =
        freshness.listOutdated(root).stream()
            .map(file -> readCandidate(file, parse))
            .collect(Collectors.toList());
    AdmissionResult result = admission.admit(candidates, validate);
    log.info(
        "Refreshed {}: {} candidate(s), {} failure(s)",
        root,
        candidates.size(),
        result.failures().size());
    return result;
  }

  /** Runs {@link #addPath} over every configured preload directory. */
  public List<AdmissionResult> preload() {
    SchemaParser parser = SchemaParsers.forFormat(settings.preloadFormat());
    List<AdmissionResult> results = new ArrayList<>();
    for (String path : settings.preloadPaths()) {
      results.add(addPath(path, parser, SchemaValidators.isJsonObject()));
    }
    return results;
  }

  /**
   * The schema stored under source key {@code key}, or else the one declaring {@code key} as its
   * identifier.
   *
   * @throws SchemaNotFoundException when neither matches
   */
  public JsonNode load(String key) {
    String canonical = KeyCanonicalizer.canonicalize(key, null);
    return find(canonical).orElseThrow(() -> new SchemaNotFoundException(canonical));
  }

  /** Non-throwing variant of {@link #load}. */
  public Optional<JsonNode> find(String key) {
    String canonical = KeyCanonicalizer.canonicalize(key, null);
    return store
        .lookupBySource(canonical)
        .or(() -> store.lookupById(canonical))
        .map(SchemaRow::getDocument);
  }

  /**
   * Like {@link #load}, but on a miss fetches {@code key} once through {@link #addUri} and looks it
   * up again. Fetch errors propagate unchanged.
   */
  public JsonNode loadUri(String key) {
    String canonical = KeyCanonicalizer.canonicalize(key, null);
    Optional<JsonNode> cached = find(canonical);
    if (cached.isPresent()) {
      return cached.get();
    }
    log.debug("Schema {} not cached; fetching", canonical);
    addUri(canonical);
    return load(canonical);
  }

  /** Every stored row, in no particular order. */
  public List<SchemaRow> loadAll() {
    return store.listAll();
  }

  /** Removes the schema stored under, or declaring the identifier, {@code key}. */
  public void delete(String key) {
    String canonical = KeyCanonicalizer.canonicalize(key, null);
    store.deleteBySource(canonical);
    store.deleteById(canonical);
    log.debug("Deleted schema(s) matching {}", canonical);
  }

  private SchemaCandidate readCandidate(Path file, SchemaParser parse) {
    String sourceKey = KeyCanonicalizer.fileKey(file);
    FetchResult fetched;
    try {
      fetched = fileFetcher.fetch(file);
    } catch (IoException e) {
      return SchemaCandidate.failed(
          sourceKey, SchemaRow.NEVER_STALE, FailureReason.READ_ERROR, e);
    }

    JsonNode document;
    try {
      document = parse.parse(fetched.getBody());
    } catch (Exception e) {
      return SchemaCandidate.failed(sourceKey, fetched.getMtime(), FailureReason.PARSE_ERROR, e);
    }
    if (document == null || document.isMissingNode()) {
      return SchemaCandidate.failed(
          sourceKey,
          fetched.getMtime(),
          FailureReason.PARSE_ERROR,
          new IllegalStateException("empty document"));
    }
    return SchemaCandidate.parsed(
        sourceKey, fetched.getMtime(), idExtractor.injectIfMissing(document, sourceKey));
  }
}
