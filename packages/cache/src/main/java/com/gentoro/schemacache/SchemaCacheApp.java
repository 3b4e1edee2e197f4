package com.gentoro.schemacache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.schemacache.admission.AdmissionFailure;
import com.gentoro.schemacache.admission.AdmissionResult;
import com.gentoro.schemacache.document.SchemaParsers;
import com.gentoro.schemacache.document.SchemaValidators;
import com.gentoro.schemacache.exception.SchemaCacheException;
import com.gentoro.schemacache.logging.LoggingService;
import com.gentoro.schemacache.store.SchemaRow;
import com.gentoro.schemacache.utility.JacksonUtility;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads schema directories into a cache and prints what was cached.
 *
 * <pre>
 * --config &lt;location&gt;   configuration (default classpath:schema-cache.yaml)
 * --path &lt;dir&gt;          directory to load in addition to the configured preload paths
 * --format json|yaml     parser for --path (default: schemacache.preload.format)
 * --mode list|load|help  list cached rows (default), or print the schema named by --key
 * --key &lt;key&gt;           source key or identifier, fetched on a miss
 * </pre>
 */
public class SchemaCacheApp {
  private static final org.slf4j.Logger log = LoggingService.getLogger(SchemaCacheApp.class);

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  static int run(String[] args, PrintStream out) {
    StartupParameters params;
    try {
      params = new StartupParameters(args);
    } catch (IllegalArgumentException e) {
      log.error("Invalid arguments: {}", e.getMessage());
      printUsage(out);
      return 2;
    }
    if ("help".equals(params.mode())) {
      printUsage(out);
      return 0;
    }

    try {
      ConfigurationProvider provider = new ConfigurationProvider(params.configFile());
      LoggingService.applyConfiguration(provider.config());
      SchemaCache cache = new SchemaCache(SchemaCacheSettings.from(provider.config()));

      List<AdmissionResult> results = new ArrayList<>(cache.preload());
      params
          .getOptionalParameter("path")
          .ifPresent(
              path ->
                  results.add(
                      cache.addPath(
                          path,
                          SchemaParsers.forFormat(
                              params
                                  .getOptionalParameter("format")
                                  .orElse(cache.settings().preloadFormat())),
                          SchemaValidators.isJsonObject())));

      if ("load".equals(params.mode())) {
        JsonNode schema = cache.loadUri(params.getOptionalParameter("key").orElseThrow());
        out.println(JacksonUtility.toJson(schema));
      } else {
        out.println(JacksonUtility.toJson(summary(cache.loadAll(), results)));
      }
      return 0;
    } catch (SchemaCacheException e) {
      log.error("Schema cache command failed: {}", e.toString(), e);
      return 1;
    }
  }

  private static ObjectNode summary(List<SchemaRow> rows, List<AdmissionResult> results) {
    ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
    ArrayNode schemas = root.putArray("schemas");
    rows.stream()
        .sorted(Comparator.comparing(SchemaRow::getSourceKey))
        .forEach(
            row -> {
              ObjectNode n = schemas.addObject();
              n.put("sourceKey", row.getSourceKey());
              n.put("id", row.getIdKey().orElse(null));
              n.put("mtime", row.getMtime());
            });
    ArrayNode failures = root.putArray("failures");
    for (AdmissionResult result : results) {
      for (AdmissionFailure failure : result.failures()) {
        ObjectNode n = failures.addObject();
        n.put("sourceKey", failure.getSourceKey());
        n.put("reason", failure.getReason().name());
        if (failure.getCause() != null) {
          n.put("message", failure.getCause().getMessage());
        }
      }
    }
    return root;
  }

  private static void printUsage(PrintStream out) {
    out.println(
        "Usage: schema-cache [--config <location>] [--path <dir>] [--format json|yaml]"
            + " [--mode list|load|help] [--key <key>]");
  }
}
