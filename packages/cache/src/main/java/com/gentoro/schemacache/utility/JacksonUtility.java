package com.gentoro.schemacache.utility;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gentoro.schemacache.exception.SchemaCacheErrorCode;
import com.gentoro.schemacache.exception.SchemaCacheException;

public class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  // a schema file holds exactly one document
  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private static final ObjectMapper PRETTY_MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  /** Pretty-printed JSON, used for command line output. */
  public static String toJson(Object object) {
    try {
      return PRETTY_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SchemaCacheException(
          SchemaCacheErrorCode.SERIALIZATION_ERROR, "Failed to serialize object to JSON", e);
    }
  }
}
