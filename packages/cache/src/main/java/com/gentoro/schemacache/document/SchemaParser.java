package com.gentoro.schemacache.document;

import com.fasterxml.jackson.databind.JsonNode;

/** Turns the raw bytes of a schema file into a document. */
@FunctionalInterface
public interface SchemaParser {
  JsonNode parse(byte[] raw) throws Exception;
}
