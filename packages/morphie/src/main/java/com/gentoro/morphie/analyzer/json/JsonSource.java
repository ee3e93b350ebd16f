package com.gentoro.morphie.analyzer.json;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.Closeable;
import java.util.Iterator;

/** A sequence of JSON objects read from a document or a stream. */
public interface JsonSource extends Iterator<JsonNode>, Closeable {

  /** Where the objects come from, for log messages. */
  String description();
}
