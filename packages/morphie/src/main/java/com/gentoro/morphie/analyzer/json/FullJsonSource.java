package com.gentoro.morphie.analyzer.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.morphie.exception.SerializationException;
import com.gentoro.morphie.exception.ValidationException;
import com.gentoro.morphie.utility.JacksonUtility;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Objects of a single JSON document. The document is either an array of objects or an object
 * whose values are the objects, as in {@code {"event_0": {...}, "event_1": {...}}}.
 */
public class FullJsonSource implements JsonSource {
  private final Reader reader;
  private final String description;
  private Iterator<JsonNode> objects;

  public FullJsonSource(Reader reader, String description) {
    this.reader = reader;
    this.description = description;
  }

  @Override
  public String description() {
    return description;
  }

  private Iterator<JsonNode> objects() {
    if (objects == null) {
      JsonNode document;
      try {
        document = JacksonUtility.getJsonMapper().readTree(reader);
      } catch (IOException e) {
        throw new SerializationException("Invalid JSON document in " + description, e);
      }
      if (document == null || document.isMissingNode()) {
        objects = List.<JsonNode>of().iterator();
      } else if (document.isArray() || document.isObject()) {
        List<JsonNode> elements = new ArrayList<>(document.size());
        document.elements().forEachRemaining(elements::add);
        objects = elements.iterator();
      } else {
        throw new ValidationException(
            "Expected a JSON array or object in " + description + " but found " + document);
      }
    }
    return objects;
  }

  @Override
  public boolean hasNext() {
    return objects().hasNext();
  }

  @Override
  public JsonNode next() {
    if (!hasNext()) throw new NoSuchElementException();
    return objects().next();
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
