package com.gentoro.morphie.analyzer.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.gentoro.morphie.exception.SerializationException;
import com.gentoro.morphie.utility.JacksonUtility;
import java.io.IOException;
import java.io.Reader;
import java.util.NoSuchElementException;

/** A stream of JSON objects, typically one per line. Objects are parsed one at a time. */
public class StreamJsonSource implements JsonSource {
  private final Reader reader;
  private final String description;
  private MappingIterator<JsonNode> objects;

  public StreamJsonSource(Reader reader, String description) {
    this.reader = reader;
    this.description = description;
  }

  @Override
  public String description() {
    return description;
  }

  private MappingIterator<JsonNode> objects() {
    if (objects == null) {
      try {
        objects = JacksonUtility.getJsonMapper().readerFor(JsonNode.class).readValues(reader);
      } catch (IOException e) {
        throw new SerializationException("Invalid JSON stream in " + description, e);
      }
    }
    return objects;
  }

  @Override
  public boolean hasNext() {
    try {
      return objects().hasNextValue();
    } catch (IOException e) {
      throw new SerializationException("Invalid JSON stream in " + description, e);
    }
  }

  @Override
  public JsonNode next() {
    if (!hasNext()) throw new NoSuchElementException();
    try {
      return objects().nextValue();
    } catch (IOException e) {
      throw new SerializationException("Invalid JSON stream in " + description, e);
    }
  }

  @Override
  public void close() throws IOException {
    if (objects != null) objects.close();
    reader.close();
  }
}
