package com.gentoro.morphie.ast;

import com.gentoro.morphie.exception.TypeMismatchException;

/**
 * A node or edge label: a tag plus a value. The tag selects the type the value is checked against
 * in the graph schema.
 */
public record TaggedValue(String tag, Value value) {
  public TaggedValue {
    if (tag == null || tag.isBlank()) {
      throw new TypeMismatchException("A label tag cannot be null or blank");
    }
    if (value == null) {
      throw new TypeMismatchException("Label '" + tag + "' requires a value");
    }
  }

  public static TaggedValue of(String tag, Value value) {
    return new TaggedValue(tag, value);
  }

  public static TaggedValue of(String tag, String value) {
    return new TaggedValue(tag, Values.of(value));
  }

  public static TaggedValue of(String tag, long value) {
    return new TaggedValue(tag, Values.of(value));
  }
}
