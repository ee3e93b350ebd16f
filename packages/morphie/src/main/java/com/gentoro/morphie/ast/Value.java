package com.gentoro.morphie.ast;

import com.gentoro.morphie.exception.TypeMismatchException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An instance of exactly one {@link Type}.
 *
 * <p>Every variant validates its content on construction, so a value that exists is well typed.
 * Values are immutable and compare structurally, including the type they were built with: an
 * {@code IntValue} is never equal to a present {@code NullableValue} wrapping the same number.
 */
public sealed interface Value
    permits Value.BoolValue,
        Value.IntValue,
        Value.StringValue,
        Value.NullableValue,
        Value.TaggedUnionValue,
        Value.CompositeValue {

  /** The type this value was built with. */
  Type type();

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive match over the value variants. */
  interface Visitor<R> {
    R visitBool(BoolValue value);

    R visitInt(IntValue value);

    R visitString(StringValue value);

    R visitNullable(NullableValue value);

    R visitTagged(TaggedUnionValue value);

    R visitComposite(CompositeValue value);
  }

  record BoolValue(boolean value) implements Value {
    @Override
    public Type type() {
      return Types.bool();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBool(this);
    }
  }

  record IntValue(long value) implements Value {
    @Override
    public Type type() {
      return Types.integer();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInt(this);
    }
  }

  record StringValue(String value) implements Value {
    public StringValue {
      if (value == null) {
        throw new TypeMismatchException("A string value cannot be null; use a nullable type");
      }
    }

    @Override
    public Type type() {
      return Types.string();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitString(this);
    }
  }

  /** Either absent ({@code inner == null}) or an inner value of {@code type.inner()}. */
  record NullableValue(Type.Nullable type, Value inner) implements Value {
    public NullableValue {
      Objects.requireNonNull(type, "type");
      if (inner != null && !inner.type().equals(type.inner())) {
        throw new TypeMismatchException(
            "Expected a value of type " + type.inner() + " but got " + inner.type());
      }
    }

    public boolean isPresent() {
      return inner != null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNullable(this);
    }
  }

  record TaggedUnionValue(Type.Tagged type, String tag, Value value) implements Value {
    public TaggedUnionValue {
      Objects.requireNonNull(type, "type");
      if (tag == null || !type.hasTag(tag)) {
        throw new TypeMismatchException(
            "Unknown tag '" + tag + "'; expected one of " + type.alternatives().keySet());
      }
      if (value == null) {
        throw new TypeMismatchException("Tag '" + tag + "' requires a value");
      }
      Type expected = type.alternatives().get(tag);
      if (!value.type().equals(expected)) {
        throw new TypeMismatchException(
            "Tag '" + tag + "' expects type " + expected + " but got " + value.type());
      }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTagged(this);
    }
  }

  /** One value per declared field, kept in declaration order. */
  record CompositeValue(Type.Composite type, Map<String, Value> fields) implements Value {
    public CompositeValue {
      Objects.requireNonNull(type, "type");
      if (fields == null) {
        throw new TypeMismatchException("A composite value requires its fields");
      }
      for (String name : fields.keySet()) {
        if (!type.fields().containsKey(name)) {
          throw new TypeMismatchException(
              "Undeclared field '" + name + "'; expected " + type.fields().keySet());
        }
      }
      Map<String, Value> ordered = new LinkedHashMap<>();
      for (Map.Entry<String, Type> field : type.fields().entrySet()) {
        Value v = fields.get(field.getKey());
        if (v == null) {
          throw new TypeMismatchException("Missing field '" + field.getKey() + "'");
        }
        if (!v.type().equals(field.getValue())) {
          throw new TypeMismatchException(
              "Field '"
                  + field.getKey()
                  + "' expects type "
                  + field.getValue()
                  + " but got "
                  + v.type());
        }
        ordered.put(field.getKey(), v);
      }
      fields = Collections.unmodifiableMap(ordered);
    }

    public Value get(String field) {
      return fields.get(field);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitComposite(this);
    }
  }
}
