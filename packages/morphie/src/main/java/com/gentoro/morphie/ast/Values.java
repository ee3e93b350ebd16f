package com.gentoro.morphie.ast;

import com.gentoro.morphie.exception.TypeMismatchException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link Value}s. {@link #make(Type, Object)} converts plain Java objects, the typed helpers
 * wrap values that are already built.
 */
public final class Values {
  private static final Value.BoolValue TRUE = new Value.BoolValue(true);
  private static final Value.BoolValue FALSE = new Value.BoolValue(false);

  private Values() {}

  public static Value.BoolValue of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static Value.IntValue of(long value) {
    return new Value.IntValue(value);
  }

  public static Value.StringValue of(String value) {
    return new Value.StringValue(value);
  }

  public static Value.NullableValue absent(Type.Nullable type) {
    return new Value.NullableValue(type, null);
  }

  public static Value.NullableValue present(Type.Nullable type, Value inner) {
    if (inner == null) {
      throw new TypeMismatchException("A present value cannot be null; use absent()");
    }
    return new Value.NullableValue(type, inner);
  }

  /** Absent when {@code inner} is null, present otherwise. */
  public static Value.NullableValue ofNullable(Type.Nullable type, Value inner) {
    return new Value.NullableValue(type, inner);
  }

  public static Value.TaggedUnionValue tagged(Type.Tagged type, String tag, Value value) {
    return new Value.TaggedUnionValue(type, tag, value);
  }

  public static Value.CompositeValue composite(Type.Composite type, Map<String, Value> fields) {
    return new Value.CompositeValue(type, fields);
  }

  /**
   * Converts a raw Java object into a value of {@code type}.
   *
   * <ul>
   *   <li>{@code BOOL}: a {@link Boolean}
   *   <li>{@code INT}: an {@link Integer}, {@link Long}, {@link Short} or {@link Byte}
   *   <li>{@code STRING}: a {@link String}
   *   <li>nullable: {@code null} for absent, otherwise a raw value of the inner type
   *   <li>tagged: a single entry {@link Map} or a {@link Map.Entry} from tag to raw value
   *   <li>composite: a {@link Map} from every declared field to its raw value
   * </ul>
   *
   * A {@link Value} of the requested type is accepted as is; a {@link Value} of any other type is
   * rejected, a nullable type does not wrap it.
   *
   * @throws TypeMismatchException when {@code raw} cannot be represented under {@code type}
   */
  public static Value make(Type type, Object raw) {
    if (type == null) {
      throw new TypeMismatchException("Cannot build a value without a type");
    }
    return type.accept(new RawConverter(raw, "value"));
  }

  private static final class RawConverter implements Type.Visitor<Value> {
    private final Object raw;
    private final String path;

    private RawConverter(Object raw, String path) {
      this.raw = raw;
      this.path = path;
    }

    private Value convert(Type type, Object nested, String nestedPath) {
      return type.accept(new RawConverter(nested, nestedPath));
    }

    private TypeMismatchException mismatch(Type type) {
      return new TypeMismatchException(
          "Cannot represent "
              + (raw == null ? "null" : raw.getClass().getSimpleName() + " '" + raw + "'")
              + " as "
              + type
              + " at "
              + path);
    }

    @Override
    public Value visitPrimitive(Type.Primitive type) {
      if (raw instanceof Value v && v.type().equals(type)) return v;
      switch (type.kind()) {
        case BOOL:
          if (raw instanceof Boolean b) return of(b);
          break;
        case INT:
          if (raw instanceof Long || raw instanceof Integer || raw instanceof Short
              || raw instanceof Byte) {
            return of(((Number) raw).longValue());
          }
          break;
        case STRING:
          if (raw instanceof String s) return of(s);
          break;
      }
      throw mismatch(type);
    }

    @Override
    public Value visitNullable(Type.Nullable type) {
      if (raw instanceof Value v) {
        if (v.type().equals(type)) return v;
        throw mismatch(type);
      }
      if (raw == null) return absent(type);
      return present(type, convert(type.inner(), raw, path));
    }

    @Override
    public Value visitTagged(Type.Tagged type) {
      if (raw instanceof Value v && v.type().equals(type)) return v;
      Map.Entry<?, ?> entry;
      if (raw instanceof Map.Entry<?, ?> e) {
        entry = e;
      } else if (raw instanceof Map<?, ?> m && m.size() == 1) {
        entry = m.entrySet().iterator().next();
      } else {
        throw mismatch(type);
      }
      if (!(entry.getKey() instanceof String tag) || !type.hasTag(tag)) {
        throw new TypeMismatchException(
            "Unknown tag '"
                + entry.getKey()
                + "' at "
                + path
                + "; expected one of "
                + type.alternatives().keySet());
      }
      Value inner = convert(type.alternatives().get(tag), entry.getValue(), path + "." + tag);
      return tagged(type, tag, inner);
    }

    @Override
    public Value visitComposite(Type.Composite type) {
      if (raw instanceof Value v && v.type().equals(type)) return v;
      if (!(raw instanceof Map<?, ?> m)) {
        throw mismatch(type);
      }
      for (Object key : m.keySet()) {
        if (!(key instanceof String name) || !type.fields().containsKey(name)) {
          throw new TypeMismatchException(
              "Undeclared field '" + key + "' at " + path + "; expected " + type.fields().keySet());
        }
      }
      Map<String, Value> fields = new LinkedHashMap<>();
      for (Map.Entry<String, Type> field : type.fields().entrySet()) {
        if (!m.containsKey(field.getKey())) {
          throw new TypeMismatchException("Missing field '" + field.getKey() + "' at " + path);
        }
        fields.put(
            field.getKey(),
            convert(field.getValue(), m.get(field.getKey()), path + "." + field.getKey()));
      }
      return composite(type, fields);
    }
  }
}
