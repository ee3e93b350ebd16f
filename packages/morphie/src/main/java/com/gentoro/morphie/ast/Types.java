package com.gentoro.morphie.ast;

import com.gentoro.morphie.exception.TypeMismatchException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Factories for {@link Type}. */
public final class Types {
  private static final Type.Primitive BOOL = new Type.Primitive(Type.PrimitiveKind.BOOL);
  private static final Type.Primitive INT = new Type.Primitive(Type.PrimitiveKind.INT);
  private static final Type.Primitive STRING = new Type.Primitive(Type.PrimitiveKind.STRING);

  private Types() {}

  public static Type.Primitive bool() {
    return BOOL;
  }

  public static Type.Primitive integer() {
    return INT;
  }

  public static Type.Primitive string() {
    return STRING;
  }

  public static Type.Nullable nullable(Type inner) {
    return new Type.Nullable(inner);
  }

  public static Type.Tagged tagged(Map<String, Type> alternatives) {
    return new Type.Tagged(alternatives);
  }

  public static Type.Composite composite(Map<String, Type> fields) {
    return new Type.Composite(fields);
  }

  /** Starts a composite whose fields keep the order in which they are added. */
  public static FieldsBuilder fields() {
    return new FieldsBuilder();
  }

  /**
   * Generic constructor. {@code options} is ignored for primitives, must be the inner {@link Type}
   * for {@link TypeKind#NULLABLE} and a {@code Map<String, Type>} for tagged and composite kinds.
   *
   * @throws TypeMismatchException when the options do not fit the kind
   */
  public static Type make(TypeKind kind, Object options) {
    switch (kind) {
      case BOOL:
        return BOOL;
      case INT:
        return INT;
      case STRING:
        return STRING;
      case NULLABLE:
        if (options instanceof Type inner) {
          return nullable(inner);
        }
        throw new TypeMismatchException("A nullable type needs its inner type, got " + options);
      case TAGGED:
        return tagged(typeMap(kind, options));
      case COMPOSITE:
        return composite(typeMap(kind, options));
      default:
        throw new TypeMismatchException("Unsupported type kind " + kind);
    }
  }

  private static Map<String, Type> typeMap(TypeKind kind, Object options) {
    String kindName = kind.name().toLowerCase(Locale.ROOT);
    if (!(options instanceof Map<?, ?> raw)) {
      throw new TypeMismatchException(
          "A " + kindName + " type needs a name to type map, got " + options);
    }
    Map<String, Type> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : raw.entrySet()) {
      if (!(e.getKey() instanceof String name) || !(e.getValue() instanceof Type type)) {
        throw new TypeMismatchException("Invalid " + kindName + " entry " + e);
      }
      result.put(name, type);
    }
    return result;
  }

  public static final class FieldsBuilder {
    private final Map<String, Type> fields = new LinkedHashMap<>();

    private FieldsBuilder() {}

    public FieldsBuilder field(String name, Type type) {
      if (fields.putIfAbsent(name, type) != null) {
        throw new TypeMismatchException("Field '" + name + "' declared twice");
      }
      return this;
    }

    public Type.Composite build() {
      return composite(fields);
    }
  }
}
