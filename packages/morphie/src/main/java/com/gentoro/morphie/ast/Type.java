package com.gentoro.morphie.ast;

import com.gentoro.morphie.exception.TypeMismatchException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Schema descriptor for labels and attributes of a {@code LabeledGraph}.
 *
 * <p>A type is one of four variants: a {@link Primitive} scalar, a {@link Nullable} wrapper, a
 * {@link Tagged} discriminated union and a {@link Composite} record. Types are immutable and are
 * compared structurally. The declaration order of tags and fields is kept for rendering only; two
 * composites declaring the same fields in a different order are equal.
 *
 * <p>Consumers match on the variant through {@link #accept(Visitor)}, which forces every consumer
 * to handle all four cases.
 */
public sealed interface Type permits Type.Primitive, Type.Nullable, Type.Tagged, Type.Composite {

  enum PrimitiveKind {
    BOOL,
    INT,
    STRING
  }

  <R> R accept(Visitor<R> visitor);

  /** Exhaustive match over the type variants. */
  interface Visitor<R> {
    R visitPrimitive(Primitive type);

    R visitNullable(Nullable type);

    R visitTagged(Tagged type);

    R visitComposite(Composite type);
  }

  record Primitive(PrimitiveKind kind) implements Type {
    public Primitive {
      Objects.requireNonNull(kind, "kind");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPrimitive(this);
    }

    @Override
    public String toString() {
      return kind.name().toLowerCase(Locale.ROOT);
    }
  }

  record Nullable(Type inner) implements Type {
    public Nullable {
      if (inner == null) {
        throw new TypeMismatchException("Nullable type requires an inner type");
      }
      if (inner instanceof Nullable) {
        throw new TypeMismatchException("Nullable type cannot wrap another nullable type");
      }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNullable(this);
    }

    @Override
    public String toString() {
      return inner + "?";
    }
  }

  /** Discriminated union: a value carries exactly one tag and a value of that tag's type. */
  record Tagged(Map<String, Type> alternatives) implements Type {
    public Tagged {
      if (alternatives == null || alternatives.isEmpty()) {
        throw new TypeMismatchException("Tagged type requires at least one tag");
      }
      alternatives = copyOf("tag", alternatives);
    }

    public boolean hasTag(String tag) {
      return alternatives.containsKey(tag);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTagged(this);
    }

    @Override
    public String toString() {
      return "oneof" + alternatives;
    }
  }

  /** Record type: a value carries one value per declared field. */
  record Composite(Map<String, Type> fields) implements Type {
    public Composite {
      if (fields == null) {
        throw new TypeMismatchException("Composite type requires a field map");
      }
      fields = copyOf("field", fields);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitComposite(this);
    }

    @Override
    public String toString() {
      return "record" + fields;
    }
  }

  private static Map<String, Type> copyOf(String what, Map<String, Type> input) {
    Map<String, Type> copy = new LinkedHashMap<>();
    input.forEach(
        (name, type) -> {
          if (name == null || name.isBlank()) {
            throw new TypeMismatchException("A " + what + " name cannot be null or blank");
          }
          if (type == null) {
            throw new TypeMismatchException("No type given for " + what + " '" + name + "'");
          }
          copy.put(name, type);
        });
    return Collections.unmodifiableMap(copy);
  }
}
