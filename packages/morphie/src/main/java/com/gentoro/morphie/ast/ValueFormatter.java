package com.gentoro.morphie.ast;

import java.util.stream.Collectors;

/**
 * Flattens values into short human readable strings: {@code true}, {@code 42}, {@code text},
 * {@code null}, {@code tag(value)} and {@code {a: 1, b: x}}. The output depends only on the value,
 * so exports built from it are stable.
 */
public final class ValueFormatter implements Value.Visitor<String> {
  private static final ValueFormatter INSTANCE = new ValueFormatter();

  private ValueFormatter() {}

  public static String format(Value value) {
    return value.accept(INSTANCE);
  }

  /** {@code tag: value}. */
  public static String format(TaggedValue label) {
    return label.tag() + ": " + format(label.value());
  }

  @Override
  public String visitBool(Value.BoolValue value) {
    return Boolean.toString(value.value());
  }

  @Override
  public String visitInt(Value.IntValue value) {
    return Long.toString(value.value());
  }

  @Override
  public String visitString(Value.StringValue value) {
    return value.value();
  }

  @Override
  public String visitNullable(Value.NullableValue value) {
    return value.isPresent() ? value.inner().accept(this) : "null";
  }

  @Override
  public String visitTagged(Value.TaggedUnionValue value) {
    return value.tag() + "(" + value.value().accept(this) + ")";
  }

  @Override
  public String visitComposite(Value.CompositeValue value) {
    return value.fields().entrySet().stream()
        .map(e -> e.getKey() + ": " + e.getValue().accept(this))
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
