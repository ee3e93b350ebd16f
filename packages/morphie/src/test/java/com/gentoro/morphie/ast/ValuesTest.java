package com.gentoro.morphie.ast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.morphie.exception.TypeMismatchException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ValuesTest {

  private static final Type.Composite EVENT =
      Types.fields()
          .field("at", Types.integer())
          .field("user", Types.nullable(Types.string()))
          .field("ok", Types.bool())
          .build();

  private static final Type.Tagged RESULT =
      Types.tagged(Map.of("code", Types.integer(), "error", Types.string()));

  @Test
  @DisplayName("make converts raw primitives")
  void primitives() {
    assertEquals(Values.of(true), Values.make(Types.bool(), Boolean.TRUE));
    assertEquals(Values.of(7L), Values.make(Types.integer(), 7));
    assertEquals(Values.of(7L), Values.make(Types.integer(), 7L));
    assertEquals(Values.of("x"), Values.make(Types.string(), "x"));

    assertThrows(TypeMismatchException.class, () -> Values.make(Types.integer(), "7"));
    assertThrows(TypeMismatchException.class, () -> Values.make(Types.integer(), 7.5));
    assertThrows(TypeMismatchException.class, () -> Values.make(Types.string(), null));
  }

  @Test
  @DisplayName("make builds absent and present nullable values")
  void nullable() {
    Type.Nullable optional = Types.nullable(Types.string());
    Value absent = Values.make(optional, null);
    Value present = Values.make(optional, "a");

    assertFalse(((Value.NullableValue) absent).isPresent());
    assertTrue(((Value.NullableValue) present).isPresent());
    assertEquals(optional, absent.type());
    assertNotEquals(absent, present);
    assertThrows(TypeMismatchException.class, () -> Values.make(optional, 3));
  }

  @Test
  @DisplayName("a built value of the inner type is not wrapped into a nullable")
  void nullableDoesNotWrapBuiltValues() {
    Type.Nullable optional = Types.nullable(Types.integer());
    assertThrows(TypeMismatchException.class, () -> Values.make(optional, Values.of(5L)));

    Value wrapped = Values.present(optional, Values.of(5L));
    assertSame(wrapped, Values.make(optional, wrapped));
    assertEquals(wrapped, Values.make(optional, 5L));
    Value text = Values.present(Types.nullable(Types.string()), Values.of("5"));
    assertThrows(TypeMismatchException.class, () -> Values.make(optional, text));
  }

  @Test
  @DisplayName("make builds a tagged value from a single entry map")
  void tagged() {
    Value value = Values.make(RESULT, Map.of("code", 404));
    assertEquals(Values.tagged(RESULT, "code", Values.of(404L)), value);
    assertEquals(RESULT, value.type());

    TypeMismatchException unknown =
        assertThrows(TypeMismatchException.class, () -> Values.make(RESULT, Map.of("warn", "x")));
    assertThat(unknown.getMessage()).contains("Unknown tag 'warn'");
    assertThrows(
        TypeMismatchException.class, () -> Values.make(RESULT, Map.of("code", 1, "error", "x")));
    assertThrows(TypeMismatchException.class, () -> Values.make(RESULT, Map.of("error", 5)));
  }

  @Test
  @DisplayName("make builds composites in declaration order")
  void composite() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("ok", true);
    raw.put("user", null);
    raw.put("at", 10);
    Value.CompositeValue value = (Value.CompositeValue) Values.make(EVENT, raw);

    assertEquals(List.of("at", "user", "ok"), List.copyOf(value.fields().keySet()));
    assertEquals(Values.of(10L), value.get("at"));
    assertEquals(EVENT, value.type());
  }

  @Test
  @DisplayName("composite errors name the offending field")
  void compositeErrors() {
    Map<String, Object> missing = new HashMap<>();
    missing.put("at", 1);
    missing.put("ok", false);
    TypeMismatchException e =
        assertThrows(TypeMismatchException.class, () -> Values.make(EVENT, missing));
    assertThat(e.getMessage()).contains("Missing field 'user'");

    Map<String, Object> extra = new HashMap<>(missing);
    extra.put("user", "bob");
    extra.put("host", "h1");
    e = assertThrows(TypeMismatchException.class, () -> Values.make(EVENT, extra));
    assertThat(e.getMessage()).contains("Undeclared field 'host'");

    Map<String, Object> wrong = new HashMap<>(missing);
    wrong.put("user", 5);
    e = assertThrows(TypeMismatchException.class, () -> Values.make(EVENT, wrong));
    assertThat(e.getMessage()).contains("value.user");
  }

  @Test
  @DisplayName("a built value of the requested type is accepted as is")
  void acceptsBuiltValue() {
    Value built = Values.make(RESULT, Map.entry("error", "boom"));
    assertSame(built, Values.make(RESULT, built));
  }

  @Test
  @DisplayName("equal inputs give equal values")
  void valueEquality() {
    Value a = Values.make(EVENT, Map.of("at", 1, "ok", true, "user", "u"));
    Value b = Values.make(EVENT, Map.of("user", "u", "at", 1L, "ok", true));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(TaggedValue.of("event", a), TaggedValue.of("event", b));
    assertNotEquals(TaggedValue.of("event", a), TaggedValue.of("other", a));
  }

  @Test
  @DisplayName("the formatter flattens nested values")
  void formatting() {
    Value value = Values.make(EVENT, Map.of("at", 3, "ok", false, "user", "amy"));
    assertEquals("{at: 3, user: amy, ok: false}", ValueFormatter.format(value));
    Map<String, Object> absentUser = new HashMap<>();
    absentUser.put("at", 3);
    absentUser.put("ok", true);
    absentUser.put("user", null);
    assertEquals(
        "{at: 3, user: null, ok: true}", ValueFormatter.format(Values.make(EVENT, absentUser)));
    assertEquals("code(200)", ValueFormatter.format(Values.make(RESULT, Map.of("code", 200))));
    assertEquals("num: 4", ValueFormatter.format(TaggedValue.of("num", 4)));
  }

  @Test
  @DisplayName("tagged values reject blank tags")
  void blankTag() {
    assertThrows(TypeMismatchException.class, () -> TaggedValue.of(" ", "x"));
    assertThrows(TypeMismatchException.class, () -> TaggedValue.of("t", (Value) null));
  }
}
