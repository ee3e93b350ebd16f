package com.gentoro.morphie.export.explorer;

import java.util.Map;

/**
 * Attribute names understood by GraphExplorer. Boolean attributes start with {@code is}; their
 * presence sets the property and their value is ignored.
 */
public final class ExplorerAttributes {
  public static final String OP = "op";
  public static final String LABEL = "label";
  public static final String IS_DIRECTED = "isDirected";
  public static final String IS_METANODE = "isMetanode";
  public static final String BOOLEAN_PREFIX = "is";
  /** Prepended to graph attribute tags that would clash with a name the viewer interprets. */
  public static final String ESCAPE_PREFIX = "attr_";

  private ExplorerAttributes() {}

  public static boolean isBoolean(String name) {
    return name.startsWith(BOOLEAN_PREFIX)
        && name.length() > BOOLEAN_PREFIX.length()
        && Character.isUpperCase(name.charAt(BOOLEAN_PREFIX.length()));
  }

  /** True for {@code op}, {@code label} and every Boolean-shaped name. */
  public static boolean isReserved(String name) {
    return OP.equals(name) || LABEL.equals(name) || isBoolean(name);
  }

  /** Key under which a graph attribute tagged {@code tag} is emitted. */
  public static String attributeKey(String tag) {
    return isReserved(tag) ? ESCAPE_PREFIX + tag : tag;
  }

  /** Sets a Boolean attribute. */
  public static void flag(Map<String, String> attributes, String name) {
    if (!isBoolean(name)) {
      throw new IllegalArgumentException("Boolean attribute names start with 'is': " + name);
    }
    attributes.put(name, "");
  }

  public static boolean hasFlag(Map<String, String> attributes, String name) {
    return attributes.containsKey(name);
  }
}
