package io.intellixity.avronames.types;

import java.util.Set;

/** Type-name tokens of the schema format. */
public final class AvroTypeNames {
  private AvroTypeNames() {}

  public static final String NULL = "null";
  public static final String BOOLEAN = "boolean";
  public static final String INT = "int";
  public static final String LONG = "long";
  public static final String FLOAT = "float";
  public static final String DOUBLE = "double";
  public static final String BYTES = "bytes";
  public static final String STRING = "string";

  public static final String ARRAY = "array";
  public static final String MAP = "map";
  public static final String UNION = "union";

  public static final Set<String> PRIMITIVES = Set.of(NULL, BOOLEAN, INT, LONG, FLOAT, DOUBLE, BYTES, STRING);

  public static boolean isPrimitive(String name) {
    return name != null && PRIMITIVES.contains(name);
  }
}
