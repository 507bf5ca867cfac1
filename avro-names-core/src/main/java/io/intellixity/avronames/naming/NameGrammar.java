package io.intellixity.avronames.naming;

/**
 * Naming grammar: a simple name is {@code [A-Za-z_][A-Za-z0-9_]*}; a dotted name is one or more simple
 * names joined by dots.
 */
public final class NameGrammar {
  private NameGrammar() {}

  /** Validates a single segment: record field names, enum symbols, one component of a type name. */
  public static boolean isCorrectName(String name) {
    if (name == null || name.isEmpty()) return false;
    if (!isCorrectFirstSymbol(name.charAt(0))) return false;
    for (int i = 1; i < name.length(); i++) {
      if (!isCorrectSymbol(name.charAt(i))) return false;
    }
    return true;
  }

  /**
   * Validates a type name or namespace. Peels components off at the rightmost dot until none is left, so every
   * component must be a correct simple name and empty components are rejected.
   */
  public static boolean isCorrectDottedName(String name) {
    if (name == null) return false;
    int end = name.length();
    int dot;
    while ((dot = name.lastIndexOf('.', end - 1)) >= 0) {
      if (!isCorrectName(name.substring(dot + 1, end))) return false;
      end = dot;
    }
    return isCorrectName(name.substring(0, end));
  }

  private static boolean isCorrectFirstSymbol(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isCorrectSymbol(char c) {
    return isCorrectFirstSymbol(c) || (c >= '0' && c <= '9');
  }
}
