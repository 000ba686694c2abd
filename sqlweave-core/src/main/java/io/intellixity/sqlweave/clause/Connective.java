package io.intellixity.sqlweave.clause;

import java.util.Locale;

/** Boolean connective written before a condition or a grouped expression. */
public enum Connective {
  AND,
  OR;

  public String sql() { return name(); }

  public static Connective fromJson(String s) {
    if (s == null || s.isBlank()) return null;
    return Connective.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }

  public String toJson() { return name().toLowerCase(Locale.ROOT); }
}
