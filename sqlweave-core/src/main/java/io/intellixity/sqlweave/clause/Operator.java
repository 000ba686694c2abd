package io.intellixity.sqlweave.clause;

import java.util.Locale;

public enum Operator {
  EQ("="),
  NEQ("!="),
  GT(">"),
  GTE(">="),
  LT("<"),
  LTE("<="),

  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE"),
  ILIKE("ILIKE"),

  IN("IN"),
  NOT_IN("NOT IN"),

  IS_NULL("IS NULL"),
  NOT_NULL("IS NOT NULL"),

  BETWEEN("BETWEEN"),
  NOT_BETWEEN("NOT BETWEEN"),

  // jsonb document operators; the key-existence ones reuse the '?' character
  JSON_CONTAINS("@>"),
  JSON_CONTAINED_BY("<@"),
  JSON_HAS_KEY("?"),
  JSON_HAS_ANY_KEYS("?|"),
  JSON_HAS_ALL_KEYS("?&");

  private final String sql;

  Operator(String sql) {
    this.sql = sql;
  }

  public String sql() { return sql; }

  /** Null checks render without a right-hand side and never bind a value. */
  public boolean consultsValue() {
    return this != IS_NULL && this != NOT_NULL;
  }

  public String toJson() { return name().toLowerCase(Locale.ROOT); }

  public static Operator fromJson(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("Operator is blank");
    return Operator.valueOf(s.trim().toUpperCase(Locale.ROOT));
  }
}
