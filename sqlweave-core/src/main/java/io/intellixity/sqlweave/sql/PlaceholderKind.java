package io.intellixity.sqlweave.sql;

import java.util.Locale;

/** Placeholder notation written into the final statement text. */
public enum PlaceholderKind {
  /** Every value is bound through a bare {@code ?} (JDBC, SQLite, MySQL). */
  QUESTION_MARK,
  /** Values are bound through {@code $1, $2, ...} in left-to-right order (Postgres wire protocol). */
  DOLLAR_SEQUENTIAL;

  public String id() { return name().toLowerCase(Locale.ROOT); }

  public static PlaceholderKind fromId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Placeholder kind is blank");
    String s = id.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    try {
      return PlaceholderKind.valueOf(s);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown placeholder kind: " + id, e);
    }
  }
}
