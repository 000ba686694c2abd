package io.intellixity.sqlweave.sql;

import java.util.Objects;

/**
 * Placeholder substitution pass: rewrites the generic markers of a fully assembled statement into the
 * selected wire notation.
 *
 * <p>Runs once over the whole statement, never per clause, so {@code $n} numbering follows the canonical
 * clause order the value list was built in. Only tracked marker offsets are rewritten; a {@code ?} that is
 * part of operator text is copied as-is.</p>
 */
public final class Placeholders {
  public static final char SEQUENTIAL_SIGIL = '$';

  private Placeholders() {}

  public static SqlStatement substitute(BoundSql sql, PlaceholderKind kind) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(kind, "kind");
    return switch (kind) {
      case QUESTION_MARK -> new SqlStatement(sql.text(), sql.values(), kind);
      case DOLLAR_SEQUENTIAL -> new SqlStatement(renumber(sql), sql.values(), kind);
    };
  }

  private static String renumber(BoundSql sql) {
    String text = sql.text();
    StringBuilder out = new StringBuilder(text.length() + sql.markers().size() * 2);
    int n = 1;
    int from = 0;
    for (int offset : sql.markers()) {
      if (text.charAt(offset) != BoundSql.MARKER) {
        throw new IllegalStateException("No marker at offset " + offset + " in sql: " + text);
      }
      out.append(text, from, offset).append(SEQUENTIAL_SIGIL).append(n++);
      from = offset + 1;
    }
    out.append(text, from, text.length());
    return out.toString();
  }
}
