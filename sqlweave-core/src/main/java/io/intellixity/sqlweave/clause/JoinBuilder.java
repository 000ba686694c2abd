package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.List;
import java.util.Objects;

/** {@code KIND JOIN table as alias ON <grouped expressions>}. */
public final class JoinBuilder {
  private JoinBuilder() {}

  public static BoundSql build(JoinKind kind, String table, String alias, List<Expression> on) {
    Objects.requireNonNull(kind, "kind");
    if (table == null || table.isEmpty()) throw new SqlValidationException("Join table is empty");
    String head = kind.sql() + " " + table + ((alias == null || alias.isEmpty()) ? "" : " as " + alias);

    if (kind == JoinKind.CROSS) {
      if (on != null && !on.isEmpty()) {
        throw new SqlValidationException("CROSS JOIN does not take ON conditions: " + table);
      }
      return BoundSql.text(head);
    }
    if (on == null || on.isEmpty()) {
      throw new SqlValidationException(kind + " JOIN requires ON conditions: " + table);
    }
    return GroupedClause.of(on).sql().prepend(head + " ON ");
  }
}
