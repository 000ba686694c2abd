package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;

import java.util.List;
import java.util.Objects;

/** Rendered {@code SET ...} clause; nested select values sit at their assignment's position. */
public final class AssignmentClause {
  private final BoundSql sql;

  AssignmentClause(BoundSql sql) {
    this.sql = Objects.requireNonNull(sql, "sql");
  }

  public String text() { return sql.text(); }
  public List<Object> values() { return sql.values(); }
  public BoundSql sql() { return sql; }
}
