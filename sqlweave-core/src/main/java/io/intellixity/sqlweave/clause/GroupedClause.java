package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expressions combined into one predicate.
 *
 * <p>With more than one expression each is rendered {@code CONNECTIVE (text)} (no prefix when its
 * connective is unset). A single expression passes through as {@code text}, without parentheses and
 * without its own connective.</p>
 */
public final class GroupedClause {
  private final BoundSql sql;

  private GroupedClause(BoundSql sql) {
    this.sql = sql;
  }

  public static GroupedClause of(List<Expression> expressions) {
    if (expressions == null || expressions.isEmpty()) {
      throw new SqlValidationException("No expressions to combine");
    }
    boolean group = expressions.size() > 1;
    List<BoundSql> parts = new ArrayList<>(expressions.size());
    for (Expression e : expressions) {
      Objects.requireNonNull(e, "expression");
      if (!group) {
        parts.add(e.sql());
        continue;
      }
      BoundSql wrapped = e.sql().wrap("(", ")");
      parts.add(e.connective() == null ? wrapped : wrapped.prepend(e.connective().sql() + " "));
    }
    return new GroupedClause(BoundSql.join(" ", parts).trim());
  }

  public String text() { return sql.text(); }
  public List<Object> values() { return sql.values(); }
  public BoundSql sql() { return sql; }
}
