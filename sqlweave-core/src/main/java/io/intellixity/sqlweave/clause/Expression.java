package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered conditions folded into one fragment, e.g. {@code t.a = ? AND t.b IS NULL}.
 *
 * <p>{@link #connective()} is how this whole expression is prefixed when grouped with siblings
 * ({@code AND (...)}); it is independent of the connectives of the conditions inside it.</p>
 */
public final class Expression {
  private final BoundSql sql;
  private final Connective connective;

  private Expression(BoundSql sql, Connective connective) {
    this.sql = sql;
    this.connective = connective;
  }

  /**
   * Fold {@code conditions} left to right, one space apart. The first condition keeps its own connective
   * prefix. Fails on the first invalid condition without building anything.
   */
  public static Expression build(List<Condition> conditions, Connective connective) {
    if (conditions == null || conditions.isEmpty()) {
      throw new SqlValidationException("Expression has no conditions");
    }
    List<BoundSql> parts = new ArrayList<>(conditions.size());
    for (Condition c : conditions) {
      parts.add(Objects.requireNonNull(c, "condition").bind());
    }
    return new Expression(BoundSql.join(" ", parts), connective);
  }

  public static Expression build(List<Condition> conditions) {
    return build(conditions, null);
  }

  public static Expression of(Condition... conditions) {
    return build(List.of(conditions), null);
  }

  public String text() { return sql.text(); }
  public List<Object> values() { return sql.values(); }
  public Connective connective() { return connective; }
  public BoundSql sql() { return sql; }

  public Expression withConnective(Connective connective) {
    return new Expression(sql, connective);
  }

  @Override
  public String toString() {
    return "Expression[" + (connective == null ? "" : connective + " ") + sql.text() + ", values=" + sql.values() + "]";
  }
}
