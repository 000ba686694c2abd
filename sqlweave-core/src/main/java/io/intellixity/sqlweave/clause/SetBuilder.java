package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.NestableStatement;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.ArrayList;
import java.util.List;

/** {@code SET a = ?, b = (SELECT ...)}. */
public final class SetBuilder {
  private SetBuilder() {}

  public static AssignmentClause build(List<Assignment> assignments) {
    if (assignments == null || assignments.isEmpty()) {
      throw new SqlValidationException("SET assignment list is empty");
    }
    List<BoundSql> parts = new ArrayList<>(assignments.size());
    for (Assignment a : assignments) {
      if (a.field() == null || a.field().isEmpty()) throw new SqlValidationException("SET field is empty");
      parts.add(rhs(a).prepend(a.field() + " = "));
    }
    return new AssignmentClause(BoundSql.join(", ", parts).prepend("SET "));
  }

  private static BoundSql rhs(Assignment a) {
    SetValue v = a.value();
    if (v instanceof SetValue.Value sv) return BoundSql.marker(sv.value());
    if (v instanceof SetValue.Query q) return nested(a.field(), q.statement());
    throw new IllegalArgumentException("Unknown SetValue: " + v);
  }

  private static BoundSql nested(String field, NestableStatement statement) {
    if (statement.placeholderKind() != PlaceholderKind.QUESTION_MARK) {
      throw new SqlValidationException("Nested statement for SET " + field + " must use "
          + PlaceholderKind.QUESTION_MARK + " placeholders, got " + statement.placeholderKind());
    }
    return statement.toBoundSql().trim().wrap("(", ")");
  }
}
