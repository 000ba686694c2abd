package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;

import java.util.List;

/** {@code WHERE} clause over grouped expressions. */
public final class WhereBuilder {
  private WhereBuilder() {}

  public static BoundSql build(List<Expression> expressions) {
    return GroupedClause.of(expressions).sql().prepend("WHERE ");
  }
}
