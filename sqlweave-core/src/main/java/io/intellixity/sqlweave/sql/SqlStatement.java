package io.intellixity.sqlweave.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Final statement text in its wire notation plus the values to bind, in placeholder order.
 * Ready to hand to a parameterized-query API; carries no marker bookkeeping.
 */
public record SqlStatement(String sql, List<Object> values, PlaceholderKind placeholderKind) {
  public SqlStatement {
    sql = sql == null ? "" : sql;
    values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    placeholderKind = placeholderKind == null ? PlaceholderKind.QUESTION_MARK : placeholderKind;
  }

  public SqlStatement(String sql, List<Object> values) {
    this(sql, values, PlaceholderKind.QUESTION_MARK);
  }
}
