package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class OrderByBuilder {
  private OrderByBuilder() {}

  /** {@code ORDER BY a.x ASC, b.y DESC}; repeated fragments are rendered once, first occurrence wins. */
  public static String build(List<OrderByItem> items) {
    if (items == null || items.isEmpty()) throw new SqlValidationException("ORDER BY item list is empty");
    Set<String> parts = new LinkedHashSet<>();
    for (OrderByItem item : items) {
      if (item.field() == null || item.field().isEmpty()) {
        throw new SqlValidationException("ORDER BY field is empty");
      }
      parts.add(GroupByBuilder.qualify(item.tableAlias(), item.field()) + " " + item.direction().name());
    }
    return "ORDER BY " + String.join(", ", parts);
  }
}
