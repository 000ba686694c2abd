package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class GroupByBuilder {
  private GroupByBuilder() {}

  /** {@code GROUP BY a.x, b.y}; repeated fragments are rendered once, first occurrence wins. */
  public static String build(List<GroupByItem> items) {
    if (items == null || items.isEmpty()) throw new SqlValidationException("GROUP BY item list is empty");
    Set<String> parts = new LinkedHashSet<>();
    for (GroupByItem item : items) {
      if (item.field() == null || item.field().isEmpty()) {
        throw new SqlValidationException("GROUP BY field is empty");
      }
      parts.add(qualify(item.tableAlias(), item.field()));
    }
    return "GROUP BY " + String.join(", ", parts);
  }

  static String qualify(String tableAlias, String field) {
    return (tableAlias == null || tableAlias.isEmpty()) ? field : tableAlias + "." + field;
  }
}
