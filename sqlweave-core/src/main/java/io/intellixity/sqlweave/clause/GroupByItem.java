package io.intellixity.sqlweave.clause;

public record GroupByItem(String tableAlias, String field) {
  public static GroupByItem of(String field) { return new GroupByItem(null, field); }
}
