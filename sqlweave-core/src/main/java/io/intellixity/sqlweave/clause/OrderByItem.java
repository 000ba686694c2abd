package io.intellixity.sqlweave.clause;

public record OrderByItem(String tableAlias, String field, Direction direction) {
  public OrderByItem {
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static OrderByItem asc(String tableAlias, String field) { return new OrderByItem(tableAlias, field, Direction.ASC); }
  public static OrderByItem desc(String tableAlias, String field) { return new OrderByItem(tableAlias, field, Direction.DESC); }

  public enum Direction { ASC, DESC }
}
