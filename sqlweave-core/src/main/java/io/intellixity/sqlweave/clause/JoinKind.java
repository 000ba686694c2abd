package io.intellixity.sqlweave.clause;

public enum JoinKind {
  INNER,
  LEFT,
  RIGHT,
  FULL,
  CROSS;

  public String sql() { return name() + " JOIN"; }
}
