package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.NestableStatement;

import java.util.Objects;

/** Right-hand side of a {@code SET} assignment: a bound value or a nested select. */
public interface SetValue {

  static Value value(Object value) { return new Value(value); }

  static Query query(NestableStatement statement) { return new Query(statement); }

  /** Bound as a single {@code ?}; collections are not expanded. */
  record Value(Object value) implements SetValue {}

  record Query(NestableStatement statement) implements SetValue {
    public Query {
      Objects.requireNonNull(statement, "statement");
    }
  }
}
