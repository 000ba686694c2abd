package io.intellixity.sqlweave.clause;

import java.util.Objects;

public record Assignment(String field, SetValue value) {
  public Assignment {
    Objects.requireNonNull(value, "value");
  }

  public static Assignment of(String field, Object value) {
    return new Assignment(field, SetValue.value(value));
  }
}
