package io.intellixity.sqlweave.clause;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.sqlweave.json.ConditionGroupJsonDeserializer;
import io.intellixity.sqlweave.json.ConditionGroupJsonSerializer;

import java.util.List;

/** Unbuilt form of an {@link Expression}: its conditions plus the connective used one level up. */
@JsonSerialize(using = ConditionGroupJsonSerializer.class)
@JsonDeserialize(using = ConditionGroupJsonDeserializer.class)
public record ConditionGroup(List<Condition> conditions, Connective connective) {
  public ConditionGroup {
    conditions = List.copyOf(conditions == null ? List.of() : conditions);
  }

  public static ConditionGroup of(Connective connective, Condition... conditions) {
    return new ConditionGroup(List.of(conditions), connective);
  }

  public Expression build() {
    return Expression.build(conditions, connective);
  }
}
