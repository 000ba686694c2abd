package io.intellixity.sqlweave.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlweave.clause.ConditionGroup;
import io.intellixity.sqlweave.clause.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads filter descriptions (a JSON array of condition groups) into built {@link Expression}s, ready for
 * {@code WHERE} or join clauses.
 */
public final class FilterJson {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final TypeReference<List<ConditionGroup>> GROUPS = new TypeReference<>() {};

  private FilterJson() {}

  public static List<ConditionGroup> readGroups(String json) {
    try {
      List<ConditionGroup> groups = JSON.readValue(json, GROUPS);
      return groups == null ? List.of() : groups;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid filter JSON: " + e.getOriginalMessage(), e);
    }
  }

  public static List<Expression> parseFilter(String json) {
    List<ConditionGroup> groups = readGroups(json);
    List<Expression> out = new ArrayList<>(groups.size());
    for (ConditionGroup g : groups) {
      if (g == null) continue;
      out.add(g.build());
    }
    return out;
  }

  public static String write(List<ConditionGroup> groups) {
    try {
      return JSON.writeValueAsString(groups);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to write filter JSON", e);
    }
  }
}
