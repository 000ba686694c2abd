package io.intellixity.sqlweave.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.sqlweave.clause.Condition;
import io.intellixity.sqlweave.clause.ConditionGroup;
import io.intellixity.sqlweave.clause.Connective;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public final class ConditionGroupJsonDeserializer extends JsonDeserializer<ConditionGroup> {
  @Override
  public ConditionGroup deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Condition group JSON must be an object");

    List<Condition> conditions = new ArrayList<>();
    JsonNode list = root.get("conditions");
    if (list != null && list.isArray()) {
      for (JsonNode n : list) {
        Condition c = ConditionJsonDeserializer.parse(n, codec);
        if (c != null) conditions.add(c);
      }
    }
    Connective connective = Connective.fromJson(ConditionJsonDeserializer.textOrNull(root.get("connective")));
    return new ConditionGroup(conditions, connective);
  }
}
