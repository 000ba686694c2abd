package io.intellixity.sqlweave.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.sqlweave.clause.Condition;
import io.intellixity.sqlweave.clause.Connective;
import io.intellixity.sqlweave.clause.Operator;
import io.intellixity.sqlweave.clause.ValueRef;

import java.io.IOException;

/** Reads the format written by {@link ConditionJsonSerializer}. */
public final class ConditionJsonDeserializer extends JsonDeserializer<Condition> {
  @Override
  public Condition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    return parse(root, codec);
  }

  static Condition parse(JsonNode node, ObjectCodec codec) throws IOException {
    if (node == null || node.isNull()) return null;
    if (!node.isObject()) throw new IllegalArgumentException("Condition JSON must be an object");

    String op = textOrNull(node.get("op"));
    if (op == null) throw new IllegalArgumentException("Condition JSON requires 'op'");

    return new Condition(
        textOrNull(node.get("table")),
        textOrNull(node.get("field")),
        Operator.fromJson(op),
        parseValue(node, codec),
        Connective.fromJson(textOrNull(node.get("connective")))
    );
  }

  private static ValueRef parseValue(JsonNode node, ObjectCodec codec) throws IOException {
    JsonNode ref = node.get("ref");
    if (ref != null && ref.isObject()) {
      String table = textOrNull(ref.get("table"));
      String field = textOrNull(ref.get("field"));
      if (table == null || field == null) {
        throw new IllegalArgumentException("Condition JSON 'ref' requires 'table' and 'field'");
      }
      return ValueRef.field(table, field);
    }
    JsonNode range = node.get("range");
    if (range != null && range.isObject()) {
      if (!range.has("low") || !range.has("high")) {
        throw new IllegalArgumentException("Condition JSON 'range' requires 'low' and 'high'");
      }
      return ValueRef.range(toValue(range.get("low"), codec), toValue(range.get("high"), codec));
    }
    if (node.has("value")) {
      return ValueRef.literal(toValue(node.get("value"), codec));
    }
    return null;
  }

  private static Object toValue(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    return codec.treeToValue(n, Object.class);
  }

  static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    return n.asText();
  }
}
