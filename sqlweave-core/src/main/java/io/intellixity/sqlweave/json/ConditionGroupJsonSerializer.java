package io.intellixity.sqlweave.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.sqlweave.clause.Condition;
import io.intellixity.sqlweave.clause.ConditionGroup;

import java.io.IOException;

/** {@code {"connective":"or","conditions":[...]}} */
public final class ConditionGroupJsonSerializer extends JsonSerializer<ConditionGroup> {
  @Override
  public void serialize(ConditionGroup group, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (group == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    if (group.connective() != null) g.writeStringField("connective", group.connective().toJson());
    g.writeArrayFieldStart("conditions");
    for (Condition c : group.conditions()) {
      serializers.defaultSerializeValue(c, g);
    }
    g.writeEndArray();
    g.writeEndObject();
  }
}
