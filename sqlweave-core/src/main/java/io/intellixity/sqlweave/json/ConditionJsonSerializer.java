package io.intellixity.sqlweave.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.sqlweave.clause.Condition;
import io.intellixity.sqlweave.clause.ValueRef;

import java.io.IOException;

/**
 * Canonical JSON for {@link Condition}:
 * <pre>
 * {"table":"t","field":"age","op":"between","range":{"low":1,"high":9},"connective":"and"}
 * {"field":"email","op":"eq","value":"a@b.c"}
 * {"table":"p","field":"id","op":"eq","ref":{"table":"o","field":"product_id"}}
 * </pre>
 */
public final class ConditionJsonSerializer extends JsonSerializer<Condition> {
  @Override
  public void serialize(Condition c, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (c == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    if (c.tableAlias() != null) g.writeStringField("table", c.tableAlias());
    g.writeStringField("field", c.field());
    g.writeStringField("op", c.operator().toJson());
    writeValue(c.value(), g, serializers);
    if (c.connective() != null) g.writeStringField("connective", c.connective().toJson());
    g.writeEndObject();
  }

  private static void writeValue(ValueRef v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v == null) return;
    if (v instanceof ValueRef.Literal l) {
      g.writeFieldName("value");
      serializers.defaultSerializeValue(l.value(), g);
      return;
    }
    if (v instanceof ValueRef.Range r) {
      g.writeObjectFieldStart("range");
      g.writeFieldName("low");
      serializers.defaultSerializeValue(r.low(), g);
      g.writeFieldName("high");
      serializers.defaultSerializeValue(r.high(), g);
      g.writeEndObject();
      return;
    }
    if (v instanceof ValueRef.FieldReference f) {
      g.writeObjectFieldStart("ref");
      g.writeStringField("table", f.tableAlias());
      g.writeStringField("field", f.field());
      g.writeEndObject();
      return;
    }
    throw new IllegalArgumentException("Unknown ValueRef: " + v);
  }
}
