package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.SqlValidationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConditionTest {
  @Test
  void rendersQualifiedEquality() {
    Condition c = Condition.of("t", "myfield1", Operator.EQ, ValueRef.literal("test"));
    assertEquals("t.myfield1 = ?", c.render());
    assertEquals(List.of("test"), c.bind().values());
  }

  @Test
  void prefixesOwnConnective() {
    Condition c = Condition.of("t", "myfield1", Operator.EQ, ValueRef.literal("test")).and();
    assertEquals("AND t.myfield1 = ?", c.render());
  }

  @Test
  void fieldReferenceRendersAsTextAndBindsNothing() {
    Condition c = Condition.of("t", "myfield1", Operator.EQ, ValueRef.field("p", "myfield2")).and();
    BoundSql sql = c.bind();
    assertEquals("AND t.myfield1 = p.myfield2", sql.text());
    assertTrue(sql.values().isEmpty());
  }

  @Test
  void rangeBindsLowThenHigh() {
    Condition c = Conditions.between("t.myfield1", 10, 20).and();
    BoundSql sql = c.bind();
    assertEquals("AND t.myfield1 BETWEEN ? AND ?", sql.text());
    assertEquals(List.of(10, 20), sql.values());
  }

  @Test
  void arrayLiteralRendersOneParenthesizedMarker() {
    Condition c = Conditions.in("myfield4", List.of("MYVALUE", 128));
    BoundSql sql = c.bind();
    assertEquals("myfield4 IN (?)", sql.text());
    assertEquals(List.of(List.of("MYVALUE", 128)), sql.values());
  }

  @Test
  void javaArraysAreTreatedAsArrayLiterals() {
    Condition c = Condition.of("id", Operator.NOT_IN, ValueRef.literal(new int[] {1, 2, 3}));
    assertEquals("id NOT IN (?)", c.render());
    assertEquals(List.of(List.of(1, 2, 3)), c.bind().values());
  }

  @Test
  void nullChecksIgnoreValue() {
    Condition c = Condition.of("t", "deleted_at", Operator.IS_NULL, ValueRef.literal("ignored")).or();
    BoundSql sql = c.bind();
    assertEquals("OR t.deleted_at IS NULL", sql.text());
    assertTrue(sql.values().isEmpty());
    assertEquals("t.x IS NOT NULL", Conditions.notNull("t.x").render());
  }

  @Test
  void jsonKeyOperatorsKeepTheirSymbols() {
    assertEquals("doc ? ?", Conditions.jsonHasKey("doc", "k").render());
    assertEquals("doc ?| (?)", Conditions.jsonHasAnyKeys("doc", List.of("a", "b")).render());
    assertEquals("doc ?& (?)", Conditions.jsonHasAllKeys("doc", List.of("a")).render());
    assertEquals("doc @> ?", Conditions.jsonContains("doc", "{\"a\":1}").render());
    // only the right-hand '?' is a placeholder
    assertEquals(List.of(6), Conditions.jsonHasKey("doc", "k").bind().markers());
  }

  @Test
  void emptyFieldFails() {
    Condition c = Condition.of("", Operator.EQ, ValueRef.literal("MYVALUE"));
    assertThrows(SqlValidationException.class, c::render);
    assertThrows(SqlValidationException.class, () -> Condition.of(null, Operator.EQ, null).bind());
  }

  @Test
  void conditionsAreValues() {
    Condition a = Conditions.eq("t.a", 1);
    Condition b = Conditions.eq("t.a", 1);
    assertEquals(a, b);
    assertNotEquals(a, b.and());
    assertNull(a.connective());
    assertEquals("t", a.tableAlias());
  }

  @Test
  @SuppressWarnings("unchecked")
  void mapLiteralIsCopiedWhenBound() {
    Map<String, Object> doc = new HashMap<>();
    doc.put("status", "ACTIVE");
    doc.put("deleted", null);
    Condition c = Conditions.jsonContains("t.body", doc);

    doc.put("status", "CHANGED");
    Map<String, Object> expected = new HashMap<>();
    expected.put("status", "ACTIVE");
    expected.put("deleted", null);
    assertEquals(List.of(expected), c.bind().values());

    Object bound = ((ValueRef.Literal) c.value()).value();
    assertThrows(UnsupportedOperationException.class, () -> ((Map<String, Object>) bound).put("x", 1));
  }
}
