package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.SqlValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class OrderByBuilderTest {
  @Test
  void rendersItemsInOrder() {
    assertEquals("ORDER BY myfield1 ASC", OrderByBuilder.build(List.of(OrderByItem.asc(null, "myfield1"))));
    assertEquals("ORDER BY t.myfield1 ASC, t.myfield2 DESC", OrderByBuilder.build(List.of(
        OrderByItem.asc("t", "myfield1"),
        OrderByItem.desc("t", "myfield2"))));
  }

  @Test
  void directionDefaultsToAsc() {
    assertEquals("ORDER BY x ASC", OrderByBuilder.build(List.of(new OrderByItem(null, "x", null))));
  }

  @Test
  void dropsDuplicateFragmentsByRenderedText() {
    String sql = OrderByBuilder.build(List.of(
        OrderByItem.asc("t", "a"),
        OrderByItem.desc("t", "b"),
        OrderByItem.asc("t", "a"),
        OrderByItem.desc("t", "a")));
    assertEquals("ORDER BY t.a ASC, t.b DESC, t.a DESC", sql);
  }

  @Test
  void emptyListOrFieldFails() {
    assertThrows(SqlValidationException.class, () -> OrderByBuilder.build(List.of()));
    assertThrows(SqlValidationException.class, () -> OrderByBuilder.build(List.of(OrderByItem.asc(null, ""))));
  }
}
