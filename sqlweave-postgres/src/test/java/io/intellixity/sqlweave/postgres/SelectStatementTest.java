package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.clause.Conditions;
import io.intellixity.sqlweave.clause.Expression;
import io.intellixity.sqlweave.clause.GroupByItem;
import io.intellixity.sqlweave.clause.JoinKind;
import io.intellixity.sqlweave.clause.OrderByItem;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.SqlStatement;
import io.intellixity.sqlweave.sql.SqlValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SelectStatementTest {
  private static final PostgresStatements PG = new PostgresStatements(PlaceholderKind.DOLLAR_SEQUENTIAL);

  @Test
  void fullSelectWithJoinFilterGroupOrderAndPaging() {
    SqlStatement ss = PG.select()
        .table("orders", "o")
        .columns("o", List.of("id", "user_id", "product_id"))
        .join(JoinKind.LEFT, "products", "p", List.of(Expression.of(Conditions.fieldEq("p.id", "o", "product_id"))))
        .filter(List.of(Expression.of(Conditions.eq("o.id", 1))))
        .groupBy(List.of(new GroupByItem("o", "user_id")))
        .orderBy(List.of(OrderByItem.asc("o", "user_id")))
        .limit(10)
        .offset(0)
        .build();

    assertEquals("SELECT o.id, o.user_id, o.product_id FROM orders as o"
        + " LEFT JOIN products as p ON p.id = o.product_id"
        + " WHERE o.id = $1 GROUP BY o.user_id ORDER BY o.user_id ASC LIMIT 10 OFFSET 0", ss.sql());
    assertEquals(List.of(1), ss.values());
  }

  @Test
  void valuesFollowClauseOrderNotCallOrder() {
    SqlStatement ss = PG.select()
        .filter(List.of(Expression.of(Conditions.eq("o.status", "NEW"))))
        .join(JoinKind.INNER, "products", "p", List.of(Expression.of(Conditions.eq("p.kind", "BOOK"))))
        .table("orders", "o")
        .build();

    assertEquals("SELECT * FROM orders as o INNER JOIN products as p ON p.kind = $1 WHERE o.status = $2", ss.sql());
    assertEquals(List.of("BOOK", "NEW"), ss.values());
  }

  @Test
  void statementsAreImmutable() {
    SelectStatement base = PG.select().table("users", "u").columns("u", List.of("id"));
    SelectStatement byEmail = base.filter(List.of(Expression.of(Conditions.eq("u.email", "a@b"))));
    SelectStatement byName = base.filter(List.of(Expression.of(Conditions.eq("u.name", "n"))));

    assertEquals("SELECT u.id FROM users as u", base.build().sql());
    assertEquals("SELECT u.id FROM users as u WHERE u.email = $1", byEmail.build().sql());
    assertEquals("SELECT u.id FROM users as u WHERE u.name = $1", byName.build().sql());
  }

  @Test
  void laterFilterReplacesEarlierOne() {
    SqlStatement ss = PG.select().table("users", "u")
        .filter(List.of(Expression.of(Conditions.eq("u.a", 1))))
        .filter(List.of(Expression.of(Conditions.eq("u.b", 2))))
        .build();
    assertEquals("SELECT * FROM users as u WHERE u.b = $1", ss.sql());
    assertEquals(List.of(2), ss.values());
  }

  @Test
  void emptyInputsAreNoOps() {
    SelectStatement base = PG.select().table("users", "u");
    SelectStatement same = base.filter(List.of()).groupBy(List.of()).orderBy(null)
        .join(JoinKind.LEFT, "x", "x", List.of());
    assertEquals(base.build(), same.build());
  }

  @Test
  void distinctStarAndRawColumns() {
    assertEquals("SELECT DISTINCT u.* FROM users as u",
        PG.select().distinct().table("users", "u").columns("u", List.of()).build().sql());
    assertEquals("SELECT count(*), max(u.id) FROM users as u",
        PG.select().table("users", "u").columnsRaw(List.of("count(*)", "max(u.id)")).build().sql());
    assertEquals("SELECT u.id FROM users as u CROSS JOIN regions as r",
        PG.select().table("users", "u").columns("u", List.of("id"))
            .join(JoinKind.CROSS, "regions", "r", List.of()).build().sql());
  }

  @Test
  void jsonOperatorsAreNotRenumbered() {
    SqlStatement ss = PG.select().table("docs", "d")
        .filter(List.of(Expression.build(List.of(
            Conditions.jsonHasKey("d.body", "k"),
            Conditions.jsonHasAnyKeys("d.body", List.of("a", "b")).and(),
            Conditions.eq("d.id", 7).and()), null)))
        .build();
    assertEquals("SELECT * FROM docs as d WHERE d.body ? $1 AND d.body ?| ($2) AND d.id = $3", ss.sql());
    assertEquals(List.of("k", List.of("a", "b"), 7), ss.values());
  }

  @Test
  void invalidInputFails() {
    assertThrows(SqlValidationException.class, () -> PG.select().build());
    assertThrows(SqlValidationException.class, () -> PG.select().limit(-1));
    assertThrows(SqlValidationException.class, () -> PG.select().table("", "u"));
  }

  @Test
  void qualifiedColumnsNeedAnAlias() {
    SelectStatement base = PG.select().table("users", "u");
    assertThrows(SqlValidationException.class, () -> base.columns(null, List.of("id")));
    assertThrows(SqlValidationException.class, () -> base.columns("", List.of()));
  }
}
