package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.clause.Conditions;
import io.intellixity.sqlweave.clause.Expression;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.SqlStatement;
import io.intellixity.sqlweave.sql.SqlValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DeleteStatementTest {
  @Test
  void aliasedDeleteWithReturning() {
    SqlStatement ss = new DeleteStatement(PlaceholderKind.QUESTION_MARK)
        .table("users", "u")
        .filter(List.of(Expression.of(Conditions.eq("u.email", "x"))))
        .returning(List.of("u.email", "u.name"))
        .build();

    assertEquals("DELETE FROM users as u WHERE u.email = ? RETURNING u.email, u.name", ss.sql());
    assertEquals(List.of("x"), ss.values());
  }

  @Test
  void usingClauseComesBeforeWhere() {
    SqlStatement ss = new DeleteStatement(PlaceholderKind.DOLLAR_SEQUENTIAL)
        .filter(List.of(Expression.build(List.of(
            Conditions.fieldEq("o.user_id", "u", "id"),
            Conditions.eq("u.status", "BANNED").and()), null)))
        .using("users", "u")
        .table("orders", "o")
        .build();

    assertEquals("DELETE FROM orders as o USING users as u WHERE o.user_id = u.id AND u.status = $1", ss.sql());
    assertEquals(List.of("BANNED"), ss.values());
  }

  @Test
  void unfilteredDeleteAndMissingTable() {
    assertEquals("DELETE FROM audit", new DeleteStatement(PlaceholderKind.QUESTION_MARK).table("audit").build().sql());
    assertThrows(SqlValidationException.class, () -> new DeleteStatement(PlaceholderKind.QUESTION_MARK).build());
  }
}
