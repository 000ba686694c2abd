package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.NestableStatement;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.SqlValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SetBuilderTest {
  private static NestableStatement nested(PlaceholderKind kind) {
    return new NestableStatement() {
      @Override public PlaceholderKind placeholderKind() { return kind; }
      @Override public BoundSql toBoundSql() {
        return BoundSql.text("SELECT u.email FROM users as u WHERE u.id =").append(" ", BoundSql.marker(42));
      }
    };
  }

  @Test
  void rendersLiteralAssignments() {
    AssignmentClause set = SetBuilder.build(List.of(
        Assignment.of("email", "joserizal@ph.com"),
        Assignment.of("password", "secret")));
    assertEquals("SET email = ?, password = ?", set.text());
    assertEquals(List.of("joserizal@ph.com", "secret"), set.values());
  }

  @Test
  void collectionValuesBindAsOneBareMarker() {
    AssignmentClause set = SetBuilder.build(List.of(Assignment.of("tags", List.of("a", "b"))));
    assertEquals("SET tags = ?", set.text());
    assertEquals(List.of(List.of("a", "b")), set.values());
  }

  @Test
  void splicesNestedSelectValuesAtAssignmentPosition() {
    AssignmentClause set = SetBuilder.build(List.of(
        Assignment.of("name", "n"),
        new Assignment("email", SetValue.query(nested(PlaceholderKind.QUESTION_MARK))),
        Assignment.of("status", "s")));
    assertEquals("SET name = ?, email = (SELECT u.email FROM users as u WHERE u.id = ?), status = ?", set.text());
    assertEquals(List.of("n", 42, "s"), set.values());
  }

  @Test
  void nestedStatementMustUseGenericMarkers() {
    SqlValidationException ex = assertThrows(SqlValidationException.class, () -> SetBuilder.build(List.of(
        new Assignment("email", SetValue.query(nested(PlaceholderKind.DOLLAR_SEQUENTIAL))))));
    assertTrue(ex.getMessage().contains("QUESTION_MARK"));
  }

  @Test
  void emptyInputFails() {
    assertThrows(SqlValidationException.class, () -> SetBuilder.build(List.of()));
    assertThrows(SqlValidationException.class, () -> SetBuilder.build(List.of(Assignment.of("", 1))));
  }
}
