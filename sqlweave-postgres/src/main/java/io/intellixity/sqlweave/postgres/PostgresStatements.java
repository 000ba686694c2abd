package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.config.SqlWeaveSettings;
import io.intellixity.sqlweave.sql.PlaceholderKind;

import java.util.Objects;

/** Entry point creating statements that share one placeholder notation. */
public final class PostgresStatements {
  private final PlaceholderKind placeholderKind;

  public PostgresStatements(PlaceholderKind placeholderKind) {
    this.placeholderKind = Objects.requireNonNull(placeholderKind, "placeholderKind");
  }

  /** Uses the notation configured in {@code META-INF/sqlweave.properties}. */
  public static PostgresStatements fromSettings() {
    return fromSettings(SqlWeaveSettings.load());
  }

  public static PostgresStatements fromSettings(SqlWeaveSettings settings) {
    return new PostgresStatements(settings.placeholderKind());
  }

  public PlaceholderKind placeholderKind() { return placeholderKind; }

  public SelectStatement select() { return new SelectStatement(placeholderKind); }
  public InsertStatement insert() { return new InsertStatement(placeholderKind); }
  public UpdateStatement update() { return new UpdateStatement(placeholderKind); }
  public DeleteStatement delete() { return new DeleteStatement(placeholderKind); }

  /** Select meant for nesting (e.g. {@code SET x = (SELECT ...)}); always uses generic markers. */
  public SelectStatement subSelect() { return new SelectStatement(PlaceholderKind.QUESTION_MARK); }

  public String tableColumns(String table) { return TableColumnsQuery.build(table); }
}
