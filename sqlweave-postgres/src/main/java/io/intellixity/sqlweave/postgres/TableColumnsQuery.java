package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.sql.SqlValidationException;

/**
 * Introspection query listing a table's columns and their data types. The result is consumed by the caller;
 * nothing here parses it.
 */
public final class TableColumnsQuery {
  private TableColumnsQuery() {}

  public static String build(String table) {
    if (table == null || table.isEmpty()) throw new SqlValidationException("Table name is empty");
    return "SELECT column_name, data_type FROM information_schema.columns WHERE table_name = '"
        + table.replace("'", "''") + "'";
  }
}
