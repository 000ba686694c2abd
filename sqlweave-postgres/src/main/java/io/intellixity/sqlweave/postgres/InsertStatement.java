package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** {@code INSERT INTO table(c1, c2) VALUES (?, ?), (?, ?) [RETURNING ...]}. */
public final class InsertStatement extends AbstractStatement {
  private final String table;
  private final List<String> columns;
  private final List<List<Object>> rows;
  private final String returning;

  public InsertStatement(PlaceholderKind placeholderKind) {
    this(placeholderKind, null, List.of(), List.of(), null);
  }

  private InsertStatement(PlaceholderKind placeholderKind, String table, List<String> columns,
                          List<List<Object>> rows, String returning) {
    super(placeholderKind);
    this.table = table;
    this.columns = columns;
    this.rows = rows;
    this.returning = returning;
  }

  public InsertStatement table(String name) {
    return new InsertStatement(placeholderKind(), tableRef(name, null), columns, rows, returning);
  }

  public InsertStatement columns(List<String> names) {
    List<String> cols = copyNames(names);
    for (String c : cols) {
      if (c.isEmpty()) throw new SqlValidationException("INSERT column is empty");
    }
    return new InsertStatement(placeholderKind(), table, cols, rows, returning);
  }

  /** Adds one row; its size must match the column count. {@code null} entries bind SQL NULL. */
  public InsertStatement values(List<?> row) {
    if (row == null || row.size() != columns.size()) {
      throw new SqlValidationException("Mismatched number of columns and values: columns=" + columns.size()
          + " values=" + (row == null ? 0 : row.size()));
    }
    List<Object> copy = Collections.unmodifiableList(new ArrayList<Object>(row));
    return new InsertStatement(placeholderKind(), table, columns, plus(rows, copy), returning);
  }

  public InsertStatement returning(List<String> names) {
    String r = returningSql(names);
    if (r == null) return this;
    return new InsertStatement(placeholderKind(), table, columns, rows, r);
  }

  /** Rows added so far, in insertion order. */
  public List<List<Object>> rows() { return rows; }

  @Override
  protected String kind() { return "insert"; }

  @Override
  protected BoundSql assemble() {
    String into = requireTable(table, "INSERT");
    if (columns.isEmpty()) throw new SqlValidationException("INSERT into " + into + " has no columns");
    if (rows.isEmpty()) throw new SqlValidationException("INSERT into " + into + " has no values");

    List<BoundSql> tuples = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      if (row.size() != columns.size()) {
        throw new SqlValidationException("Mismatched number of columns and values: columns=" + columns.size()
            + " values=" + row.size());
      }
      List<BoundSql> markers = new ArrayList<>(row.size());
      for (Object v : row) markers.add(BoundSql.marker(v));
      tuples.add(BoundSql.join(", ", markers).wrap("(", ")"));
    }

    BoundSql sql = BoundSql.text("INSERT INTO " + into + "(" + String.join(", ", columns) + ") VALUES ")
        .append("", BoundSql.join(", ", tuples));
    if (returning != null) sql = sql.append(" ", returning);
    return sql;
  }
}
