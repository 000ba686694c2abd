package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.clause.Expression;
import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.PlaceholderKind;

import java.util.List;

/** {@code DELETE FROM table [as alias] [USING other] [WHERE ...] [RETURNING ...]}. */
public final class DeleteStatement extends AbstractStatement {
  private final String table;
  private final String using;
  private final BoundSql filter;
  private final String returning;

  public DeleteStatement(PlaceholderKind placeholderKind) {
    this(placeholderKind, null, null, null, null);
  }

  private DeleteStatement(PlaceholderKind placeholderKind, String table, String using, BoundSql filter,
                          String returning) {
    super(placeholderKind);
    this.table = table;
    this.using = using;
    this.filter = filter;
    this.returning = returning;
  }

  public DeleteStatement table(String name) {
    return table(name, null);
  }

  public DeleteStatement table(String name, String alias) {
    return new DeleteStatement(placeholderKind(), tableRef(name, alias), using, filter, returning);
  }

  public DeleteStatement using(String name, String alias) {
    return new DeleteStatement(placeholderKind(), table, "USING " + tableRef(name, alias), filter, returning);
  }

  /** Sets the {@code WHERE} clause, replacing an earlier one; an empty list is a no-op. */
  public DeleteStatement filter(List<Expression> expressions) {
    BoundSql where = where(expressions);
    if (where == null) return this;
    return new DeleteStatement(placeholderKind(), table, using, where, returning);
  }

  public DeleteStatement returning(List<String> names) {
    String r = returningSql(names);
    if (r == null) return this;
    return new DeleteStatement(placeholderKind(), table, using, filter, r);
  }

  @Override
  protected String kind() { return "delete"; }

  @Override
  protected BoundSql assemble() {
    BoundSql sql = BoundSql.text("DELETE FROM " + requireTable(table, "DELETE"));
    if (using != null) sql = sql.append(" ", using);
    if (filter != null) sql = sql.append(" ", filter);
    if (returning != null) sql = sql.append(" ", returning);
    return sql;
  }
}
