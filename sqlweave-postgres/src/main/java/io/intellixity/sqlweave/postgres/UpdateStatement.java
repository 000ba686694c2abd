package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.clause.Assignment;
import io.intellixity.sqlweave.clause.AssignmentClause;
import io.intellixity.sqlweave.clause.Expression;
import io.intellixity.sqlweave.clause.SetBuilder;
import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.List;

/** {@code UPDATE table SET ... [WHERE ...] [RETURNING ...]}. */
public final class UpdateStatement extends AbstractStatement {
  private final String table;
  private final AssignmentClause set;
  private final BoundSql filter;
  private final String returning;

  public UpdateStatement(PlaceholderKind placeholderKind) {
    this(placeholderKind, null, null, null, null);
  }

  private UpdateStatement(PlaceholderKind placeholderKind, String table, AssignmentClause set, BoundSql filter,
                          String returning) {
    super(placeholderKind);
    this.table = table;
    this.set = set;
    this.filter = filter;
    this.returning = returning;
  }

  public UpdateStatement table(String name) {
    return table(name, null);
  }

  public UpdateStatement table(String name, String alias) {
    return new UpdateStatement(placeholderKind(), tableRef(name, alias), set, filter, returning);
  }

  /** The {@code SET} clause; may be given once per statement. */
  public UpdateStatement set(List<Assignment> assignments) {
    if (set != null) throw new SqlValidationException("SET can only be given once per UPDATE statement");
    return new UpdateStatement(placeholderKind(), table, SetBuilder.build(assignments), filter, returning);
  }

  /** Sets the {@code WHERE} clause, replacing an earlier one; an empty list is a no-op. */
  public UpdateStatement filter(List<Expression> expressions) {
    BoundSql where = where(expressions);
    if (where == null) return this;
    return new UpdateStatement(placeholderKind(), table, set, where, returning);
  }

  public UpdateStatement returning(List<String> names) {
    String r = returningSql(names);
    if (r == null) return this;
    return new UpdateStatement(placeholderKind(), table, set, filter, r);
  }

  @Override
  protected String kind() { return "update"; }

  @Override
  protected BoundSql assemble() {
    String target = requireTable(table, "UPDATE");
    if (set == null) throw new SqlValidationException("UPDATE " + target + " has no SET clause");
    BoundSql sql = BoundSql.text("UPDATE " + target).append(" ", set.sql());
    if (filter != null) sql = sql.append(" ", filter);
    if (returning != null) sql = sql.append(" ", returning);
    return sql;
  }
}
