package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.clause.Expression;
import io.intellixity.sqlweave.clause.GroupByBuilder;
import io.intellixity.sqlweave.clause.GroupByItem;
import io.intellixity.sqlweave.clause.JoinBuilder;
import io.intellixity.sqlweave.clause.JoinKind;
import io.intellixity.sqlweave.clause.OrderByBuilder;
import io.intellixity.sqlweave.clause.OrderByItem;
import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.NestableStatement;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code SELECT [DISTINCT] cols FROM table as alias [joins] [WHERE] [GROUP BY] [ORDER BY] [LIMIT] [OFFSET]}.
 *
 * <p>Immutable: every call returns a new statement, so a partially built select can be shared as a
 * template without one branch affecting another.</p>
 */
public final class SelectStatement extends AbstractStatement implements NestableStatement {
  private final boolean distinct;
  private final String table;
  private final List<String> columns;
  private final List<BoundSql> joins;
  private final BoundSql filter;
  private final String groupBy;
  private final String orderBy;
  private final Long limit;
  private final Long offset;

  public SelectStatement(PlaceholderKind placeholderKind) {
    this(placeholderKind, false, null, List.of(), List.of(), null, null, null, null, null);
  }

  private SelectStatement(PlaceholderKind placeholderKind, boolean distinct, String table, List<String> columns,
                          List<BoundSql> joins, BoundSql filter, String groupBy, String orderBy,
                          Long limit, Long offset) {
    super(placeholderKind);
    this.distinct = distinct;
    this.table = table;
    this.columns = columns;
    this.joins = joins;
    this.filter = filter;
    this.groupBy = groupBy;
    this.orderBy = orderBy;
    this.limit = limit;
    this.offset = offset;
  }

  public SelectStatement distinct() {
    return new SelectStatement(placeholderKind(), true, table, columns, joins, filter, groupBy, orderBy, limit, offset);
  }

  public SelectStatement table(String name, String alias) {
    return new SelectStatement(placeholderKind(), distinct, tableRef(name, alias), columns, joins, filter,
        groupBy, orderBy, limit, offset);
  }

  /** Qualified columns {@code alias.name}; an empty list selects {@code alias.*}. */
  public SelectStatement columns(String alias, List<String> names) {
    if (alias == null || alias.isEmpty()) throw new SqlValidationException("Column alias is empty");
    List<String> added = new ArrayList<>();
    if (names == null || names.isEmpty()) {
      added.add(alias + ".*");
    } else {
      for (String n : names) added.add(alias + "." + n);
    }
    return withColumns(added);
  }

  /** Columns rendered verbatim (expressions, aggregates); an empty list selects {@code *}. */
  public SelectStatement columnsRaw(List<String> names) {
    return withColumns((names == null || names.isEmpty()) ? List.of("*") : names);
  }

  private SelectStatement withColumns(List<String> added) {
    List<String> all = new ArrayList<>(columns);
    all.addAll(added);
    return new SelectStatement(placeholderKind(), distinct, table, List.copyOf(all), joins, filter,
        groupBy, orderBy, limit, offset);
  }

  /** Adds a join after the ones already present; an empty {@code on} list is a no-op except for CROSS joins. */
  public SelectStatement join(JoinKind kind, String name, String alias, List<Expression> on) {
    if (kind != JoinKind.CROSS && (on == null || on.isEmpty())) return this;
    BoundSql join = JoinBuilder.build(kind, name, alias, on);
    return new SelectStatement(placeholderKind(), distinct, table, columns, plus(joins, join), filter,
        groupBy, orderBy, limit, offset);
  }

  /** Sets the {@code WHERE} clause, replacing an earlier one; an empty list is a no-op. */
  public SelectStatement filter(List<Expression> expressions) {
    BoundSql where = where(expressions);
    if (where == null) return this;
    return new SelectStatement(placeholderKind(), distinct, table, columns, joins, where, groupBy, orderBy,
        limit, offset);
  }

  public SelectStatement groupBy(List<GroupByItem> items) {
    if (items == null || items.isEmpty()) return this;
    return new SelectStatement(placeholderKind(), distinct, table, columns, joins, filter,
        GroupByBuilder.build(items), orderBy, limit, offset);
  }

  public SelectStatement orderBy(List<OrderByItem> items) {
    if (items == null || items.isEmpty()) return this;
    return new SelectStatement(placeholderKind(), distinct, table, columns, joins, filter, groupBy,
        OrderByBuilder.build(items), limit, offset);
  }

  public SelectStatement limit(long n) {
    return new SelectStatement(placeholderKind(), distinct, table, columns, joins, filter, groupBy, orderBy,
        requireNonNegative(n, "LIMIT"), offset);
  }

  public SelectStatement offset(long n) {
    return new SelectStatement(placeholderKind(), distinct, table, columns, joins, filter, groupBy, orderBy,
        limit, requireNonNegative(n, "OFFSET"));
  }

  @Override
  protected String kind() { return "select"; }

  @Override
  protected BoundSql assemble() {
    String from = requireTable(table, "SELECT");
    String cols = columns.isEmpty() ? "*" : String.join(", ", columns);
    BoundSql sql = BoundSql.text((distinct ? "SELECT DISTINCT " : "SELECT ") + cols + " FROM " + from);
    for (BoundSql j : joins) sql = sql.append(" ", j);
    if (filter != null) sql = sql.append(" ", filter);
    if (groupBy != null) sql = sql.append(" ", groupBy);
    if (orderBy != null) sql = sql.append(" ", orderBy);
    if (limit != null) sql = sql.append(" ", "LIMIT " + limit);
    if (offset != null) sql = sql.append(" ", "OFFSET " + offset);
    return sql;
  }
}
