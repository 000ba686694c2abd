package io.intellixity.sqlweave.postgres;

import io.intellixity.sqlweave.clause.Expression;
import io.intellixity.sqlweave.clause.WhereBuilder;
import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.PlaceholderKind;
import io.intellixity.sqlweave.sql.Placeholders;
import io.intellixity.sqlweave.sql.SqlStatement;
import io.intellixity.sqlweave.sql.SqlValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base for statement assemblers.
 *
 * Subclasses concatenate their clause slots in canonical order in {@link #assemble()}; {@link #build()}
 * trims the result and runs the placeholder substitution pass exactly once, over the whole statement.
 */
public abstract class AbstractStatement {
  private static final Logger log = LoggerFactory.getLogger(AbstractStatement.class);

  private final PlaceholderKind placeholderKind;

  protected AbstractStatement(PlaceholderKind placeholderKind) {
    this.placeholderKind = Objects.requireNonNull(placeholderKind, "placeholderKind");
  }

  public PlaceholderKind placeholderKind() { return placeholderKind; }

  /** Statement kind used in log lines, e.g. {@code select}. */
  protected abstract String kind();

  /** Clause fragments in canonical order, still carrying generic markers. */
  protected abstract BoundSql assemble();

  /** Assembled text with generic markers, before substitution. */
  public final BoundSql toBoundSql() {
    return assemble().trim();
  }

  /** Values in the order their placeholders appear in {@link #build()}'s text. */
  public final List<Object> values() {
    return toBoundSql().values();
  }

  public final SqlStatement build() {
    BoundSql sql = toBoundSql();
    SqlStatement out = Placeholders.substitute(sql, placeholderKind);
    debugSql(out);
    return out;
  }

  protected static BoundSql where(List<Expression> expressions) {
    if (expressions == null || expressions.isEmpty()) return null;
    return WhereBuilder.build(expressions);
  }

  protected static String returningSql(List<String> columns) {
    if (columns == null || columns.isEmpty()) return null;
    for (String c : columns) {
      if (c == null || c.isEmpty()) throw new SqlValidationException("RETURNING column is empty");
    }
    return "RETURNING " + String.join(", ", columns);
  }

  protected static String tableRef(String table, String alias) {
    if (table == null || table.isEmpty()) throw new SqlValidationException("Table name is empty");
    return (alias == null || alias.isEmpty()) ? table : table + " as " + alias;
  }

  protected static String requireTable(String table, String kind) {
    if (table == null) throw new SqlValidationException(kind + " statement has no table");
    return table;
  }

  protected static long requireNonNegative(long n, String what) {
    if (n < 0) throw new SqlValidationException(what + " must be >= 0, got " + n);
    return n;
  }

  /** Append {@code item} to an unmodifiable copy of {@code list}. */
  protected static <T> List<T> plus(List<T> list, T item) {
    List<T> out = new ArrayList<>(list.size() + 1);
    out.addAll(list);
    out.add(item);
    return Collections.unmodifiableList(out);
  }

  protected static List<String> copyNames(List<String> names) {
    return names == null ? List.of() : List.copyOf(names);
  }

  private void debugSql(SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlweave.build kind={} placeholder={} valueCount={} sql={}",
        kind(), ss.placeholderKind().id(), ss.values().size(), ss.sql());

    // TRACE: value summary only, raw values may carry PII
    if (log.isTraceEnabled() && !ss.values().isEmpty()) {
      int idx = 1;
      for (Object v : ss.values()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("sqlweave.value index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }
}
