package io.intellixity.sqlweave.clause;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.sqlweave.json.ConditionJsonDeserializer;
import io.intellixity.sqlweave.json.ConditionJsonSerializer;
import io.intellixity.sqlweave.sql.BoundSql;
import io.intellixity.sqlweave.sql.SqlValidationException;

import java.util.Objects;

/**
 * One leaf predicate: {@code [CONNECTIVE] [alias.]field OPERATOR [value]}.
 *
 * <p>The connective is this condition's own prefix; it is never inserted between conditions
 * automatically.</p>
 */
@JsonSerialize(using = ConditionJsonSerializer.class)
@JsonDeserialize(using = ConditionJsonDeserializer.class)
public final class Condition {
  private final String tableAlias;
  private final String field;
  private final Operator operator;
  private final ValueRef value;
  private final Connective connective;

  public Condition(String tableAlias, String field, Operator operator, ValueRef value, Connective connective) {
    this.tableAlias = tableAlias;
    this.field = field;
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.connective = connective;
  }

  public String tableAlias() { return tableAlias; }
  public String field() { return field; }
  public Operator operator() { return operator; }
  public ValueRef value() { return value; }
  public Connective connective() { return connective; }

  public Condition withConnective(Connective connective) {
    return new Condition(tableAlias, field, operator, value, connective);
  }

  public Condition and() { return withConnective(Connective.AND); }
  public Condition or() { return withConnective(Connective.OR); }

  public static Condition of(String tableAlias, String field, Operator operator, ValueRef value) {
    return new Condition(tableAlias, field, operator, value, null);
  }

  public static Condition of(String field, Operator operator, ValueRef value) {
    return new Condition(null, field, operator, value, null);
  }

  /** Rendered text of this condition, e.g. {@code AND t.age BETWEEN ? AND ?}. */
  public String render() { return bind().text(); }

  /** Rendered fragment with its marker offsets and bound values. */
  public BoundSql bind() {
    if (field == null || field.isEmpty()) {
      throw new SqlValidationException("Condition field is empty (operator " + operator + ")");
    }
    String column = (tableAlias == null || tableAlias.isEmpty()) ? field : tableAlias + "." + field;
    BoundSql sql = BoundSql.text(column + " " + operator.sql());
    if (value != null && operator.consultsValue()) {
      sql = sql.append(" ", ValueBinder.bind(value));
    }
    return connective == null ? sql : sql.prepend(connective.sql() + " ");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return Objects.equals(tableAlias, c.tableAlias) && Objects.equals(field, c.field)
        && operator == c.operator && Objects.equals(value, c.value) && connective == c.connective;
  }

  @Override
  public int hashCode() { return Objects.hash(tableAlias, field, operator, value, connective); }

  @Override
  public String toString() {
    return "Condition[" + (tableAlias == null ? "" : tableAlias + ".") + field + " " + operator
        + " " + value + (connective == null ? "" : ", connective=" + connective) + "]";
  }
}
