package io.intellixity.sqlweave.clause;

import java.util.Collection;

/**
 * Shorthand factories for {@link Condition}. {@code field} may be qualified as {@code alias.field};
 * the part before the first dot becomes the table alias.
 */
public final class Conditions {
  private Conditions() {}

  public static Condition eq(String field, Object value) { return literal(field, Operator.EQ, value); }
  public static Condition neq(String field, Object value) { return literal(field, Operator.NEQ, value); }
  public static Condition gt(String field, Object value) { return literal(field, Operator.GT, value); }
  public static Condition gte(String field, Object value) { return literal(field, Operator.GTE, value); }
  public static Condition lt(String field, Object value) { return literal(field, Operator.LT, value); }
  public static Condition lte(String field, Object value) { return literal(field, Operator.LTE, value); }

  public static Condition like(String field, Object value) { return literal(field, Operator.LIKE, value); }
  public static Condition notLike(String field, Object value) { return literal(field, Operator.NOT_LIKE, value); }
  public static Condition ilike(String field, Object value) { return literal(field, Operator.ILIKE, value); }

  public static Condition in(String field, Collection<?> values) { return literal(field, Operator.IN, values); }
  public static Condition notIn(String field, Collection<?> values) { return literal(field, Operator.NOT_IN, values); }

  public static Condition isNull(String field) { return of(field, Operator.IS_NULL, null); }
  public static Condition notNull(String field) { return of(field, Operator.NOT_NULL, null); }

  public static Condition between(String field, Object low, Object high) {
    return of(field, Operator.BETWEEN, ValueRef.range(low, high));
  }

  public static Condition notBetween(String field, Object low, Object high) {
    return of(field, Operator.NOT_BETWEEN, ValueRef.range(low, high));
  }

  /** Column-to-column comparison, e.g. join keys: {@code p.id = o.product_id}. */
  public static Condition fieldEq(String field, String otherAlias, String otherField) {
    return of(field, Operator.EQ, ValueRef.field(otherAlias, otherField));
  }

  /** jsonb containment; {@code document} is bound as a single value. */
  public static Condition jsonContains(String field, Object document) { return literal(field, Operator.JSON_CONTAINS, document); }
  public static Condition jsonContainedBy(String field, Object document) { return literal(field, Operator.JSON_CONTAINED_BY, document); }
  public static Condition jsonHasKey(String field, String key) { return literal(field, Operator.JSON_HAS_KEY, key); }
  public static Condition jsonHasAnyKeys(String field, Collection<String> keys) { return literal(field, Operator.JSON_HAS_ANY_KEYS, keys); }
  public static Condition jsonHasAllKeys(String field, Collection<String> keys) { return literal(field, Operator.JSON_HAS_ALL_KEYS, keys); }

  private static Condition literal(String field, Operator op, Object value) {
    return of(field, op, ValueRef.literal(value));
  }

  private static Condition of(String qualified, Operator op, ValueRef value) {
    if (qualified != null) {
      int dot = qualified.indexOf('.');
      if (dot > 0) {
        return Condition.of(qualified.substring(0, dot), qualified.substring(dot + 1), op, value);
      }
    }
    return Condition.of(qualified, op, value);
  }
}
