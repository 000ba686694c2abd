package io.intellixity.sqlweave.clause;

import io.intellixity.sqlweave.sql.BoundSql;

import java.util.List;

/**
 * Renders a {@link ValueRef} into its in-text marker shape: scalar {@code ?}, array {@code (?)},
 * field reference {@code alias.field}, range {@code ? AND ?}.
 *
 * <p>Arrays bind as one value; expanding them into one marker per element is left to the driver layer.</p>
 */
public final class ValueBinder {
  private ValueBinder() {}

  public static BoundSql bind(ValueRef ref) {
    if (ref instanceof ValueRef.Literal l) return bindValue(l.value());
    if (ref instanceof ValueRef.FieldReference f) return BoundSql.text(f.sql());
    if (ref instanceof ValueRef.Range r) return bindValue(r.low()).append(" AND ", bindValue(r.high()));
    throw new IllegalArgumentException("Unknown ValueRef: " + ref);
  }

  static BoundSql bindValue(Object value) {
    return (value instanceof List<?>) ? BoundSql.wrappedMarker(value) : BoundSql.marker(value);
  }
}
