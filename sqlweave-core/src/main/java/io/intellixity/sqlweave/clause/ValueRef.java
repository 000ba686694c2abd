package io.intellixity.sqlweave.clause;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Right-hand side of a {@link Condition}: one of {@link Literal}, {@link FieldReference} or {@link Range}.
 *
 * <p>A literal contributes one bound value, a range two (low, then high) and a field reference none.</p>
 */
public interface ValueRef {

  /** Number of values this reference binds. */
  int arity();

  static Literal literal(Object value) { return new Literal(value); }

  static FieldReference field(String tableAlias, String field) { return new FieldReference(tableAlias, field); }

  static Range range(Object low, Object high) { return new Range(low, high); }

  /**
   * Scalar, array, map or null value. Collections and Java arrays are copied into an unmodifiable list, maps
   * into an unmodifiable map.
   */
  record Literal(Object value) implements ValueRef {
    public Literal {
      value = copyIfArray(value);
    }

    public boolean isArray() { return value instanceof List<?>; }

    @Override public int arity() { return 1; }
  }

  /** Column of another table, rendered verbatim as {@code alias.field}. */
  record FieldReference(String tableAlias, String field) implements ValueRef {
    public FieldReference {
      Objects.requireNonNull(tableAlias, "tableAlias");
      Objects.requireNonNull(field, "field");
    }

    public String sql() { return tableAlias + "." + field; }

    @Override public int arity() { return 0; }
  }

  record Range(Object low, Object high) implements ValueRef {
    public Range {
      low = copyIfArray(low);
      high = copyIfArray(high);
    }

    @Override public int arity() { return 2; }
  }

  private static Object copyIfArray(Object value) {
    if (value instanceof Collection<?> c) {
      return Collections.unmodifiableList(new ArrayList<Object>(c));
    }
    // JSON documents may hold null entries, so no Map.copyOf
    if (value instanceof Map<?, ?> m) {
      return Collections.unmodifiableMap(new LinkedHashMap<Object, Object>(m));
    }
    if (value != null && value.getClass().isArray()) {
      int n = Array.getLength(value);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(Array.get(value, i));
      return Collections.unmodifiableList(out);
    }
    return value;
  }
}
