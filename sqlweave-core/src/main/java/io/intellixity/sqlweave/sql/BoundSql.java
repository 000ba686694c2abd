package io.intellixity.sqlweave.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text carrying generic {@code ?} markers, the offset of each marker and the value bound to it.
 *
 * <p>Every fragment produced by the clause builders is a {@code BoundSql}. Concatenation shifts the marker
 * offsets of the right-hand side, so the final statement knows exactly which {@code ?} characters are
 * placeholders and which belong to operator text (e.g. the JSON key operators {@code ?}, {@code ?|}).</p>
 *
 * <p>Invariant: {@code markers().size() == values().size()}, offsets strictly increase and each one points
 * at a {@code ?} in {@link #text()}.</p>
 */
public final class BoundSql {
  public static final char MARKER = '?';

  private static final BoundSql EMPTY = new BoundSql("", List.of(), List.of());

  private final String text;
  private final List<Integer> markers;
  private final List<Object> values;

  private BoundSql(String text, List<Integer> markers, List<Object> values) {
    this.text = Objects.requireNonNull(text, "text");
    this.markers = markers;
    this.values = values;
    checkMarkers();
  }

  public static BoundSql empty() { return EMPTY; }

  /** Literal SQL text; any {@code ?} inside it is operator text, never a placeholder. */
  public static BoundSql text(String sql) {
    if (sql == null || sql.isEmpty()) return EMPTY;
    return new BoundSql(sql, List.of(), List.of());
  }

  /** A single bare marker: {@code ?}. */
  public static BoundSql marker(Object value) {
    return new BoundSql(String.valueOf(MARKER), List.of(0), listOf(value));
  }

  /** A single parenthesized marker, {@code (?)}, used for array values. */
  public static BoundSql wrappedMarker(Object value) {
    return new BoundSql("(" + MARKER + ")", List.of(1), listOf(value));
  }

  public String text() { return text; }
  public List<Integer> markers() { return markers; }
  public List<Object> values() { return values; }

  public boolean isEmpty() { return text.isEmpty(); }

  /** Concatenate {@code this + separator + other}; an empty side drops the separator. */
  public BoundSql append(String separator, BoundSql other) {
    Objects.requireNonNull(other, "other");
    if (other.isEmpty()) return this;
    if (isEmpty()) return other;
    String sep = separator == null ? "" : separator;
    int shift = text.length() + sep.length();

    List<Integer> m = new ArrayList<>(markers.size() + other.markers.size());
    m.addAll(markers);
    for (int offset : other.markers) m.add(offset + shift);

    List<Object> v = new ArrayList<>(values.size() + other.values.size());
    v.addAll(values);
    v.addAll(other.values);
    return new BoundSql(text + sep + other.text, Collections.unmodifiableList(m), Collections.unmodifiableList(v));
  }

  public BoundSql append(String separator, String sql) {
    return append(separator, text(sql));
  }

  public BoundSql prepend(String prefix) {
    if (prefix == null || prefix.isEmpty()) return this;
    return text(prefix).append("", this);
  }

  public BoundSql wrap(String open, String close) {
    return prepend(open).append("", text(close));
  }

  public BoundSql trim() {
    int start = 0;
    int end = text.length();
    while (start < end && Character.isWhitespace(text.charAt(start))) start++;
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) end--;
    if (start == 0 && end == text.length()) return this;

    List<Integer> m = new ArrayList<>(markers.size());
    for (int offset : markers) m.add(offset - start);
    return new BoundSql(text.substring(start, end), Collections.unmodifiableList(m), values);
  }

  /** Join non-empty parts with {@code separator}, in order. */
  public static BoundSql join(String separator, List<BoundSql> parts) {
    BoundSql out = EMPTY;
    for (BoundSql part : parts) {
      if (part == null) continue;
      out = out.append(separator, part);
    }
    return out;
  }

  private void checkMarkers() {
    if (markers.size() != values.size()) {
      throw new IllegalStateException("Marker/value count mismatch: markers=" + markers.size()
          + " values=" + values.size() + " sql=" + text);
    }
    int prev = -1;
    for (int offset : markers) {
      if (offset <= prev || offset >= text.length() || text.charAt(offset) != MARKER) {
        throw new IllegalStateException("Invalid marker offset " + offset + " in sql: " + text);
      }
      prev = offset;
    }
  }

  private static List<Object> listOf(Object value) {
    // List.of rejects null, and null is a legitimate bind value
    return Collections.singletonList(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BoundSql b)) return false;
    return text.equals(b.text) && markers.equals(b.markers) && values.equals(b.values);
  }

  @Override
  public int hashCode() { return Objects.hash(text, markers, values); }

  @Override
  public String toString() { return "BoundSql[text=" + text + ", values=" + values + "]"; }
}
