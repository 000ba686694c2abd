package io.intellixity.sqlweave.sql;

/**
 * A statement that can be embedded into another one (e.g. a sub-select on the right-hand side of a
 * {@code SET} assignment).
 *
 * <p>Nested statements are spliced in their generic form and only substituted once, by the outermost
 * statement, so they must be configured with {@link PlaceholderKind#QUESTION_MARK}.</p>
 */
public interface NestableStatement {
  PlaceholderKind placeholderKind();

  /** Fully assembled text with generic markers, before placeholder substitution. */
  BoundSql toBoundSql();
}
