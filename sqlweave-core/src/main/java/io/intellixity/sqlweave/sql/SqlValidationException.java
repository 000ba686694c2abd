package io.intellixity.sqlweave.sql;

/**
 * Raised when a clause or statement is built from invalid input: an empty field, an empty clause item list,
 * mismatched column/value counts, a repeated {@code SET} clause or a nested statement built with the wrong
 * placeholder notation.
 * <p>
 * A statement that fails validation produces neither text nor values.
 */
public final class SqlValidationException extends RuntimeException {
  public SqlValidationException(String message) {
    super(message);
  }

  public SqlValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
