package com.squareup.markup;

/**
 * Thrown at setup time when a {@link StateTable} (or one of its {@link Rule}s) is
 * malformed; e.g., a rule pushes a state that was never defined. This mirrors
 * {@link java.util.regex.PatternSyntaxException}: it is unchecked, and it is only
 * ever thrown while building a table, never while tokenizing.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class InvalidStateTableException extends IllegalArgumentException {

  /**
   * Create a new exception with a human-readable explanation.
   *
   * @param message What is wrong with the table.
   */
  public InvalidStateTableException(String message) {
    super(message);
  }

  /**
   * Create a new exception caused by a lower-level failure.
   *
   * @param message What is wrong with the table.
   * @param cause The failure that revealed the problem.
   */
  public InvalidStateTableException(String message, Throwable cause) {
    super(message, cause);
  }
}
