package com.squareup.markup;

import java.util.Objects;

/**
 * A recoverable condition met during a tokenization run. The lexer never throws on
 * bad input; instead it applies its {@linkplain LexerOptions fallback policies} and
 * records one of these, so that callers can decide whether the input was acceptable.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class LexerDiagnostic {

  /**
   * The kinds of conditions the lexer recovers from.
   */
  public enum Kind {
    /** No rule of the current state matched at the offset. */
    NO_MATCH,
    /** A rule popped while only one state was on the stack. */
    STACK_UNDERFLOW,
    /** A dynamic push selected a state that is not in the table. */
    UNKNOWN_STATE,
    /** Too many zero-width transitions happened at the same offset. */
    ZERO_WIDTH_LOOP
  }

  /** What happened. */
  public final Kind kind;
  /** The offset at which it happened. */
  public final int offset;
  /** The state on top of the stack when it happened. */
  public final String state;
  /** A human-readable description. */
  public final String message;

  /**
   * Create a new diagnostic.
   *
   * @param kind See {@link #kind}.
   * @param offset See {@link #offset}.
   * @param state See {@link #state}.
   * @param message See {@link #message}.
   */
  public LexerDiagnostic(Kind kind, int offset, String state, String message) {
    this.kind = Objects.requireNonNull(kind);
    this.offset = offset;
    this.state = Objects.requireNonNull(state);
    this.message = Objects.requireNonNull(message);
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    LexerDiagnostic that = (LexerDiagnostic) o;
    return offset == that.offset &&
        kind == that.kind &&
        state.equals(that.state) &&
        message.equals(that.message);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(kind, offset, state, message);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return kind + "@" + offset + " in '" + state + "': " + message;
  }
}
