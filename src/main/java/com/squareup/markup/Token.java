package com.squareup.markup;

import java.util.Objects;

/**
 * <p>
 *   A single classified span of input text, as produced by a {@link TokenStream}.
 *   A token is a plain value: its kind is the kind of the {@link Rule} that
 *   matched it (or one of the fallback kinds configured in {@link LexerOptions}),
 *   its text is exactly the matched substring, and its offset is the absolute
 *   character position of the first character of the match.
 * </p>
 *
 * <p>
 *   Tokens are never constructed by the tree side of this library, and the
 *   lexer never looks at anything but its own tokens.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class Token {

  /** The kind of this token, e.g., "IDENT". */
  private final String kind;
  /** The exact text that was matched. */
  private final String text;
  /** The absolute character offset at which {@link #text} starts. */
  private final int offset;

  /**
   * Create a new token.
   *
   * @param kind See {@link #kind}.
   * @param text See {@link #text}.
   * @param offset See {@link #offset}.
   */
  public Token(String kind, String text, int offset) {
    if (kind == null) {
      throw new NullPointerException("Token kind may not be null");
    }
    if (text == null) {
      throw new NullPointerException("Token text may not be null");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("Token offset may not be negative: " + offset);
    }
    this.kind = kind;
    this.text = text;
    this.offset = offset;
  }

  /**
   * @return The kind of this token.
   */
  public String kind() {
    return kind;
  }

  /**
   * @return The matched text of this token.
   */
  public String text() {
    return text;
  }

  /**
   * @return The offset of the first character of this token, inclusive.
   */
  public int offset() {
    return offset;
  }

  /**
   * @return The offset just past the last character of this token, exclusive.
   */
  public int end() {
    return offset + text.length();
  }

  /**
   * @return The number of characters in this token.
   */
  public int length() {
    return text.length();
  }

  /**
   * Check whether this token is of the given kind.
   *
   * @param kind The kind to check against.
   *
   * @return True if this token's kind equals the argument.
   */
  public boolean is(String kind) {
    return this.kind.equals(kind);
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Token that = (Token) o;
    return offset == that.offset &&
        kind.equals(that.kind) &&
        text.equals(that.text);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(kind, text, offset);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return kind + "(\"" + text + "\")@" + offset;
  }
}
