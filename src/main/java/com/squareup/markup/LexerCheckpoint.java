package com.squareup.markup;

import java.util.List;
import java.util.Objects;

/**
 * <p>
 *   A frozen lexer context: the context stack and the offset reached by a
 *   {@link TokenStream}. A checkpoint lets a caller lex a document piecewise
 *   (e.g., line by line, re-lexing only edited lines) by
 *   {@linkplain StateLexer#resume(CharSequence, LexerCheckpoint) resuming} on the
 *   next piece of text in the same nested context the previous piece ended in.
 * </p>
 *
 * <p>
 *   Checkpoints are immutable values, and two checkpoints with equal stacks and
 *   offsets are equal; an editor can thus stop re-lexing as soon as the checkpoint
 *   after an edited line equals the one recorded before the edit.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class LexerCheckpoint {

  /** The context stack, bottom first. Never empty. */
  private final List<String> stack;
  /** The absolute offset the next token will start from. */
  private final int offset;

  /**
   * Create a checkpoint.
   *
   * @param stack See {@link #stack}. The list is copied.
   * @param offset See {@link #offset}.
   */
  public LexerCheckpoint(List<String> stack, int offset) {
    Objects.requireNonNull(stack, "Checkpoint stack may not be null");
    if (stack.isEmpty()) {
      throw new IllegalArgumentException("Checkpoint stack may not be empty");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("Checkpoint offset may not be negative: " + offset);
    }
    this.stack = List.copyOf(stack);
    this.offset = offset;
  }

  /**
   * Create a checkpoint for starting a document in a single state.
   *
   * @param initialState The state to start in.
   *
   * @return A checkpoint at offset 0 with the given state as the only stack entry.
   */
  public static LexerCheckpoint start(String initialState) {
    return new LexerCheckpoint(List.of(initialState), 0);
  }

  /**
   * @return The frozen context stack, bottom first. This list is immutable.
   */
  public List<String> stack() {
    return stack;
  }

  /**
   * @return The state that was on top of the stack.
   */
  public String currentState() {
    return stack.get(stack.size() - 1);
  }

  /**
   * @return The offset at which lexing resumes.
   */
  public int offset() {
    return offset;
  }

  /**
   * @param delta The number of characters to shift the offset by.
   *
   * @return A checkpoint with the same stack but a shifted offset; e.g., to account
   *         for a newline that was not part of the text that was lexed.
   */
  public LexerCheckpoint shift(int delta) {
    return new LexerCheckpoint(stack, offset + delta);
  }

  /** {@inheritDoc} */
  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    LexerCheckpoint that = (LexerCheckpoint) o;
    return offset == that.offset && stack.equals(that.stack);
  }

  /** {@inheritDoc} */
  @Override public int hashCode() {
    return Objects.hash(stack, offset);
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return stack + "@" + offset;
  }
}
