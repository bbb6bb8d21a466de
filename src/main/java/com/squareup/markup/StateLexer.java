package com.squareup.markup;

import java.util.List;
import java.util.Objects;

/**
 * <p>
 *   A context-stack driven lexer over a {@link StateTable}. The lexer itself holds
 *   no per-run state, so a single instance can be shared freely; every call to
 *   {@link #tokenize(CharSequence, String)} starts an independent, lazy
 *   {@link TokenStream}.
 * </p>
 *
 * <p>
 *   A typical invocation sequence is thus
 * </p>
 *
 * <blockquote><pre>
 * StateLexer lexer = new StateLexer(table);
 * TokenStream tokens = lexer.{@link #tokenize(CharSequence, String) tokenize}("a {b}", "default");
 * while (tokens.hasNext()) {
 *   Token token = tokens.next();
 *   ...
 * }
 * List&lt;String&gt; unclosed = tokens.contextStack();
 * </pre></blockquote>
 *
 * <p>
 *   Bad input never causes an exception: unmatched text and unbalanced pops are
 *   handled by the {@link LexerOptions} of this lexer. The only errors thrown are for
 *   misuse at setup time; e.g., an initial state that is not in the table.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class StateLexer {

  /** The states this lexer runs. */
  private final StateTable table;
  /** The fallback policies of this lexer. */
  private final LexerOptions options;

  /**
   * Create a lexer.
   *
   * @param table See {@link #table}.
   * @param options See {@link #options}.
   */
  public StateLexer(StateTable table, LexerOptions options) {
    this.table = Objects.requireNonNull(table, "State table may not be null");
    this.options = Objects.requireNonNull(options, "Lexer options may not be null");
  }

  /**
   * Create a lexer with the {@linkplain LexerOptions#DEFAULT default options}.
   *
   * @param table See {@link #table}.
   */
  public StateLexer(StateTable table) {
    this(table, LexerOptions.DEFAULT);
  }

  /**
   * Tokenize a text with the default options. This is a convenience for
   * {@code new StateLexer(table).tokenize(text, initialState)}.
   *
   * @param text The text to tokenize.
   * @param table The states to use.
   * @param initialState The state to start in.
   *
   * @return A lazy token stream over the text.
   *
   * @throws IllegalArgumentException Thrown if the initial state is not in the table.
   */
  public static TokenStream tokenize(CharSequence text, StateTable table, String initialState) {
    return new StateLexer(table).tokenize(text, initialState);
  }

  /**
   * Start a new tokenization run.
   *
   * @param text The text to tokenize. This must not change while the stream is in use.
   * @param initialState The state to start in; the bottom of the context stack.
   *
   * @return A lazy token stream over the text.
   *
   * @throws IllegalArgumentException Thrown if the initial state is not in the table.
   */
  public TokenStream tokenize(CharSequence text, String initialState) {
    Objects.requireNonNull(initialState, "Initial state may not be null");
    table.require(initialState);
    return new TokenStream(table, options, Objects.requireNonNull(text),
        LexerCheckpoint.start(initialState));
  }

  /**
   * Tokenize a whole text eagerly.
   *
   * @param text The text to tokenize.
   * @param initialState The state to start in.
   *
   * @return Every token of the text, in order.
   *
   * @see #tokenize(CharSequence, String)
   */
  public List<Token> tokenizeAll(CharSequence text, String initialState) {
    return tokenize(text, initialState).toList();
  }

  /**
   * Start a new tokenization run in a previously frozen context. The text is
   * assumed to directly follow the text the checkpoint was taken in, so token
   * offsets continue from {@link LexerCheckpoint#offset()}.
   *
   * @param text The text to tokenize.
   * @param checkpoint The context to start in.
   *
   * @return A lazy token stream over the text.
   *
   * @throws IllegalArgumentException Thrown if a state on the checkpoint's stack
   *         is not in this lexer's table.
   */
  public TokenStream resume(CharSequence text, LexerCheckpoint checkpoint) {
    Objects.requireNonNull(checkpoint, "Checkpoint may not be null");
    for (String state : checkpoint.stack()) {
      table.require(state);
    }
    return new TokenStream(table, options, Objects.requireNonNull(text), checkpoint);
  }

  /**
   * @return The states this lexer runs.
   */
  public StateTable table() {
    return table;
  }

  /**
   * @return The fallback policies of this lexer.
   */
  public LexerOptions options() {
    return options;
  }

  /**
   * @param options The new fallback policies.
   *
   * @return A lexer over the same table with different options.
   */
  public StateLexer withOptions(LexerOptions options) {
    return new StateLexer(table, options);
  }
}
