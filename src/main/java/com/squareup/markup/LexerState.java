package com.squareup.markup;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <p>
 *   A named, ordered list of {@link Rule}s that is active while it is on top of
 *   a lexer's context stack. Order is precedence: the first rule that matches
 *   at the cursor wins, even if a later rule would match more text.
 * </p>
 *
 * <p>
 *   States are plain data; all behavior lives in {@link TokenStream}.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class LexerState {

  /** The identifier of this state, unique within a {@link StateTable}. */
  private final String id;
  /** The rules of this state, in precedence order. */
  private final List<Rule> rules;

  /**
   * Create a new state.
   *
   * @param id See {@link #id}.
   * @param rules See {@link #rules}. The list is copied.
   */
  public LexerState(String id, List<Rule> rules) {
    Rule.requireName(id, "State id");
    Objects.requireNonNull(rules, "State rules may not be null");
    for (Rule rule : rules) {
      if (rule == null) {
        throw new NullPointerException("State '" + id + "' has a null rule");
      }
    }
    this.id = id;
    this.rules = List.copyOf(rules);
  }

  /**
   * @see #LexerState(String, List)
   */
  public LexerState(String id, Rule... rules) {
    this(id, Arrays.asList(rules));
  }

  /**
   * @return The identifier of this state.
   */
  public String id() {
    return id;
  }

  /**
   * @return The rules of this state, in precedence order. This list is immutable.
   */
  public List<Rule> rules() {
    return rules;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return id + rules;
  }
}
