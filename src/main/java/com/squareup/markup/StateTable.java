package com.squareup.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * <p>
 *   An immutable set of {@link LexerState}s, keyed by their id. A table is
 *   built once, validated at construction time, and can then be shared by any
 *   number of {@linkplain StateLexer lexers} and tokenization runs.
 * </p>
 *
 * <blockquote><pre>
 * StateTable table = StateTable.builder()
 *     .state("default",
 *         Rule.skip("\\s+"),
 *         Rule.emit("IDENT", "\\w+"),
 *         Rule.emit("LBRACE", "\\{").push("block"))
 *     .state("block",
 *         Rule.emit("IDENT", "\\w+"),
 *         Rule.emit("RBRACE", "\\}").pop())
 *     .build();
 * </pre></blockquote>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class StateTable {

  /**
   * A builder for a {@link StateTable}. Validation happens in {@link #build()}, so
   * states may be declared in any order and may reference each other cyclically.
   */
  public static final class Builder {
    /** The states declared so far, in declaration order. */
    private final List<LexerState> states = new ArrayList<>();

    /** Use {@link StateTable#builder()}. */
    private Builder() {}

    /**
     * Declare a state.
     *
     * @param state The state to add.
     *
     * @return This builder.
     */
    public Builder state(LexerState state) {
      if (state == null) {
        throw new NullPointerException("State may not be null");
      }
      states.add(state);
      return this;
    }

    /**
     * @see #state(LexerState)
     */
    public Builder state(String id, Rule... rules) {
      return state(new LexerState(id, rules));
    }

    /**
     * @see #state(LexerState)
     */
    public Builder state(String id, List<Rule> rules) {
      return state(new LexerState(id, rules));
    }

    /**
     * Validate the declared states and build the table.
     *
     * @return A new, immutable state table.
     *
     * @throws InvalidStateTableException Thrown if no state was declared, a state id is
     *         declared twice, or a rule pushes a fixed state that does not exist.
     */
    public StateTable build() throws InvalidStateTableException {
      if (states.isEmpty()) {
        throw new InvalidStateTableException("A state table needs at least one state");
      }
      Map<String, LexerState> byId = new LinkedHashMap<>();
      for (LexerState state : states) {
        if (byId.put(state.id(), state) != null) {
          throw new InvalidStateTableException("Duplicate state '" + state.id() + "'");
        }
      }
      for (LexerState state : states) {
        for (Rule rule : state.rules()) {
          String target = rule.pushTarget();
          if (target != null && !byId.containsKey(target)) {
            throw new InvalidStateTableException("Rule " + rule + " in state '" + state.id()
                + "' pushes undefined state '" + target + "'");
          }
        }
      }
      return new StateTable(byId);
    }
  }

  /** The states of this table, keyed by id, in declaration order. */
  private final Map<String, LexerState> states;

  /**
   * Create a table from already validated states.
   */
  private StateTable(Map<String, LexerState> states) {
    this.states = Collections.unmodifiableMap(states);
  }

  /**
   * @return A new builder for a state table.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Look up a state by id.
   *
   * @param id The id of the state.
   *
   * @return The state with the given id, or null if there is none.
   */
  public @Nullable LexerState get(String id) {
    return states.get(id);
  }

  /**
   * @param id The id of the state.
   *
   * @return True if this table defines a state with this id.
   */
  public boolean contains(String id) {
    return states.containsKey(id);
  }

  /**
   * Look up a state that must exist.
   *
   * @param id The id of the state.
   *
   * @return The state with the given id.
   *
   * @throws IllegalArgumentException Thrown if the state is not in this table.
   */
  public LexerState require(String id) {
    LexerState state = states.get(id);
    if (state == null) {
      throw new IllegalArgumentException("Unknown lexer state '" + id + "'; known states are "
          + states.keySet());
    }
    return state;
  }

  /**
   * @return The ids of every state in this table, in declaration order.
   */
  public Set<String> stateIds() {
    return states.keySet();
  }

  /**
   * @return The number of states in this table.
   */
  public int size() {
    return states.size();
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "StateTable" + states.keySet();
  }
}
