package com.squareup.markup;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import javax.annotation.Nullable;

/**
 * <p>
 *   A single entry in a {@link LexerState}: a regular expression, the kind of
 *   token to emit when it matches, and what to do with the context stack
 *   afterwards. Rules are immutable; the fluent methods ({@link #push(String)},
 *   {@link #pop()}, etc.) return a modified copy.
 * </p>
 *
 * <p>
 *   A typical state definition thus reads
 * </p>
 *
 * <blockquote><pre>
 * Rule.skip("\\s+"),
 * Rule.emit("IDENT", "[A-Za-z_]\\w*"),
 * Rule.emit("LBRACE", "\\{").push("block"),
 * Rule.emit("RBRACE", "\\}").pop()
 * </pre></blockquote>
 *
 * <p>
 *   The regex is matched with {@link java.util.regex.Matcher#lookingAt()} anchored
 *   at the lexer cursor, using transparent bounds so that look-behind assertions can
 *   see text before the cursor.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class Rule {

  /**
   * What a rule does to the context stack after it matched.
   */
  public enum Action {
    /** Leave the stack alone. */
    NONE,
    /** Enter a nested state. */
    PUSH,
    /** Return to the enclosing state. */
    POP
  }

  /**
   * <p>
   *   Selects the state to push from the text a rule matched. Returning null, or the
   *   id of a state that is not in the table, causes the push to be dropped (and a
   *   {@link LexerDiagnostic.Kind#UNKNOWN_STATE} diagnostic to be recorded).
   * </p>
   *
   * <p>
   *   The matcher passed in is the lexer's own matcher for the rule, positioned on
   *   the current match. It may be queried but must not be reset or re-run.
   * </p>
   */
  @FunctionalInterface
  public interface StateSelector {
    /**
     * @param match The matcher of the rule that is pushing, holding the current match.
     *
     * @return The id of the state to enter.
     */
    @Nullable String select(Matcher match);
  }

  /** The compiled regex for this rule. */
  private final Pattern pattern;
  /** The kind of the emitted token. Null only if {@link #emit} is false. */
  @Nullable private final String kind;
  /** If false, the matched text is consumed without producing a token. */
  private final boolean emit;
  /** The stack action to take after a match. */
  private final Action action;
  /** The fixed state to push, if this is a {@link Action#PUSH} rule with a fixed target. */
  @Nullable private final String pushTarget;
  /** The dynamic state selector, if this is a {@link Action#PUSH} rule with a dynamic target. */
  @Nullable private final StateSelector selector;

  /**
   * The raw constructor. Prefer {@link #emit(String, String)} and {@link #skip(String)}.
   */
  private Rule(
      Pattern pattern,
      @Nullable String kind,
      boolean emit,
      Action action,
      @Nullable String pushTarget,
      @Nullable StateSelector selector) {
    this.pattern = pattern;
    this.kind = kind;
    this.emit = emit;
    this.action = action;
    this.pushTarget = pushTarget;
    this.selector = selector;
  }

  /**
   * Create a rule emitting a token of the given kind whenever the regex matches.
   *
   * @param kind The kind of the emitted tokens.
   * @param regex The regular expression to match.
   *
   * @return An emit-only rule.
   *
   * @throws PatternSyntaxException Thrown if the regex does not compile.
   */
  public static Rule emit(String kind, String regex) throws PatternSyntaxException {
    return emit(kind, Pattern.compile(regex));
  }

  /**
   * @see #emit(String, String)
   */
  public static Rule emit(String kind, Pattern pattern) {
    requireName(kind, "Rule kind");
    return new Rule(Objects.requireNonNull(pattern, "Rule pattern may not be null"),
        kind, true, Action.NONE, null, null);
  }

  /**
   * Create a rule consuming text without producing a token; e.g., for whitespace.
   *
   * @param regex The regular expression to match.
   *
   * @return An emit-suppressing rule.
   *
   * @throws PatternSyntaxException Thrown if the regex does not compile.
   */
  public static Rule skip(String regex) throws PatternSyntaxException {
    return skip(Pattern.compile(regex));
  }

  /**
   * @see #skip(String)
   */
  public static Rule skip(Pattern pattern) {
    return new Rule(Objects.requireNonNull(pattern, "Rule pattern may not be null"),
        null, false, Action.NONE, null, null);
  }

  /**
   * @param state The state to enter after this rule matched.
   *
   * @return A copy of this rule that pushes the given state.
   */
  public Rule push(String state) {
    requireName(state, "Push target");
    return new Rule(pattern, kind, emit, Action.PUSH, state, null);
  }

  /**
   * @param selector Computes the state to enter from the match.
   *
   * @return A copy of this rule that pushes a state chosen from the matched text.
   */
  public Rule pushDynamic(StateSelector selector) {
    Objects.requireNonNull(selector, "State selector may not be null");
    return new Rule(pattern, kind, emit, Action.PUSH, null, selector);
  }

  /**
   * Push the state whose id is the given prefix followed by the value of a named capture
   * group; e.g., a heredoc opener {@code <<(?<delim>\w+)} with prefix "heredoc:" enters
   * "heredoc:EOF" for {@code <<EOF}.
   *
   * @param group The name of the capture group in this rule's regex.
   * @param prefix The prefix of the state id.
   *
   * @return A copy of this rule pushing a state selected by the capture group.
   *
   * @throws InvalidStateTableException Thrown if this rule's regex has no capture
   *         group of that name.
   */
  public Rule pushGroup(String group, String prefix) {
    requireName(group, "Capture group name");
    Objects.requireNonNull(prefix, "State prefix may not be null");
    // Ask the regex engine itself: the empty alternative always matches, and
    // group() then fails for a name the regex doesn't define
    Matcher empty = Pattern.compile("(?:" + pattern.pattern() + ")|", pattern.flags()).matcher("");
    empty.matches();
    try {
      empty.group(group);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateTableException(
          "Rule /" + pattern + "/ has no capture group named '" + group + "'", e);
    }
    return pushDynamic(match -> {
      String value = match.group(group);
      return value == null ? null : prefix + value;
    });
  }

  /**
   * @return A copy of this rule that pops the current state.
   */
  public Rule pop() {
    return new Rule(pattern, kind, emit, Action.POP, null, null);
  }

  /**
   * @return The compiled regex of this rule.
   */
  public Pattern pattern() {
    return pattern;
  }

  /**
   * @return The kind of token this rule emits, or null if it is emit-suppressing.
   */
  public @Nullable String kind() {
    return kind;
  }

  /**
   * @return True if this rule produces tokens.
   */
  public boolean emits() {
    return emit;
  }

  /**
   * @return The stack action of this rule.
   */
  public Action action() {
    return action;
  }

  /**
   * @return The fixed state this rule pushes, or null if it doesn't push a fixed state.
   */
  public @Nullable String pushTarget() {
    return pushTarget;
  }

  /**
   * @return True if this rule pushes a state chosen at match time.
   */
  public boolean isDynamicPush() {
    return selector != null;
  }

  /**
   * Compute the state this rule pushes for a given match.
   *
   * @param match The match of this rule.
   *
   * @return The state id to push, or null if this rule doesn't push or the
   *         selector declined.
   */
  @Nullable String targetFor(Matcher match) {
    if (action != Action.PUSH) {
      return null;
    } else if (selector != null) {
      return selector.select(match);
    } else {
      return pushTarget;
    }
  }

  /**
   * Ensure that a given name is non-null and not blank.
   */
  static void requireName(@Nullable String name, String what) {
    if (name == null) {
      throw new NullPointerException(what + " may not be null");
    }
    if (name.isBlank()) {
      throw new IllegalArgumentException(what + " may not be blank");
    }
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    StringBuilder b = new StringBuilder();
    b.append(emit ? kind : "skip")
        .append(':')
        .append('/')
        .append(pattern)
        .append('/');
    switch (action) {
      case PUSH:
        b.append(" -> push ").append(selector != null ? "<dynamic>" : pushTarget);
        break;
      case POP:
        b.append(" -> pop");
        break;
      default:
        break;
    }
    return b.toString();
  }
}
