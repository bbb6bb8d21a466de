package com.squareup.markup;

import java.util.Objects;

/**
 * <p>
 *   The fallback policies of a {@link StateLexer}. These decide what happens when
 *   the current state has no rule matching at the cursor, and what happens when a
 *   rule pops the last remaining state. Neither case ever throws: both degrade to
 *   observable tokens and {@linkplain LexerDiagnostic diagnostics}.
 * </p>
 *
 * <p>
 *   Options are immutable. Start from {@link #DEFAULT} or {@link #builder()}.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public final class LexerOptions {

  /**
   * What to do when no rule of the current state matches at the cursor.
   */
  public enum UnmatchedPolicy {
    /** Emit a single code point as a token of the unparsed kind. */
    UNPARSED_CHAR,
    /** Emit the longest run of code points at which nothing matches as one unparsed token. */
    UNPARSED_RUN,
    /** Silently step over a single code point. */
    SKIP
  }

  /**
   * What to do when a rule pops while only one state is on the stack.
   */
  public enum UnderflowPolicy {
    /** Ignore the pop; the rule otherwise behaves as usual. */
    IGNORE,
    /** Emit the matched text with the unbalanced kind instead of the rule's kind. */
    EMIT_UNBALANCED
  }

  /** The default kind for text no rule matched. */
  public static final String UNPARSED = "unparsed";
  /** The default kind for a closing token with nothing to close. */
  public static final String UNBALANCED = "unbalanced";
  /** The default number of consecutive zero-width steps allowed at one offset. */
  public static final int DEFAULT_MAX_ZERO_WIDTH_STEPS = 16;

  /** The default options: single unparsed characters, and ignored underflows. */
  public static final LexerOptions DEFAULT = builder().build();

  /**
   * A builder for {@link LexerOptions}.
   */
  public static final class Builder {
    private UnmatchedPolicy unmatchedPolicy = UnmatchedPolicy.UNPARSED_CHAR;
    private UnderflowPolicy underflowPolicy = UnderflowPolicy.IGNORE;
    private String unparsedKind = UNPARSED;
    private String unbalancedKind = UNBALANCED;
    private int maxZeroWidthSteps = DEFAULT_MAX_ZERO_WIDTH_STEPS;

    /** Use {@link LexerOptions#builder()}. */
    private Builder() {}

    /** @see LexerOptions#unmatchedPolicy() */
    public Builder unmatchedPolicy(UnmatchedPolicy policy) {
      this.unmatchedPolicy = Objects.requireNonNull(policy);
      return this;
    }

    /** @see LexerOptions#underflowPolicy() */
    public Builder underflowPolicy(UnderflowPolicy policy) {
      this.underflowPolicy = Objects.requireNonNull(policy);
      return this;
    }

    /** @see LexerOptions#unparsedKind() */
    public Builder unparsedKind(String kind) {
      Rule.requireName(kind, "Unparsed kind");
      this.unparsedKind = kind;
      return this;
    }

    /** @see LexerOptions#unbalancedKind() */
    public Builder unbalancedKind(String kind) {
      Rule.requireName(kind, "Unbalanced kind");
      this.unbalancedKind = kind;
      return this;
    }

    /** @see LexerOptions#maxZeroWidthSteps() */
    public Builder maxZeroWidthSteps(int steps) {
      if (steps < 0) {
        throw new IllegalArgumentException("Zero-width step limit may not be negative: " + steps);
      }
      this.maxZeroWidthSteps = steps;
      return this;
    }

    /**
     * @return The options configured in this builder.
     */
    public LexerOptions build() {
      return new LexerOptions(this);
    }
  }

  private final UnmatchedPolicy unmatchedPolicy;
  private final UnderflowPolicy underflowPolicy;
  private final String unparsedKind;
  private final String unbalancedKind;
  private final int maxZeroWidthSteps;

  private LexerOptions(Builder builder) {
    this.unmatchedPolicy = builder.unmatchedPolicy;
    this.underflowPolicy = builder.underflowPolicy;
    this.unparsedKind = builder.unparsedKind;
    this.unbalancedKind = builder.unbalancedKind;
    this.maxZeroWidthSteps = builder.maxZeroWidthSteps;
  }

  /**
   * @return A new builder, initialized to the default options.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return A new builder initialized to these options.
   */
  public Builder toBuilder() {
    return builder()
        .unmatchedPolicy(unmatchedPolicy)
        .underflowPolicy(underflowPolicy)
        .unparsedKind(unparsedKind)
        .unbalancedKind(unbalancedKind)
        .maxZeroWidthSteps(maxZeroWidthSteps);
  }

  /**
   * @return The policy for text no rule matches. Defaults to
   *         {@link UnmatchedPolicy#UNPARSED_CHAR}.
   */
  public UnmatchedPolicy unmatchedPolicy() {
    return unmatchedPolicy;
  }

  /**
   * @return The policy for a pop on a single-entry stack. Defaults to
   *         {@link UnderflowPolicy#IGNORE}.
   */
  public UnderflowPolicy underflowPolicy() {
    return underflowPolicy;
  }

  /**
   * @return The kind of the tokens emitted for unmatched text.
   */
  public String unparsedKind() {
    return unparsedKind;
  }

  /**
   * @return The kind of the tokens emitted for an underflowing pop under
   *         {@link UnderflowPolicy#EMIT_UNBALANCED}.
   */
  public String unbalancedKind() {
    return unbalancedKind;
  }

  /**
   * The number of consecutive zero-width state transitions accepted at a single
   * offset. A zero-width match past this limit is treated as no match at all, which
   * guarantees that every run terminates even for rules like {@code (?=x)} that
   * push and pop forever.
   *
   * @return The zero-width step limit.
   */
  public int maxZeroWidthSteps() {
    return maxZeroWidthSteps;
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "LexerOptions[unmatched=" + unmatchedPolicy
        + ",underflow=" + underflowPolicy
        + ",unparsedKind=" + unparsedKind
        + ",unbalancedKind=" + unbalancedKind
        + ",maxZeroWidthSteps=" + maxZeroWidthSteps + "]";
  }
}
