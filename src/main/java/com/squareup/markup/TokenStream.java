package com.squareup.markup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Matcher;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   A single tokenization run of a {@link StateLexer} over one input text,
 *   analogous to a {@link java.util.regex.Matcher} for a
 *   {@link java.util.regex.Pattern}. The stream is lazy: every call to
 *   {@link #next()} scans only as far as needed to produce one more token, and a
 *   caller may stop pulling at any point without the rest of the input ever being
 *   looked at.
 * </p>
 *
 * <p>
 *   The algorithm is a loop over the context stack. At every step, the rules of the
 *   state on top of the stack are tried in order at the cursor, and the first one
 *   that matches wins. Its text is emitted as a token (unless the rule is
 *   emit-suppressing), the cursor moves past it, and the rule's push or pop is
 *   applied. If no rule matches, the {@link LexerOptions.UnmatchedPolicy} decides
 *   what to do; in any case the cursor strictly advances, so every run terminates.
 * </p>
 *
 * <p>
 *   A stream is not restartable; tokenizing the text again requires a new call to
 *   {@link StateLexer#tokenize(CharSequence, String)}. Streams are not threadsafe.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class TokenStream implements Iterator<Token> {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(TokenStream.class);

  /** The states we are running. */
  private final StateTable table;
  /** The fallback policies for this run. */
  private final LexerOptions options;
  /** The text we are tokenizing. */
  private final CharSequence input;
  /**
   * The absolute offset of the first character of {@link #input}. This is 0 unless
   * we {@linkplain StateLexer#resume(CharSequence, LexerCheckpoint) resumed} from a
   * checkpoint.
   */
  private final int base;
  /** The context stack, bottom first. This is never empty. */
  private final List<String> stack;
  /**
   * One regex matcher per rule, reset onto new regions as we go. This is lazily
   * populated, since most runs only ever visit a few of the states in a table.
   */
  private final Map<Rule, Matcher> matchers = new IdentityHashMap<>();
  /** The index into {@link #input} that the next step starts from. */
  private int cursor = 0;
  /** A token computed by {@link #hasNext()}, but not yet returned from {@link #next()}. */
  private @Nullable Token pending = null;
  /** The cursor at which {@link #zeroWidthSteps} were counted, or -1. */
  private int zeroWidthCursor = -1;
  /** The number of zero-width transitions taken at {@link #zeroWidthCursor}. */
  private int zeroWidthSteps = 0;
  /** Set by {@link #firstMatch(LexerState)} if a zero-width match was refused for looping. */
  private boolean zeroWidthLimitHit = false;
  /**
   * The state the rule last returned by {@link #firstMatch(LexerState)} pushes, or null.
   * A dynamic selector runs once per match, so this is computed once and reused.
   */
  private @Nullable String matchedTarget = null;
  /**
   * A rule that already matched at {@link #lookaheadAt}, found while scanning an
   * unparsed run. Its matcher and {@link #matchedTarget} are still on that match.
   */
  private @Nullable Rule lookahead = null;
  /** The cursor {@link #lookahead} matched at. */
  private int lookaheadAt = -1;
  /** The conditions we recovered from. Null until the first one happens. */
  private @Nullable List<LexerDiagnostic> diagnostics = null;

  /**
   * Create a new run. Use {@link StateLexer#tokenize(CharSequence, String)} or
   * {@link StateLexer#resume(CharSequence, LexerCheckpoint)}.
   *
   * @param table See {@link #table}.
   * @param options See {@link #options}.
   * @param input See {@link #input}.
   * @param checkpoint The context stack and base offset to start from. Every state on
   *                   the stack must already have been checked against the table.
   */
  TokenStream(StateTable table, LexerOptions options, CharSequence input,
      LexerCheckpoint checkpoint) {
    this.table = table;
    this.options = options;
    this.input = input;
    this.base = checkpoint.offset();
    this.stack = new ArrayList<>(checkpoint.stack());
  }

  /** {@inheritDoc} */
  @Override public boolean hasNext() {
    while (pending == null && cursor < input.length()) {
      pending = step();
    }
    return pending != null;
  }

  /** {@inheritDoc} */
  @Override public Token next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more tokens at offset " + position());
    }
    Token token = pending;
    pending = null;
    return token;
  }

  /**
   * @return The rest of this run as a lazy, sequential stream. Consuming the stream
   *         consumes this iterator.
   */
  public Stream<Token> stream() {
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Drain the rest of this run.
   *
   * @return Every remaining token, in order.
   */
  public List<Token> toList() {
    List<Token> tokens = new ArrayList<>();
    while (hasNext()) {
      tokens.add(next());
    }
    return tokens;
  }

  /**
   * <p>
   *   The absolute offset the lexer has scanned up to.
   * </p>
   *
   * <p>
   *   Note that {@link #hasNext()} may scan one token ahead of what {@link #next()} has
   *   returned; this, {@link #contextStack()} and {@link #checkpoint()} all describe the
   *   scan position, i.e., the state just after the most recently computed token.
   * </p>
   *
   * @return The offset the next step starts from.
   */
  public int position() {
    return base + cursor;
  }

  /**
   * @return A snapshot of the context stack, bottom first. After the input is exhausted
   *         this may hold more than the initial state if nested regions were left
   *         unterminated.
   */
  public List<String> contextStack() {
    return List.copyOf(stack);
  }

  /**
   * @return The id of the state on top of the context stack.
   */
  public String currentState() {
    return stack.get(stack.size() - 1);
  }

  /**
   * @return The number of states on the context stack. This is 1 when every nested
   *         region entered so far has been closed again.
   */
  public int depth() {
    return stack.size();
  }

  /**
   * @return True if the whole input has been scanned and every token returned.
   */
  public boolean isExhausted() {
    return pending == null && cursor >= input.length();
  }

  /**
   * @return The recoverable conditions met so far, in order. This is a snapshot.
   */
  public List<LexerDiagnostic> diagnostics() {
    if (diagnostics == null) {
      return Collections.emptyList();
    } else {
      return List.copyOf(diagnostics);
    }
  }

  /**
   * @return True if any recoverable condition was met so far.
   */
  public boolean hasDiagnostics() {
    return diagnostics != null && !diagnostics.isEmpty();
  }

  /**
   * Freeze the current context. See {@link #position()} for how this relates to
   * the tokens returned so far.
   *
   * @return A checkpoint from which lexing of following text can be resumed.
   */
  public LexerCheckpoint checkpoint() {
    return new LexerCheckpoint(stack, position());
  }

  /**
   * Run a single step of the lexer: match one rule (or apply the fallback) and
   * advance the cursor.
   *
   * @return The token produced by this step, or null if the step produced none.
   */
  private @Nullable Token step() {
    LexerState state = table.require(currentState());
    Rule rule;
    if (lookahead != null && lookaheadAt == cursor) {
      rule = lookahead;
    } else {
      zeroWidthLimitHit = false;
      rule = firstMatch(state);
    }
    lookahead = null;
    if (rule == null) {
      if (zeroWidthLimitHit) {
        diagnose(LexerDiagnostic.Kind.ZERO_WIDTH_LOOP, base + cursor,
            "More than " + options.maxZeroWidthSteps() + " zero-width transitions");
      }
      return unmatched(state);
    }
    Matcher m = matchers.get(rule);
    int start = cursor;
    int end = m.end();
    if (end == start) {
      // Zero-width: firstMatch() guaranteed the transition changes the stack
      if (zeroWidthCursor != start) {
        zeroWidthCursor = start;
        zeroWidthSteps = 0;
      }
      zeroWidthSteps += 1;
      transition(rule, matchedTarget, m, false);
      return null;
    }
    String text = input.subSequence(start, end).toString();
    cursor = end;
    boolean underflow = !transition(rule, matchedTarget, m, true);
    if (underflow && options.underflowPolicy() == LexerOptions.UnderflowPolicy.EMIT_UNBALANCED) {
      return new Token(options.unbalancedKind(), text, base + start);
    } else if (rule.emits()) {
      return new Token(rule.kind(), text, base + start);
    } else {
      return null;
    }
  }

  /**
   * Find the first rule of the state that matches at the cursor. A rule matching
   * the empty string only counts if it would change the context stack and we have
   * not yet exceeded the zero-width step limit at this offset; otherwise it could
   * never make progress.
   *
   * @param state The state whose rules we are trying.
   *
   * @return The winning rule, whose matcher is left on the match and whose push
   *         target is left in {@link #matchedTarget}, or null if nothing matched.
   */
  private @Nullable Rule firstMatch(LexerState state) {
    for (Rule rule : state.rules()) {
      Matcher m = matcherFor(rule);
      m.region(cursor, input.length());
      if (!m.lookingAt()) {
        continue;
      }
      String target = rule.targetFor(m);
      if (m.end() > cursor) {
        matchedTarget = target;
        return rule;
      }
      if (changesStack(rule, target)) {
        int steps = zeroWidthCursor == cursor ? zeroWidthSteps : 0;
        if (steps < options.maxZeroWidthSteps()) {
          matchedTarget = target;
          return rule;
        }
        zeroWidthLimitHit = true;
      }
    }
    return null;
  }

  /**
   * @return True if applying this rule's action, with the given push target, would
   *         change the context stack.
   */
  private boolean changesStack(Rule rule, @Nullable String target) {
    switch (rule.action()) {
      case PUSH:
        return target != null && table.contains(target);
      case POP:
        return stack.size() > 1;
      default:
        return false;
    }
  }

  /**
   * Apply the stack action of a rule that matched.
   *
   * @param rule The rule that matched.
   * @param target The state the rule selected to push, if it is a push rule.
   * @param m The matcher of the rule, positioned on the match.
   * @param diagnose If true, record a diagnostic for a push or pop that can't be applied.
   *
   * @return False if the rule popped a single-entry stack, true otherwise.
   */
  private boolean transition(Rule rule, @Nullable String target, Matcher m,
      boolean diagnose) {
    switch (rule.action()) {
      case PUSH:
        if (target != null && table.contains(target)) {
          stack.add(target);
          if (log.isTraceEnabled()) {
            log.trace("[[push {} at {}; stack is now {}]]", target, base + m.start(), stack);
          }
        } else if (diagnose) {
          diagnose(LexerDiagnostic.Kind.UNKNOWN_STATE, base + m.start(),
              "Rule " + rule + " selected unknown state '" + target + "'");
        }
        return true;
      case POP:
        if (stack.size() > 1) {
          String popped = stack.remove(stack.size() - 1);
          if (log.isTraceEnabled()) {
            log.trace("[[pop {} at {}; stack is now {}]]", popped, base + m.start(), stack);
          }
          return true;
        }
        if (diagnose) {
          diagnose(LexerDiagnostic.Kind.STACK_UNDERFLOW, base + m.start(),
              "Rule " + rule + " popped the last state on the stack");
        }
        return false;
      default:
        return true;
    }
  }

  /**
   * Apply the {@link LexerOptions.UnmatchedPolicy} at the cursor.
   *
   * @param state The current state, none of whose rules matched.
   *
   * @return The fallback token, or null if the policy is to skip.
   */
  private @Nullable Token unmatched(LexerState state) {
    int start = cursor;
    diagnose(LexerDiagnostic.Kind.NO_MATCH, base + start, "No rule matches "
        + describeCodePoint(Character.codePointAt(input, start)));
    cursor = Character.offsetByCodePoints(input, start, 1);
    switch (options.unmatchedPolicy()) {
      case SKIP:
        return null;
      case UNPARSED_RUN:
        while (cursor < input.length()) {
          Rule next = firstMatch(state);
          if (next != null) {
            lookahead = next;
            lookaheadAt = cursor;
            break;
          }
          cursor = Character.offsetByCodePoints(input, cursor, 1);
        }
        break;
      default:
        break;
    }
    return new Token(options.unparsedKind(), input.subSequence(start, cursor).toString(),
        base + start);
  }

  /**
   * Get the (cached) matcher for a rule.
   */
  private Matcher matcherFor(Rule rule) {
    Matcher m = matchers.get(rule);
    if (m == null) {
      m = rule.pattern().matcher(input);
      m.useTransparentBounds(true);
      m.useAnchoringBounds(false);
      matchers.put(rule, m);
    }
    return m;
  }

  /**
   * Record a recoverable condition.
   */
  private void diagnose(LexerDiagnostic.Kind kind, int offset, String message) {
    if (diagnostics == null) {
      diagnostics = new ArrayList<>();
    }
    LexerDiagnostic diagnostic =
        new LexerDiagnostic(kind, offset, currentState(), message);
    diagnostics.add(diagnostic);
    log.debug("[[{}]]", diagnostic);
  }

  /**
   * Render a code point for a diagnostic message.
   */
  private static String describeCodePoint(int codePoint) {
    if (Character.isISOControl(codePoint) || Character.isWhitespace(codePoint)) {
      return String.format("U+%04X", codePoint);
    } else {
      return "'" + new String(Character.toChars(codePoint)) + "'";
    }
  }

  /** {@inheritDoc} */
  @Override public String toString() {
    return "TokenStream[position=" + position() + ",stack=" + stack + "]";
  }
}
