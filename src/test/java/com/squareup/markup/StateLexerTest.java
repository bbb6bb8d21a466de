package com.squareup.markup;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import static com.squareup.markup.TestTables.BLOCKS;
import static com.squareup.markup.TestTables.IDENT;
import static com.squareup.markup.TestTables.RICH;
import static com.squareup.markup.TestTables.WHITESPACE;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test the {@link StateLexer}, and the {@link TokenStream} algorithm behind it.
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class StateLexerTest {

  /**
   * A short helper for building an expected token.
   */
  private static Token tok(String kind, String text, int offset) {
    return new Token(kind, text, offset);
  }

  /**
   * @return The kinds of the diagnostics of a run.
   */
  private static List<LexerDiagnostic.Kind> diagnosticKinds(TokenStream tokens) {
    return tokens.diagnostics().stream().map(d -> d.kind).collect(Collectors.toList());
  }

  /**
   * The canonical example: braces push and pop a nested state.
   */
  @Test void blockScenario() {
    TokenStream tokens = StateLexer.tokenize("a {b}", BLOCKS, "default");
    assertEquals(tok("IDENT", "a", 0), tokens.next());
    assertEquals(List.of("default"), tokens.contextStack());
    assertEquals(tok("LBRACE", "{", 2), tokens.next());
    assertEquals(List.of("default", "block"), tokens.contextStack());
    assertEquals(tok("IDENT", "b", 3), tokens.next());
    assertEquals("block", tokens.currentState());
    assertEquals(tok("RBRACE", "}", 4), tokens.next());
    assertFalse(tokens.hasNext());
    assertTrue(tokens.isExhausted());
    assertEquals(List.of("default"), tokens.contextStack());
    assertEquals(5, tokens.position());
    assertFalse(tokens.hasDiagnostics());
  }

  /**
   * Rules are tried in declaration order, and the first match wins even if a later
   * rule would match more text.
   */
  @Test void firstMatchNotLongestMatch() {
    StateTable table = StateTable.builder()
        .state("default",
            Rule.emit("KEYWORD", "if"),
            IDENT)
        .build();
    assertEquals(
        List.of(tok("KEYWORD", "if", 0), tok("IDENT", "fy", 2)),
        new StateLexer(table).tokenizeAll("iffy", "default"));

    StateTable reversed = StateTable.builder()
        .state("default",
            IDENT,
            Rule.emit("KEYWORD", "if"))
        .build();
    assertEquals(
        List.of(tok("IDENT", "iffy", 0)),
        new StateLexer(reversed).tokenizeAll("iffy", "default"));
  }

  /**
   * Unterminated nested regions are a valid end state, not an error.
   */
  @Test void unterminatedRegionLeavesResidualStack() {
    TokenStream tokens = StateLexer.tokenize("a {b {c", BLOCKS, "default");
    assertEquals(5, tokens.toList().size());
    assertEquals(List.of("default", "block", "block"), tokens.contextStack());
    assertEquals(3, tokens.depth());
    assertFalse(tokens.hasDiagnostics());
  }

  /**
   * The empty input produces no tokens.
   */
  @Test void emptyInput() {
    TokenStream tokens = StateLexer.tokenize("", BLOCKS, "default");
    assertFalse(tokens.hasNext());
    assertTrue(tokens.isExhausted());
    assertEquals(List.of("default"), tokens.contextStack());
  }

  /**
   * Rules can be entered in any state, not only the bottom one.
   */
  @Test void startInNestedState() {
    TokenStream tokens = StateLexer.tokenize("b}", BLOCKS, "block");
    assertEquals(tok("IDENT", "b", 0), tokens.next());
    assertEquals(tok("RBRACE", "}", 1), tokens.next());
    // popping the only state is an underflow, which is ignored by default
    assertEquals(List.of("block"), tokens.contextStack());
    assertEquals(List.of(LexerDiagnostic.Kind.STACK_UNDERFLOW), diagnosticKinds(tokens));
  }

  /**
   * An unknown initial state is a setup error.
   */
  @Test void unknownInitialState() {
    StateLexer lexer = new StateLexer(BLOCKS);
    assertThrows(IllegalArgumentException.class, () -> lexer.tokenize("a", "nope"));
    assertThrows(NullPointerException.class, () -> lexer.tokenize("a", null));
  }

  /**
   * Tests for the {@link LexerOptions.UnmatchedPolicy}.
   */
  @SuppressWarnings("InnerClassMayBeStatic")
  @Nested
  class Unmatched {
    private final StateTable table = StateTable.builder()
        .state("default", WHITESPACE, IDENT)
        .build();

    private TokenStream lex(String input, LexerOptions.UnmatchedPolicy policy) {
      LexerOptions options = LexerOptions.builder().unmatchedPolicy(policy).build();
      return new StateLexer(table, options).tokenize(input, "default");
    }

    /**
     * By default, every unmatched character becomes its own token.
     */
    @Test void unparsedChar() {
      TokenStream tokens = StateLexer.tokenize("a?!b", table, "default");
      assertEquals(List.of(
          tok("IDENT", "a", 0),
          tok(LexerOptions.UNPARSED, "?", 1),
          tok(LexerOptions.UNPARSED, "!", 2),
          tok("IDENT", "b", 3)), tokens.toList());
      assertEquals(List.of(LexerDiagnostic.Kind.NO_MATCH, LexerDiagnostic.Kind.NO_MATCH),
          diagnosticKinds(tokens));
      assertEquals(1, tokens.diagnostics().get(0).offset);
      assertEquals("default", tokens.diagnostics().get(0).state);
    }

    /**
     * A run of unmatched characters can be collapsed into one token.
     */
    @Test void unparsedRun() {
      TokenStream tokens = lex("a?!b", LexerOptions.UnmatchedPolicy.UNPARSED_RUN);
      assertEquals(List.of(
          tok("IDENT", "a", 0),
          tok(LexerOptions.UNPARSED, "?!", 1),
          tok("IDENT", "b", 3)), tokens.toList());
      assertEquals(List.of(LexerDiagnostic.Kind.NO_MATCH), diagnosticKinds(tokens));
    }

    /**
     * A run ends at the end of the input.
     */
    @Test void unparsedRunAtEnd() {
      TokenStream tokens = lex("a?!", LexerOptions.UnmatchedPolicy.UNPARSED_RUN);
      assertEquals(List.of(
          tok("IDENT", "a", 0),
          tok(LexerOptions.UNPARSED, "?!", 1)), tokens.toList());
    }

    /**
     * Unmatched characters can be skipped silently, leaving a gap.
     */
    @Test void skip() {
      TokenStream tokens = lex("a?b", LexerOptions.UnmatchedPolicy.SKIP);
      assertEquals(List.of(tok("IDENT", "a", 0), tok("IDENT", "b", 2)), tokens.toList());
      assertEquals(List.of(LexerDiagnostic.Kind.NO_MATCH), diagnosticKinds(tokens));
    }

    /**
     * The fallback steps over whole code points, never half a surrogate pair.
     */
    @Test void supplementaryCodePoint() {
      String emoji = new String(Character.toChars(0x1F600));
      TokenStream tokens = StateLexer.tokenize("a" + emoji + "b", table, "default");
      assertEquals(List.of(
          tok("IDENT", "a", 0),
          tok(LexerOptions.UNPARSED, emoji, 1),
          tok("IDENT", "b", 3)), tokens.toList());
    }

    /**
     * The fallback kind is configurable.
     */
    @Test void customUnparsedKind() {
      LexerOptions options = LexerOptions.builder().unparsedKind("ERROR").build();
      assertEquals(List.of(tok("ERROR", "?", 0)),
          new StateLexer(table, options).tokenizeAll("?", "default"));
    }

    /**
     * A state without any rules degrades to the fallback for every character.
     */
    @Test void emptyState() {
      StateTable empty = StateTable.builder().state("default").build();
      assertEquals(List.of(tok(LexerOptions.UNPARSED, "x", 0), tok(LexerOptions.UNPARSED, "y", 1)),
          new StateLexer(empty).tokenizeAll("xy", "default"));
    }
  }

  /**
   * Tests for the {@link LexerOptions.UnderflowPolicy}.
   */
  @SuppressWarnings("InnerClassMayBeStatic")
  @Nested
  class Underflow {

    /**
     * By default, a pop on the last state is ignored and the token is emitted as usual.
     */
    @Test void ignore() {
      TokenStream tokens = StateLexer.tokenize("}a", BLOCKS, "block");
      assertEquals(List.of(tok("RBRACE", "}", 0), tok("IDENT", "a", 1)), tokens.toList());
      assertEquals(List.of("block"), tokens.contextStack());
      assertEquals(List.of(LexerDiagnostic.Kind.STACK_UNDERFLOW), diagnosticKinds(tokens));
      assertEquals(0, tokens.diagnostics().get(0).offset);
    }

    /**
     * The unbalanced close can instead be flagged in the token stream.
     */
    @Test void emitUnbalanced() {
      LexerOptions options = LexerOptions.builder()
          .underflowPolicy(LexerOptions.UnderflowPolicy.EMIT_UNBALANCED)
          .build();
      TokenStream tokens = new StateLexer(BLOCKS, options).tokenize("{a}}b", "default");
      assertEquals(List.of(
          tok("LBRACE", "{", 0),
          tok("IDENT", "a", 1),
          tok("RBRACE", "}", 2),
          tok(LexerOptions.UNPARSED, "}", 3),
          tok("IDENT", "b", 4)), tokens.toList());
      // the default state has no closing rule at all, so the second brace is unparsed
      assertEquals(List.of(LexerDiagnostic.Kind.NO_MATCH), diagnosticKinds(tokens));

      tokens = new StateLexer(BLOCKS, options).tokenize("a}}", "block");
      assertEquals(List.of(
          tok("IDENT", "a", 0),
          tok(LexerOptions.UNBALANCED, "}", 1),
          tok(LexerOptions.UNBALANCED, "}", 2)), tokens.toList());
      assertEquals(List.of("block"), tokens.contextStack());
    }

    /**
     * Even an emit-suppressing pop shows up when flagged as unbalanced.
     */
    @Test void emitUnbalancedForSkippedPop() {
      StateTable table = StateTable.builder()
          .state("default", Rule.skip("\\)").pop(), IDENT)
          .build();
      LexerOptions options = LexerOptions.builder()
          .underflowPolicy(LexerOptions.UnderflowPolicy.EMIT_UNBALANCED)
          .unbalancedKind("STRAY")
          .build();
      assertEquals(List.of(tok("STRAY", ")", 0), tok("IDENT", "a", 1)),
          new StateLexer(table, options).tokenizeAll(")a", "default"));
      assertEquals(List.of(tok("IDENT", "a", 1)),
          new StateLexer(table).tokenizeAll(")a", "default"));
    }

    /**
     * An underflow doesn't corrupt the rest of the run.
     */
    @Test void recoversAfterUnderflow() {
      TokenStream tokens = StateLexer.tokenize("} {a}", BLOCKS, "block");
      tokens.toList();
      assertEquals(List.of("block"), tokens.contextStack());
      assertEquals(1, tokens.diagnostics().size());
    }
  }

  /**
   * Tests for rules choosing the state to push from their match.
   */
  @SuppressWarnings("InnerClassMayBeStatic")
  @Nested
  class DynamicPush {
    private final StateTable quotes = StateTable.builder()
        .state("default",
            WHITESPACE,
            IDENT,
            Rule.emit("OPEN", "(?<q>['\"`])").pushGroup("q", "string"))
        .state("string'",
            Rule.emit("TEXT", "[^']+"),
            Rule.emit("CLOSE", "'").pop())
        .state("string\"",
            Rule.emit("TEXT", "[^\"]+"),
            Rule.emit("CLOSE", "\"").pop())
        .build();

    /**
     * The delimiter decides which state we are in, and therefore which quote closes it.
     */
    @Test void delimiterDependentNesting() {
      TokenStream tokens = StateLexer.tokenize("'a\"b' \"c'd\"", quotes, "default");
      assertEquals(tok("OPEN", "'", 0), tokens.next());
      assertEquals("string'", tokens.currentState());
      assertEquals(List.of(
          tok("TEXT", "a\"b", 1),
          tok("CLOSE", "'", 4),
          tok("OPEN", "\"", 6),
          tok("TEXT", "c'd", 7),
          tok("CLOSE", "\"", 10)), tokens.toList());
      assertEquals(List.of("default"), tokens.contextStack());
    }

    /**
     * A selected state that doesn't exist drops the push and records a diagnostic.
     */
    @Test void unknownSelectedState() {
      TokenStream tokens = StateLexer.tokenize("`x", quotes, "default");
      assertEquals(List.of(tok("OPEN", "`", 0), tok("IDENT", "x", 1)), tokens.toList());
      assertEquals(List.of("default"), tokens.contextStack());
      assertEquals(List.of(LexerDiagnostic.Kind.UNKNOWN_STATE), diagnosticKinds(tokens));
    }

    /**
     * An arbitrary selector sees the whole match.
     */
    @Test void customSelector() {
      StateTable table = StateTable.builder()
          .state("default",
              Rule.emit("FENCE", "`{3,}").pushDynamic(m -> "fence" + m.group().length()),
              Rule.emit("TEXT", "[^`]+"))
          .state("fence3", Rule.emit("END", "```").pop(), Rule.emit("CODE", "[^`]+|`"))
          .state("fence4", Rule.emit("END", "````").pop(), Rule.emit("CODE", "[^`]+|`"))
          .build();
      TokenStream tokens = StateLexer.tokenize("````a```b````c", table, "default");
      assertEquals(List.of(
          tok("FENCE", "````", 0),
          tok("CODE", "a", 4),
          tok("CODE", "`", 5),
          tok("CODE", "`", 6),
          tok("CODE", "`", 7),
          tok("CODE", "b", 8),
          tok("END", "````", 9),
          tok("TEXT", "c", 13)), tokens.toList());
    }

    /**
     * A capture group that isn't in the regex is a setup error.
     */
    @Test void missingCaptureGroup() {
      assertThrows(InvalidStateTableException.class,
          () -> Rule.emit("OPEN", "['\"]").pushGroup("q", "string"));
      // group syntax that is escaped or inside a character class doesn't define a group
      assertThrows(InvalidStateTableException.class,
          () -> Rule.emit("X", "\\(?<d>").pushGroup("d", "s:"));
      assertThrows(InvalidStateTableException.class,
          () -> Rule.emit("X", "[(?<d>]").pushGroup("d", "s:"));
      assertThrows(InvalidStateTableException.class,
          () -> Rule.emit("X", "(?<dd>x)").pushGroup("d", "s:"));
    }

    /**
     * A capture group that only sometimes participates is still a valid group.
     */
    @Test void optionalCaptureGroup() {
      StateTable table = StateTable.builder()
          .state("default",
              Rule.emit("OPEN", "(?:(?<q>')|\\()").pushGroup("q", "string"),
              IDENT)
          .state("string'", Rule.emit("CLOSE", "'").pop())
          .build();
      TokenStream tokens = StateLexer.tokenize("''(a", table, "default");
      assertEquals(List.of(
          tok("OPEN", "'", 0),
          tok("CLOSE", "'", 1),
          tok("OPEN", "(", 2),
          tok("IDENT", "a", 3)), tokens.toList());
      // the bracket matched without the group, so nothing was pushed
      assertEquals(List.of(LexerDiagnostic.Kind.UNKNOWN_STATE), diagnosticKinds(tokens));
      assertEquals(List.of("default"), tokens.contextStack());
    }

    /**
     * A selector sees every accepted match exactly once, including zero-width ones.
     */
    @Test void selectorRunsOncePerZeroWidthMatch() {
      int[] calls = {0};
      StateTable table = StateTable.builder()
          .state("default",
              Rule.skip("(?=[a-z])").pushDynamic(m -> {
                calls[0] += 1;
                return "word";
              }),
              Rule.emit("NUM", "\\d+"))
          .state("word", Rule.emit("WORD", "[a-z]+").pop())
          .build();
      assertEquals(List.of(tok("NUM", "1", 0), tok("WORD", "ab", 1)),
          new StateLexer(table).tokenizeAll("1ab", "default"));
      assertEquals(1, calls[0]);
    }

    /**
     * The match that ends an unparsed run isn't selected twice either.
     */
    @Test void selectorRunsOnceAfterUnparsedRun() {
      int[] calls = {0};
      StateTable table = StateTable.builder()
          .state("default", Rule.emit("OPEN", "\\{").pushDynamic(m -> {
            calls[0] += 1;
            return "block";
          }))
          .state("block", Rule.emit("CLOSE", "\\}").pop())
          .build();
      LexerOptions options = LexerOptions.builder()
          .unmatchedPolicy(LexerOptions.UnmatchedPolicy.UNPARSED_RUN)
          .build();
      TokenStream tokens = new StateLexer(table, options).tokenize("?!{}", "default");
      assertEquals(List.of(
          tok(LexerOptions.UNPARSED, "?!", 0),
          tok("OPEN", "{", 2),
          tok("CLOSE", "}", 3)), tokens.toList());
      assertEquals(List.of("default"), tokens.contextStack());
      assertEquals(1, calls[0]);
    }
  }

  /**
   * Tests for rules that match the empty string.
   */
  @SuppressWarnings("InnerClassMayBeStatic")
  @Nested
  class ZeroWidth {

    /**
     * A look-ahead rule can switch state without consuming text.
     */
    @Test void lookaheadPush() {
      StateTable table = StateTable.builder()
          .state("default",
              Rule.emit("NUM", "\\d+"),
              Rule.skip("(?=[a-z])").push("word"))
          .state("word",
              Rule.emit("WORD", "[a-z]+").pop())
          .build();
      TokenStream tokens = StateLexer.tokenize("12ab3", table, "default");
      assertEquals(List.of(
          tok("NUM", "12", 0),
          tok("WORD", "ab", 2),
          tok("NUM", "3", 4)), tokens.toList());
      assertEquals(List.of("default"), tokens.contextStack());
      assertFalse(tokens.hasDiagnostics());
    }

    /**
     * A rule matching the empty string without a transition can never make
     * progress, and is passed over.
     */
    @Test void emptyMatchWithoutTransitionIsIgnored() {
      StateTable table = StateTable.builder()
          .state("default",
              Rule.emit("AS", "a*"),
              Rule.emit("B", "b"))
          .build();
      assertEquals(List.of(tok("AS", "a", 0), tok("B", "b", 1), tok("B", "b", 2)),
          new StateLexer(table).tokenizeAll("abb", "default"));
    }

    /**
     * Zero-width rules that push and pop each other forever are cut off.
     */
    @Test void zeroWidthLoopTerminates() {
      StateTable table = StateTable.builder()
          .state("default", Rule.skip("(?=x)").push("other"))
          .state("other", Rule.skip("(?=x)").pop())
          .build();
      TokenStream tokens = StateLexer.tokenize("xx", table, "default");
      assertEquals(List.of(
          tok(LexerOptions.UNPARSED, "x", 0),
          tok(LexerOptions.UNPARSED, "x", 1)), tokens.toList());
      assertTrue(diagnosticKinds(tokens).contains(LexerDiagnostic.Kind.ZERO_WIDTH_LOOP));
      assertEquals(List.of("default"), tokens.contextStack());
    }

    /**
     * The zero-width limit is configurable.
     */
    @Test void zeroWidthLimit() {
      StateTable table = StateTable.builder()
          .state("default", Rule.skip("(?=x)").push("other"))
          .state("other", Rule.skip("(?=x)").pop())
          .build();
      LexerOptions options = LexerOptions.builder().maxZeroWidthSteps(3).build();
      TokenStream tokens = new StateLexer(table, options).tokenize("x", "default");
      assertEquals(List.of(tok(LexerOptions.UNPARSED, "x", 0)), tokens.toList());
      assertEquals(List.of("default", "other"), tokens.contextStack());
    }
  }

  /**
   * Tokens are produced on demand; text past the current token is never looked at.
   */
  @Test void lazy() {
    CharSequence poisoned = new CharSequence() {
      private final String prefix = "ab cd";
      @Override public int length() {
        return 1_000_000;
      }
      @Override public char charAt(int index) {
        if (index >= prefix.length()) {
          throw new AssertionError("Read past the first token: " + index);
        }
        return prefix.charAt(index);
      }
      @Override public CharSequence subSequence(int start, int end) {
        if (end > prefix.length()) {
          throw new AssertionError("Read past the first token: " + end);
        }
        return prefix.subSequence(start, end);
      }
      @Override public String toString() {
        return prefix + "...";
      }
    };
    TokenStream tokens = StateLexer.tokenize(poisoned, BLOCKS, "default");
    assertEquals(tok("IDENT", "ab", 0), tokens.next());
    assertEquals(2, tokens.position());
    assertFalse(tokens.isExhausted());
  }

  /**
   * The inputs we check the structural properties of runs on.
   */
  private static final List<String> INPUTS = Arrays.asList(
      "",
      "a {b}",
      "abc 123 {def {\"g h\\\"i\"} 45}",
      "{{{",
      "}}} a",
      "a @# b",
      "\"unterminated {string",
      "  \t\n  ",
      "x{y}z{}{{}}\"\\\\\""
  );

  /**
   * Tokenizing the same input twice yields the same tokens.
   */
  @TestFactory Stream<DynamicTest> deterministic() {
    return INPUTS.stream().map(input -> DynamicTest.dynamicTest(
        "'" + input + "' lexes deterministically", () -> {
          StateLexer lexer = new StateLexer(RICH);
          TokenStream first = lexer.tokenize(input, "default");
          TokenStream second = lexer.tokenize(input, "default");
          assertEquals(first.toList(), second.toList());
          assertEquals(first.contextStack(), second.contextStack());
          assertEquals(first.diagnostics(), second.diagnostics());
        }));
  }

  /**
   * Tokens appear in order, don't overlap, carry exactly the text at their offset,
   * and only skipped whitespace lies between them.
   */
  @TestFactory Stream<DynamicTest> coverage() {
    return INPUTS.stream().map(input -> DynamicTest.dynamicTest(
        "'" + input + "' is covered by its tokens", () -> {
          int end = 0;
          for (Token token : new StateLexer(RICH).tokenizeAll(input, "default")) {
            assertTrue(token.offset() >= end, "Token overlaps its predecessor: " + token);
            assertTrue(input.substring(end, token.offset()).isBlank(),
                "Gap before " + token + " is not whitespace");
            assertTrue(token.length() > 0, "Empty token: " + token);
            assertEquals(input.substring(token.offset(), token.end()), token.text());
            end = token.end();
          }
          assertTrue(input.substring(end).isBlank(), "Trailing gap is not whitespace");
        }));
  }

  /**
   * Every run terminates, even when nothing matches.
   */
  @TestFactory Stream<DynamicTest> terminates() {
    StateTable nothing = StateTable.builder()
        .state("default", Rule.skip("(?=.)").push("default"))
        .build();
    return INPUTS.stream().map(input -> DynamicTest.dynamicTest(
        "'" + input + "' terminates", () -> {
          TokenStream tokens = new StateLexer(nothing).tokenize(input, "default");
          int count = tokens.toList().size();
          assertEquals(input.codePointCount(0, input.length()), count);
          assertTrue(tokens.isExhausted());
        }));
  }
}
