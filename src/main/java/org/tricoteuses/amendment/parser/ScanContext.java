package org.tricoteuses.amendment.parser;

import org.tricoteuses.amendment.tree.SourceSpan;

import java.text.Normalizer;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Mutable cursor over an immutable input. One instance per parse attempt; never shared.
 *
 * <p>Every parser that fails restores the cursor to the checkpoint it took before trying,
 * so that the next alternative sees unconsumed input.
 */
public final class ScanContext {

    private final String input;
    private final ParserConfig config;

    private int pos;
    private int furthestPos;
    private String furthestExpected;

    private ScanContext(String input, ParserConfig config) {
        this.input = input;
        this.config = config;
        this.pos = 0;
        this.furthestPos = 0;
        this.furthestExpected = "";
    }

    public static ScanContext create(String input) {
        return create(input, ParserConfig.DEFAULT);
    }

    public static ScanContext create(String input, ParserConfig config) {
        if (input == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        return new ScanContext(input, config);
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    /**
     * Checkpoint for {@link #restore(int)}.
     */
    public int save() {
        return pos;
    }

    public void restore(int checkpoint) {
        if (checkpoint < 0 || checkpoint > input.length()) {
            throw new IllegalArgumentException("Checkpoint out of range: " + checkpoint);
        }
        this.pos = checkpoint;
    }

    public boolean isAtEnd() {
        return pos >= input.length();
    }

    public String remaining() {
        return input.substring(pos);
    }

    public int remainingLength() {
        return input.length() - pos;
    }

    // === Character Access ===

    public char peek() {
        return input.charAt(pos);
    }

    /**
     * Up to {@code n} characters ahead of the cursor, without consuming them.
     */
    public String peek(int n) {
        return input.substring(pos, Math.min(input.length(), pos + n));
    }

    public char charAt(int offset) {
        return input.charAt(offset);
    }

    public char advance() {
        return input.charAt(pos++);
    }

    public String substring(int start, int end) {
        return input.substring(start, end);
    }

    // === Matching ===

    /**
     * Consume {@code literal} if it is next in the input, honouring the case and diacritics policy.
     */
    public boolean matchLiteral(String literal) {
        if (!lookingAtLiteral(literal)) {
            return false;
        }
        pos += literal.length();
        return true;
    }

    public boolean lookingAtLiteral(String literal) {
        if (pos + literal.length() > input.length()) {
            return false;
        }
        for (int i = 0; i < literal.length(); i++) {
            if (!sameChar(input.charAt(pos + i), literal.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Consume a match of {@code pattern} anchored at the cursor. Case sensitivity is the pattern's own.
     */
    public Optional<MatchResult> matchPattern(Pattern pattern) {
        var matcher = pattern.matcher(input);
        matcher.region(pos, input.length());
        matcher.useTransparentBounds(true);
        matcher.useAnchoringBounds(false);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        var result = matcher.toMatchResult();
        pos = matcher.end();
        return Optional.of(result);
    }

    /**
     * Skip whitespace (including non-breaking spaces) and return the number of chars skipped.
     */
    public int skipWhitespace() {
        int start = pos;
        while (pos < input.length() && isSpace(input.charAt(pos))) {
            pos++;
        }
        return pos - start;
    }

    /**
     * Skip whitespace if the configuration asks token parsers to do so.
     */
    public void skipTrivia() {
        if (config.skipWhitespace()) {
            skipWhitespace();
        }
    }

    /**
     * Whether the char at {@code offset} continues a word (used for keyword boundaries).
     */
    public boolean isWordCharAt(int offset) {
        return offset < input.length() && Character.isLetterOrDigit(input.charAt(offset));
    }

    // === Error Tracking ===

    public void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestExpected = expected;
        } else if (pos == furthestPos && !furthestExpected.contains(expected)) {
            furthestExpected = furthestExpected.isEmpty()
                ? expected
                : furthestExpected + " or " + expected;
        }
    }

    public int furthestPos() {
        return furthestPos;
    }

    public String furthestExpected() {
        return furthestExpected;
    }

    // === Accessors ===

    public String input() {
        return input;
    }

    public ParserConfig config() {
        return config;
    }

    // === Span Creation ===

    public SourceSpan spanFrom(int startOffset) {
        return SourceSpan.of(startOffset, pos);
    }

    // === Folding ===

    private boolean sameChar(char actual, char expected) {
        if (actual == expected) {
            return true;
        }
        return fold(actual) == fold(expected);
    }

    private char fold(char c) {
        char folded = c;
        if (folded == '\u2019' || folded == '\u02BC') {
            return '\'';
        }
        if (isSpace(folded)) {
            return ' ';
        }
        if (config.foldDiacritics()) {
            folded = stripDiacritic(folded);
        }
        if (config.caseInsensitive()) {
            folded = Character.toLowerCase(folded);
        }
        return folded;
    }

    static char stripDiacritic(char c) {
        if (c < 0x00C0) {
            return c;
        }
        var decomposed = Normalizer.normalize(String.valueOf(c), Normalizer.Form.NFD);
        return decomposed.isEmpty() ? c : decomposed.charAt(0);
    }

    public static boolean isSpace(char c) {
        return Character.isWhitespace(c) || c == '\u00A0' || c == '\u202F' || c == '\u2007';
    }
}
