package org.tricoteuses.amendment.navigation;

import org.tricoteuses.amendment.parser.ScanContext;
import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a block into sentences on ".", "!", "?" or "…" followed by a blank or the end.
 *
 * <p>The leading division label ("II. –", "1°") is not part of the first sentence. Terminal
 * punctuation inside « » quotations, or followed by a lowercase word or a digit ("article L. 123"),
 * does not end a sentence.
 */
public final class SentenceSplitter {
    private SentenceSplitter() {}

    public static List<SourceSpan> split(String text) {
        return split(text, MarkerPatterns.labelLength(text));
    }

    /**
     * Sentence spans of {@code text} from {@code from} on, trimmed and never empty.
     */
    public static List<SourceSpan> split(String text, int from) {
        var sentences = new ArrayList<SourceSpan>();
        int start = from;
        int quoteDepth = 0;
        for (int i = from; i < text.length(); i++) {
            var c = text.charAt(i);
            if (c == '«') {
                quoteDepth++;
            } else if (c == '»' && quoteDepth > 0) {
                quoteDepth--;
            } else if (quoteDepth == 0 && isTerminal(c) && endsSentence(text, i)) {
                addTrimmed(text, start, i + 1, sentences);
                start = i + 1;
            }
        }
        addTrimmed(text, start, text.length(), sentences);
        return sentences;
    }

    private static boolean isTerminal(char c) {
        return c == '.' || c == '!' || c == '?' || c == '…';
    }

    private static boolean endsSentence(String text, int index) {
        int next = index + 1;
        if (next >= text.length()) {
            return true;
        }
        if (!ScanContext.isSpace(text.charAt(next))) {
            return false;
        }
        while (next < text.length() && ScanContext.isSpace(text.charAt(next))) {
            next++;
        }
        return next >= text.length()
               || !(Character.isLowerCase(text.charAt(next)) || Character.isDigit(text.charAt(next)));
    }

    private static void addTrimmed(String text, int start, int end, List<SourceSpan> sentences) {
        int from = start;
        int to = end;
        while (from < to && ScanContext.isSpace(text.charAt(from))) {
            from++;
        }
        while (to > from && ScanContext.isSpace(text.charAt(to - 1))) {
            to--;
        }
        if (from < to) {
            sentences.add(SourceSpan.of(from, to));
        }
    }
}
