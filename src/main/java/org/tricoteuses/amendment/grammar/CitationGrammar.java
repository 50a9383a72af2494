package org.tricoteuses.amendment.grammar;

import org.tricoteuses.amendment.parser.ParseResult;
import org.tricoteuses.amendment.parser.Parser;
import org.tricoteuses.amendment.parser.ScanContext;
import org.tricoteuses.amendment.tree.CitationNode;

/**
 * Delimited quotations: « … » (nesting-aware), “ … ” and "…".
 *
 * <p>An opening delimiter without its closing mate is a failure, never a partial citation.
 */
public final class CitationGrammar {
    private CitationGrammar() {}

    private static final String OPENERS = "«“\"";

    public static boolean isOpener(char c) {
        return OPENERS.indexOf(c) >= 0;
    }

    /**
     * Whether the next non-blank char opens a quotation.
     */
    public static boolean atOpener(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipWhitespace();
        var result = !ctx.isAtEnd() && isOpener(ctx.peek());
        ctx.restore(checkpoint);
        return result;
    }

    public static Parser<CitationNode> citation() {
        return CitationGrammar::parseCitation;
    }

    private static ParseResult<CitationNode> parseCitation(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipTrivia();
        var start = ctx.pos();
        if (ctx.isAtEnd() || !isOpener(ctx.peek())) {
            ctx.updateFurthest("quotation");
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "quotation");
        }
        var opener = ctx.advance();
        var closer = closerOf(opener);
        var contentStart = ctx.pos();
        int depth = 1;
        while (!ctx.isAtEnd()) {
            var c = ctx.peek();
            if (c == closer && --depth == 0) {
                var content = ctx.substring(contentStart, ctx.pos());
                ctx.advance();
                return ParseResult.Success.of(new CitationNode(ctx.spanFrom(start), stripSpaces(content)), ctx.pos());
            }
            if (c == opener && opener != closer) {
                depth++;
            }
            ctx.advance();
        }
        var expected = "closing " + closer;
        ctx.updateFurthest(expected);
        ctx.restore(checkpoint);
        return ParseResult.Failure.at(start, expected);
    }

    private static char closerOf(char opener) {
        return switch (opener) {
            case '«' -> '»';
            case '“' -> '”';
            default -> opener;
        };
    }

    static String stripSpaces(String text) {
        int from = 0;
        int to = text.length();
        while (from < to && ScanContext.isSpace(text.charAt(from))) {
            from++;
        }
        while (to > from && ScanContext.isSpace(text.charAt(to - 1))) {
            to--;
        }
        return text.substring(from, to);
    }
}
