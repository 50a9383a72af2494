package org.tricoteuses.amendment.grammar;

import org.tricoteuses.amendment.parser.ParseResult;
import org.tricoteuses.amendment.parser.Parser;
import org.tricoteuses.amendment.parser.ScanContext;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.CitationNode;
import org.tricoteuses.amendment.tree.Placement;
import org.tricoteuses.amendment.tree.Placement.Position;
import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static org.tricoteuses.amendment.parser.Parsers.keyword;
import static org.tricoteuses.amendment.parser.Parsers.keywords;
import static org.tricoteuses.amendment.parser.Parsers.literal;
import static org.tricoteuses.amendment.parser.Parsers.pattern;

/**
 * Amendment verbs: "est remplacé par", "sont insérés", "est ainsi rédigé", "est abrogé"...
 * with an optional leading placement clause and the quoted content that follows.
 */
public final class ActionGrammar {

    private static final Pattern CITATION_SEPARATOR = Pattern.compile(
        "(?:[\\s,;:]|\\bet\\b|\\bou\\b|\\ble\\s+mot\\b|\\bles\\s+mots\\b|\\bla\\s+référence\\b|\\bles\\s+références\\b)+",
        Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /**
     * Failure expectation of an action whose quotation is never closed.
     */
    public static final String UNBALANCED_QUOTATION = "closing quotation mark";

    private final ReferenceGrammar references;

    private ActionGrammar(ReferenceGrammar references) {
        this.references = references;
    }

    public static ActionGrammar create(ReferenceGrammar references) {
        return new ActionGrammar(references);
    }

    public static ActionGrammar create() {
        return create(ReferenceGrammar.create());
    }

    /**
     * Placement clause with the span it covers, comma excluded.
     */
    public record PlacementClause(Placement placement, SourceSpan span) {}

    /**
     * Action with an optional leading placement ("Après le III, il est inséré...").
     */
    public Parser<ActionNode> action() {
        return this::parseAction;
    }

    /**
     * Verb clause only, starting at "il", "est" or "sont".
     */
    public Parser<ActionNode> verbClause() {
        return this::parseVerbClause;
    }

    /**
     * "après le III", "avant l'article 3", "au début du I", "à la fin du premier alinéa".
     */
    public Parser<PlacementClause> placement() {
        return this::parsePlacement;
    }

    // === Placement ===

    private ParseResult<PlacementClause> parsePlacement(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipTrivia();
        var start = ctx.pos();
        var relative = keywords("après", "avant").parse(ctx);
        if (relative.isSuccess()) {
            var anchor = references.reference().parse(ctx);
            if (anchor.isFailure()) {
                ctx.restore(checkpoint);
                return ParseResult.Failure.at(checkpoint, "placement anchor");
            }
            var position = relative.toOptional().orElseThrow().equals("après") ? Position.AFTER : Position.BEFORE;
            var placement = Placement.of(position, anchor.toOptional().orElseThrow());
            return ParseResult.Success.of(new PlacementClause(placement, ctx.spanFrom(start)), ctx.pos());
        }
        var edge = keywords("au début", "à la fin").parse(ctx);
        if (edge.isSuccess()) {
            var position = edge.toOptional().orElseThrow().equals("au début") ? Position.BEGINNING : Position.END;
            var afterEdge = ctx.pos();
            // "à la fin du premier alinéa": the anchor opens with its own connector
            var anchor = references.reference().parse(ctx).toOptional();
            var placement = new Placement(position, anchor);
            if (anchor.isEmpty()) {
                ctx.restore(afterEdge);
            }
            return ParseResult.Success.of(new PlacementClause(placement, ctx.spanFrom(start)), ctx.pos());
        }
        ctx.restore(checkpoint);
        ctx.updateFurthest("placement");
        return ParseResult.Failure.at(checkpoint, "placement");
    }

    // === Action ===

    /**
     * Whether a failed action recognized its verb but not the end of its quotation.
     */
    public static boolean isUnbalanced(ParseResult<?> result) {
        return result instanceof ParseResult.Failure<?> failure && failure.expected().equals(UNBALANCED_QUOTATION);
    }

    private ParseResult<ActionNode> parseAction(ScanContext ctx) {
        var checkpoint = ctx.save();
        var placement = parsePlacement(ctx).toOptional();
        if (placement.isPresent()) {
            literal(",").parse(ctx);
        }
        var verb = parseVerbClause(ctx);
        if (verb.isFailure()) {
            ctx.restore(checkpoint);
            return verb;
        }
        var action = verb.toOptional().orElseThrow();
        if (placement.isPresent()) {
            action = action.withPlacement(placement.get().placement(), placement.get().span());
        }
        return ParseResult.Success.of(action, ctx.pos());
    }

    private ParseResult<ActionNode> parseVerbClause(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipTrivia();
        var start = ctx.pos();
        keyword("il").parse(ctx);
        if (keywords("est", "sont").parse(ctx).isFailure()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "'est' or 'sont'");
        }
        var form = keywords(AmendmentVerb.forms()).parse(ctx);
        if (form.isFailure()) {
            ctx.restore(checkpoint);
            ctx.updateFurthest("amendment verb");
            return ParseResult.Failure.at(checkpoint, "amendment verb");
        }
        var verb = AmendmentVerb.fromForm(form.toOptional().orElseThrow()).orElseThrow();
        if (verb.requiresPar() && keyword("par").parse(ctx).isFailure()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "'par'");
        }
        var end = ctx.pos();
        var citations = new ArrayList<CitationNode>();
        skipTail(ctx);
        if (CitationGrammar.atOpener(ctx)) {
            var quoted = parseCitations(ctx);
            if (quoted.isEmpty()) {
                ctx.restore(checkpoint);
                return ParseResult.Failure.at(checkpoint, UNBALANCED_QUOTATION);
            }
            citations.addAll(quoted.get());
            end = ctx.pos();
        } else if (ctx.pos() > end) {
            end = endOfTail(ctx, end);
        }
        ctx.restore(end);
        var placement = verb.appends() ? Optional.of(Placement.of(Position.END)) : Optional.<Placement>empty();
        var node = new ActionNode(ctx.spanFrom(start), verb.kind(), citations, placement, verb.rewritesWholeTarget());
        return ParseResult.Success.of(node, ctx.pos());
    }

    // === Tail and citations ===

    /**
     * Descriptive words after the verb ("un III bis ainsi rédigé :", "par les mots :"), up to the
     * first quotation, a semicolon or the end.
     */
    private static void skipTail(ScanContext ctx) {
        while (!ctx.isAtEnd() && !CitationGrammar.isOpener(ctx.peek()) && ctx.peek() != ';') {
            ctx.advance();
        }
    }

    /**
     * End of a tail with no quotation: trailing blanks and a final period stay unconsumed.
     */
    private static int endOfTail(ScanContext ctx, int verbEnd) {
        int end = ctx.pos();
        while (end > verbEnd && ScanContext.isSpace(ctx.charAt(end - 1))) {
            end--;
        }
        if (end > verbEnd && ctx.charAt(end - 1) == '.') {
            end--;
            while (end > verbEnd && ScanContext.isSpace(ctx.charAt(end - 1))) {
                end--;
            }
        }
        return end;
    }

    private static Optional<List<CitationNode>> parseCitations(ScanContext ctx) {
        var citation = CitationGrammar.citation();
        var first = citation.parse(ctx);
        if (first.isFailure()) {
            return Optional.empty();
        }
        var citations = new ArrayList<CitationNode>();
        citations.add(first.toOptional().orElseThrow());
        var separator = pattern(CITATION_SEPARATOR, "citation separator");
        while (true) {
            var afterLast = ctx.save();
            separator.parse(ctx);
            if (!CitationGrammar.atOpener(ctx)) {
                ctx.restore(afterLast);
                break;
            }
            var next = citation.parse(ctx);
            if (next.isFailure()) {
                return Optional.empty();
            }
            citations.add(next.toOptional().orElseThrow());
        }
        return Optional.of(citations);
    }
}
