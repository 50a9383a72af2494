package org.tricoteuses.amendment.grammar;

import org.tricoteuses.amendment.parser.ParseResult;
import org.tricoteuses.amendment.parser.Parser;
import org.tricoteuses.amendment.parser.ScanContext;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.AmendmentNode;
import org.tricoteuses.amendment.tree.ReferenceAndAction;
import org.tricoteuses.amendment.tree.ReferenceNode;
import org.tricoteuses.amendment.tree.ReferenceNode.ParentChild;

import java.util.regex.Pattern;

import static org.tricoteuses.amendment.parser.Parsers.keywords;
import static org.tricoteuses.amendment.parser.Parsers.literal;

/**
 * Whole amendment sentence: a reference clause followed by its action, a bare reference, or an
 * action whose target is left implicit.
 */
public final class AmendmentGrammar {

    /**
     * Enumeration label opening a block: "1°", "a)", "II. –", "B.-", "3 bis."
     */
    static final Pattern LEADING_LABEL = Pattern.compile(
        "(?:[IVXLCDM]+|[A-Z]|\\d+|[a-z])(?:\\s+(?:" + Lexicon.MULTIPLICATIVE + "))?"
        + "(?:\\s?°|\\s?\\.\\s?[-–—]|(?:\\)|\\s?[-–—]|\\.)(?=\\s|$))");

    private final ReferenceGrammar references;
    private final ActionGrammar actions;

    private AmendmentGrammar(ReferenceGrammar references, ActionGrammar actions) {
        this.references = references;
        this.actions = actions;
    }

    public static AmendmentGrammar create() {
        var references = ReferenceGrammar.create();
        return new AmendmentGrammar(references, ActionGrammar.create(references));
    }

    public ReferenceGrammar references() {
        return references;
    }

    public ActionGrammar actions() {
        return actions;
    }

    public Parser<AmendmentNode> amendment() {
        return this::parseAmendment;
    }

    /**
     * Reference followed by comma-separated narrower references: "Au I, le A" is the A of the I.
     */
    public Parser<ReferenceNode> referenceClause() {
        return this::parseReferenceClause;
    }

    // === Composition ===

    private ParseResult<AmendmentNode> parseAmendment(ScanContext ctx) {
        var checkpoint = ctx.save();
        if (ctx.config().skipLeadingLabel()) {
            skipLeadingLabel(ctx);
        }

        var reference = parseReferenceClause(ctx);
        if (reference instanceof ParseResult.Success<ReferenceNode> found) {
            var afterReference = ctx.save();
            literal(",").parse(ctx);
            var action = actions.action().parse(ctx);
            if (action instanceof ParseResult.Success<ActionNode> verb) {
                skipTerminator(ctx);
                return ParseResult.Success.of(ReferenceAndAction.of(found.value(), verb.value()), ctx.pos());
            }
            ctx.restore(afterReference);
            if (ActionGrammar.isUnbalanced(action)) {
                ctx.restore(checkpoint);
                return ParseResult.Failure.at(checkpoint, ActionGrammar.UNBALANCED_QUOTATION);
            }
            return ParseResult.Success.of(found.value(), ctx.pos());
        }

        var placed = parsePlacedReference(ctx);
        if (placed.isSuccess()) {
            return placed;
        }

        var action = actions.action().parse(ctx);
        if (action instanceof ParseResult.Success<ActionNode> verb) {
            skipTerminator(ctx);
            return ParseResult.Success.of(verb.value(), ctx.pos());
        }
        ctx.restore(checkpoint);
        return ParseResult.Failure.at(checkpoint, "reference or amendment action");
    }

    /**
     * "Après le 2°, au I, il est inséré...": the placement belongs to the action, the reference is its target.
     */
    private ParseResult<AmendmentNode> parsePlacedReference(ScanContext ctx) {
        var checkpoint = ctx.save();
        var placement = actions.placement().parse(ctx).toOptional();
        if (placement.isEmpty() || literal(",").parse(ctx).isFailure()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "placement");
        }
        var reference = parseReferenceClause(ctx).toOptional();
        if (reference.isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "reference");
        }
        literal(",").parse(ctx);
        var action = actions.verbClause().parse(ctx).toOptional();
        if (action.isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "amendment action");
        }
        var placed = action.get().withPlacement(placement.get().placement(), placement.get().span());
        skipTerminator(ctx);
        return ParseResult.Success.of(ReferenceAndAction.of(reference.get(), placed), ctx.pos());
    }

    private ParseResult<ReferenceNode> parseReferenceClause(ScanContext ctx) {
        var first = references.reference().parse(ctx);
        if (first.isFailure()) {
            return first;
        }
        var result = first.toOptional().orElseThrow();
        while (true) {
            var beforeComma = ctx.save();
            if (literal(",").parse(ctx).isFailure()) {
                break;
            }
            var next = references.reference().parse(ctx);
            if (next.isFailure()) {
                ctx.restore(beforeComma);
                break;
            }
            result = ParentChild.of(result, next.toOptional().orElseThrow());
        }
        return ParseResult.Success.of(result, ctx.pos());
    }

    // === Helpers ===

    private static void skipLeadingLabel(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipWhitespace();
        if (ctx.matchPattern(LEADING_LABEL).isEmpty()) {
            ctx.restore(checkpoint);
        }
    }

    private static void skipTerminator(ScanContext ctx) {
        keywords(".", ";").parse(ctx);
    }
}
