package org.tricoteuses.amendment;

import org.tricoteuses.amendment.error.ParseError;
import org.tricoteuses.amendment.grammar.AmendmentGrammar;
import org.tricoteuses.amendment.parser.ParseOutcome;
import org.tricoteuses.amendment.parser.ParseResult;
import org.tricoteuses.amendment.parser.Parser;
import org.tricoteuses.amendment.parser.ParserConfig;
import org.tricoteuses.amendment.parser.ScanContext;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.AmendmentNode;
import org.tricoteuses.amendment.tree.ReferenceNode;

/**
 * Entry point for parsing amendment sentences.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = AmendmentParser.create();
 *
 * var outcome = parser.parse("Le dernier alinéa du II est supprimé.");
 * outcome.value().ifPresent(node -> ...);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe: every call builds its own {@link ScanContext}.
 */
public final class AmendmentParser {
    private static final int FOUND_PREVIEW = 20;

    private final AmendmentGrammar grammar;
    private final ParserConfig config;

    private AmendmentParser(AmendmentGrammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
    }

    public static AmendmentParser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static AmendmentParser create(ParserConfig config) {
        return new AmendmentParser(AmendmentGrammar.create(), config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Parse a whole sentence: reference and action, bare reference, or bare action.
     */
    public ParseOutcome<AmendmentNode> parse(String input) {
        return run(grammar.amendment(), input, "reference or amendment action");
    }

    /**
     * Parse a reference clause only ("du dernier alinéa du II").
     */
    public ParseOutcome<ReferenceNode> parseReference(String input) {
        return run(grammar.referenceClause(), input, "reference");
    }

    /**
     * Parse an action clause only ("est remplacée par les mots : « ... »").
     */
    public ParseOutcome<ActionNode> parseAction(String input) {
        return run(grammar.actions().action(), input, "amendment action");
    }

    /**
     * Render a parse error against the sentence it came from.
     */
    public String diagnose(String input, ParseError error) {
        return error.toDiagnostic().format(input, "");
    }

    private <T> ParseOutcome<T> run(Parser<T> parser, String input, String expected) {
        var ctx = ScanContext.create(input, config);
        if (input.isBlank()) {
            return ParseOutcome.unparsed(new ParseError.UnexpectedEof(input.length(), expected));
        }
        var result = parser.parse(ctx);
        if (result instanceof ParseResult.Success<T> success) {
            return ParseOutcome.parsed(success.value(), input.substring(success.end()));
        }
        return ParseOutcome.unparsed(errorAt(ctx, expected));
    }

    private static ParseError errorAt(ScanContext ctx, String fallback) {
        var input = ctx.input();
        var offset = ctx.furthestPos();
        var expected = ctx.furthestExpected().isEmpty() ? fallback : ctx.furthestExpected();
        if (input.substring(offset).isBlank()) {
            return new ParseError.UnexpectedEof(offset, expected);
        }
        int end = offset;
        while (end < input.length() && end - offset < FOUND_PREVIEW && !ScanContext.isSpace(input.charAt(end))) {
            end++;
        }
        return new ParseError.UnexpectedInput(offset, input.substring(offset, end), expected);
    }

    public static final class Builder {
        private boolean caseInsensitive = true;
        private boolean foldDiacritics = true;
        private boolean skipWhitespace = true;
        private boolean skipLeadingLabel = true;

        private Builder() {}

        public Builder caseInsensitive(boolean enabled) {
            this.caseInsensitive = enabled;
            return this;
        }

        public Builder foldDiacritics(boolean enabled) {
            this.foldDiacritics = enabled;
            return this;
        }

        public Builder skipWhitespace(boolean enabled) {
            this.skipWhitespace = enabled;
            return this;
        }

        public Builder skipLeadingLabel(boolean enabled) {
            this.skipLeadingLabel = enabled;
            return this;
        }

        public AmendmentParser build() {
            return create(new ParserConfig(caseInsensitive, foldDiacritics, skipWhitespace, skipLeadingLabel));
        }
    }
}
