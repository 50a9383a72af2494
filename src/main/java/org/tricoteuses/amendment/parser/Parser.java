package org.tricoteuses.amendment.parser;

import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A parser of {@code T} over a {@link ScanContext}.
 *
 * <p>Contract: on failure the context cursor is back where it was before the call.
 */
@FunctionalInterface
public interface Parser<T> {

    ParseResult<T> parse(ScanContext ctx);

    default <R> Parser<R> map(Function<? super T, ? extends R> mapper) {
        return ctx -> parse(ctx).map(mapper);
    }

    /**
     * Map the value together with the exact span this parser consumed (leading whitespace excluded).
     */
    default <R> Parser<R> mapSpanned(BiFunction<? super T, SourceSpan, ? extends R> mapper) {
        return Parsers.spanned(this, mapper);
    }

    /**
     * Replace the expectation reported when this parser fails.
     */
    default Parser<T> expecting(String expected) {
        return ctx -> {
            var checkpoint = ctx.save();
            var result = parse(ctx);
            if (result.isFailure()) {
                ctx.restore(checkpoint);
                ctx.updateFurthest(expected);
                return ParseResult.Failure.at(checkpoint, expected);
            }
            return result;
        };
    }

    default Parser<T> or(Parser<? extends T> other) {
        return Parsers.alternative(this, other);
    }
}
