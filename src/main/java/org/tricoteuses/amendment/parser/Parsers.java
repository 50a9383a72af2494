package org.tricoteuses.amendment.parser;

import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Combinator building blocks. Every higher parser in the engine is a composition of these.
 *
 * <p>All parsers returned here honour the backtracking contract of {@link Parser}.
 */
public final class Parsers {
    private Parsers() {}

    /**
     * Three-argument combine function for {@link #sequence(Parser, Parser, Parser, Function3)}.
     */
    @FunctionalInterface
    public interface Function3<A, B, C, R> {
        R apply(A a, B b, C c);
    }

    // === Terminals ===

    /**
     * Literal text, matched with the case/diacritics policy of the context.
     */
    public static Parser<String> literal(String text) {
        var expected = "'" + text + "'";
        return ctx -> {
            var checkpoint = ctx.save();
            ctx.skipTrivia();
            var start = ctx.pos();
            if (ctx.matchLiteral(text)) {
                return ParseResult.Success.of(ctx.substring(start, ctx.pos()), ctx.pos());
            }
            return fail(ctx, checkpoint, expected);
        };
    }

    /**
     * Literal that must not be immediately followed by a letter or digit.
     */
    public static Parser<String> keyword(String word) {
        var expected = "'" + word + "'";
        var bounded = endsWithWordChar(word);
        return ctx -> {
            var checkpoint = ctx.save();
            ctx.skipTrivia();
            var start = ctx.pos();
            if (ctx.matchLiteral(word) && !(bounded && ctx.isWordCharAt(ctx.pos()))) {
                return ParseResult.Success.of(ctx.substring(start, ctx.pos()), ctx.pos());
            }
            return fail(ctx, checkpoint, expected);
        };
    }

    /**
     * Any keyword of a lexicon. Longer entries are tried first; the value is the lexicon entry
     * that matched (not the input text), so callers can map it to a meaning.
     */
    public static Parser<String> keywords(String... words) {
        return keywords(Arrays.asList(words));
    }

    public static Parser<String> keywords(List<String> words) {
        var ordered = new ArrayList<>(words);
        ordered.sort(Comparator.comparingInt(String::length).reversed());
        var expected = "one of " + words;
        return ctx -> {
            var checkpoint = ctx.save();
            ctx.skipTrivia();
            var start = ctx.pos();
            for (var word : ordered) {
                if (ctx.matchLiteral(word)) {
                    if (!(endsWithWordChar(word) && ctx.isWordCharAt(ctx.pos()))) {
                        return ParseResult.Success.of(word, ctx.pos());
                    }
                    ctx.restore(start);
                }
            }
            return fail(ctx, checkpoint, expected);
        };
    }

    /**
     * Regular expression anchored at the cursor.
     */
    public static Parser<MatchResult> pattern(Pattern pattern, String expected) {
        return ctx -> {
            var checkpoint = ctx.save();
            ctx.skipTrivia();
            var match = ctx.matchPattern(pattern);
            if (match.isPresent()) {
                return ParseResult.Success.of(match.get(), ctx.pos());
            }
            return fail(ctx, checkpoint, expected);
        };
    }

    public static <T> Parser<T> success(T value) {
        return ctx -> ParseResult.Success.of(value, ctx.pos());
    }

    // === Combinators ===

    public static <A, B, R> Parser<R> sequence(Parser<A> first,
                                               Parser<B> second,
                                               BiFunction<? super A, ? super B, ? extends R> combine) {
        return ctx -> {
            var checkpoint = ctx.save();
            var a = first.parse(ctx);
            if (a instanceof ParseResult.Failure<A> failure) {
                ctx.restore(checkpoint);
                return ParseResult.Failure.at(failure.position(), failure.expected());
            }
            var b = second.parse(ctx);
            if (b instanceof ParseResult.Failure<B> failure) {
                ctx.restore(checkpoint);
                return ParseResult.Failure.at(failure.position(), failure.expected());
            }
            var value = combine.apply(valueOf(a), valueOf(b));
            return ParseResult.Success.of(value, ctx.pos());
        };
    }

    public static <A, B, C, R> Parser<R> sequence(Parser<A> first,
                                                  Parser<B> second,
                                                  Parser<C> third,
                                                  Function3<? super A, ? super B, ? super C, ? extends R> combine) {
        return sequence(sequence(first, second, Pair::new),
                        third,
                        (pair, c) -> combine.apply(pair.first(), pair.second(), c));
    }

    /**
     * All parsers in order; on any failure the cursor goes back before the first one.
     */
    public static <R> Parser<R> sequence(List<? extends Parser<?>> parsers,
                                         Function<List<Object>, ? extends R> combine) {
        var steps = List.copyOf(parsers);
        return ctx -> {
            var checkpoint = ctx.save();
            var values = new ArrayList<Object>(steps.size());
            for (var parser : steps) {
                var result = parser.parse(ctx);
                if (result instanceof ParseResult.Failure<?> failure) {
                    ctx.restore(checkpoint);
                    return ParseResult.Failure.at(failure.position(), failure.expected());
                }
                values.add(((ParseResult.Success<?>) result).value());
            }
            return ParseResult.Success.of(combine.apply(values), ctx.pos());
        };
    }

    /**
     * Ordered choice: the first alternative that succeeds wins.
     */
    @SafeVarargs
    public static <T> Parser<T> alternative(Parser<? extends T>... alternatives) {
        return alternative(Arrays.asList(alternatives));
    }

    public static <T> Parser<T> alternative(List<? extends Parser<? extends T>> alternatives) {
        var choices = List.copyOf(alternatives);
        return ctx -> {
            var checkpoint = ctx.save();
            var expected = new ArrayList<String>();
            for (var choice : choices) {
                var result = choice.parse(ctx);
                if (result instanceof ParseResult.Success<? extends T> success) {
                    return ParseResult.Success.of(success.value(), success.end());
                }
                ctx.restore(checkpoint);
                expected.add(((ParseResult.Failure<? extends T>) result).expected());
            }
            return ParseResult.Failure.at(checkpoint, String.join(" or ", expected));
        };
    }

    /**
     * Succeeds with {@code defaultValue} and consumes nothing when {@code parser} fails.
     */
    public static <T> Parser<T> optional(Parser<T> parser, T defaultValue) {
        return ctx -> {
            var checkpoint = ctx.save();
            var result = parser.parse(ctx);
            if (result.isSuccess()) {
                return result;
            }
            ctx.restore(checkpoint);
            return ParseResult.Success.of(defaultValue, checkpoint);
        };
    }

    public static <T> Parser<Optional<T>> optional(Parser<T> parser) {
        return optional(parser.map(Optional::of), Optional.empty());
    }

    /**
     * Greedy repetition between {@code min} and {@code max} occurrences.
     */
    public static <T> Parser<List<T>> repeat(Parser<T> parser, int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid repetition bounds " + min + ".." + max);
        }
        return ctx -> {
            var checkpoint = ctx.save();
            var values = new ArrayList<T>();
            while (values.size() < max) {
                var before = ctx.save();
                var result = parser.parse(ctx);
                if (result instanceof ParseResult.Success<T> success) {
                    values.add(success.value());
                    if (ctx.pos() == before) {
                        // no progress, another round would loop forever
                        break;
                    }
                } else {
                    ctx.restore(before);
                    break;
                }
            }
            if (values.size() < min) {
                ctx.restore(checkpoint);
                return ParseResult.Failure.at(checkpoint, "at least " + min + " repetitions");
            }
            return ParseResult.Success.of(List.copyOf(values), ctx.pos());
        };
    }

    public static <T> Parser<List<T>> zeroOrMore(Parser<T> parser) {
        return repeat(parser, 0, Integer.MAX_VALUE);
    }

    public static <T> Parser<List<T>> oneOrMore(Parser<T> parser) {
        return repeat(parser, 1, Integer.MAX_VALUE);
    }

    // === Predicates ===

    /**
     * Positive lookahead: succeeds when {@code parser} would, without consuming input.
     */
    public static <T> Parser<T> lookahead(Parser<T> parser) {
        return ctx -> {
            var checkpoint = ctx.save();
            var result = parser.parse(ctx);
            ctx.restore(checkpoint);
            if (result instanceof ParseResult.Success<T> success) {
                return ParseResult.Success.of(success.value(), checkpoint);
            }
            return result;
        };
    }

    /**
     * Negative lookahead: succeeds, consuming nothing, when {@code parser} fails.
     */
    public static Parser<Boolean> not(Parser<?> parser, String expected) {
        return ctx -> {
            var checkpoint = ctx.save();
            var result = parser.parse(ctx);
            ctx.restore(checkpoint);
            if (result.isSuccess()) {
                return ParseResult.Failure.at(checkpoint, expected);
            }
            return ParseResult.Success.of(Boolean.TRUE, checkpoint);
        };
    }

    // === Special ===

    /**
     * Run {@code parser} and hand its value together with the exact consumed span to {@code mapper}.
     */
    public static <T, R> Parser<R> spanned(Parser<T> parser, BiFunction<? super T, SourceSpan, ? extends R> mapper) {
        return ctx -> {
            var checkpoint = ctx.save();
            ctx.skipTrivia();
            var start = ctx.pos();
            var result = parser.parse(ctx);
            if (result instanceof ParseResult.Success<T> success) {
                return ParseResult.Success.of(mapper.apply(success.value(), ctx.spanFrom(start)), ctx.pos());
            }
            ctx.restore(checkpoint);
            var failure = (ParseResult.Failure<T>) result;
            return ParseResult.Failure.at(failure.position(), failure.expected());
        };
    }

    /**
     * Deferred parser, for grammar rules that refer to each other.
     */
    public static <T> Parser<T> lazy(Supplier<Parser<T>> supplier) {
        return ctx -> supplier.get().parse(ctx);
    }

    // === Helpers ===

    private static <T> ParseResult<T> fail(ScanContext ctx, int checkpoint, String expected) {
        ctx.updateFurthest(expected);
        ctx.restore(checkpoint);
        return ParseResult.Failure.at(checkpoint, expected);
    }

    private static <T> T valueOf(ParseResult<T> result) {
        return ((ParseResult.Success<T>) result).value();
    }

    private static boolean endsWithWordChar(String word) {
        return !word.isEmpty() && Character.isLetterOrDigit(word.charAt(word.length() - 1));
    }

    private record Pair<A, B>(A first, B second) {}
}
