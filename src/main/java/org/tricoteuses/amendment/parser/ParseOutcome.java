package org.tricoteuses.amendment.parser;

import org.tricoteuses.amendment.error.ParseError;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of parsing a whole sentence: a value plus the input left unconsumed, or a typed error.
 */
public sealed interface ParseOutcome<T> {

    boolean isParsed();

    default boolean isUnparsed() {
        return !isParsed();
    }

    Optional<T> value();

    Optional<ParseError> error();

    <R> R fold(Function<? super ParseError, ? extends R> onError, Function<? super T, ? extends R> onValue);

    <R> ParseOutcome<R> map(Function<? super T, ? extends R> mapper);

    <R> ParseOutcome<R> flatMap(Function<? super T, ParseOutcome<R>> mapper);

    /**
     * The value, or an {@link IllegalStateException} carrying the error message.
     */
    default T unwrap() {
        return fold(error -> {
            throw new IllegalStateException(error.message());
        }, Function.identity());
    }

    static <T> ParseOutcome<T> parsed(T value, String remaining) {
        return new Parsed<>(value, remaining);
    }

    static <T> ParseOutcome<T> unparsed(ParseError error) {
        return new Unparsed<>(error);
    }

    /**
     * @param remaining input left after the parsed value, for diagnostics when parsing is partial
     */
    record Parsed<T>(T node, String remaining) implements ParseOutcome<T> {
        public Parsed {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(remaining, "remaining");
        }

        public boolean isComplete() {
            return remaining.isBlank();
        }

        @Override
        public boolean isParsed() {
            return true;
        }

        @Override
        public Optional<T> value() {
            return Optional.of(node);
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onError, Function<? super T, ? extends R> onValue) {
            return onValue.apply(node);
        }

        @Override
        public <R> ParseOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Parsed<>(mapper.apply(node), remaining);
        }

        @Override
        public <R> ParseOutcome<R> flatMap(Function<? super T, ParseOutcome<R>> mapper) {
            return mapper.apply(node);
        }
    }

    record Unparsed<T>(ParseError cause) implements ParseOutcome<T> {
        public Unparsed {
            Objects.requireNonNull(cause, "cause");
        }

        @Override
        public boolean isParsed() {
            return false;
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(cause);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onError, Function<? super T, ? extends R> onValue) {
            return onError.apply(cause);
        }

        @Override
        public <R> ParseOutcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Unparsed<>(cause);
        }

        @Override
        public <R> ParseOutcome<R> flatMap(Function<? super T, ParseOutcome<R>> mapper) {
            return new Unparsed<>(cause);
        }
    }
}
