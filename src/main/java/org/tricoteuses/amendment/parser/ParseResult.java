package org.tricoteuses.amendment.parser;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of running a parser at the current position - either success with a value or failure.
 *
 * <p>A failure is an ordinary outcome, not an exception: the cursor has been restored and the
 * caller may try something else at the same position.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed value, empty on failure.
     */
    Optional<T> toOptional();

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Successful parse with its value and the offset where it stopped.
     */
    record Success<T>(T value, int end) implements ParseResult<T> {

        public static <T> Success<T> of(T value, int end) {
            return new Success<>(value, end);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.ofNullable(value);
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value), end);
        }
    }

    /**
     * Failed parse - no match at {@code position}.
     */
    record Failure<T>(int position, String expected) implements ParseResult<T> {

        public static <T> Failure<T> at(int position, String expected) {
            return new Failure<>(position, expected);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> toOptional() {
            return Optional.empty();
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(position, expected);
        }
    }
}
