package org.pragmatica.alang.parser;

import org.pragmatica.alang.error.ParseError;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of running the front end - either a value or the single fatal error that aborted the parse.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The value, present only on success.
     */
    Optional<T> value();

    /**
     * The value of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    T unwrap();

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Failure<T>, ? extends R> onFailure);

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error, error.toDiagnostic().formatSimple());
    }

    static <T> ParseResult<T> failure(ParseError error, String report) {
        return new Failure<>(error, report);
    }

    record Success<T>(T node) implements ParseResult<T> {
        public Success {
            Objects.requireNonNull(node, "node");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> value() {
            return Optional.of(node);
        }

        @Override
        public T unwrap() {
            return node;
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(node));
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Failure<T>, ? extends R> onFailure) {
            return onSuccess.apply(node);
        }
    }

    /**
     * Failed parse; {@code report} is the human-readable diagnostic.
     */
    record Failure<T>(ParseError error, String report) implements ParseResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(report, "report");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> value() {
            return Optional.empty();
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException(report);
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(error, report);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<Failure<T>, ? extends R> onFailure) {
            return onFailure.apply(this);
        }

        public Failure<T> withReport(String newReport) {
            return new Failure<>(error, newReport);
        }
    }
}
