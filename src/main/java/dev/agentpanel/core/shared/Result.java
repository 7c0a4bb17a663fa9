package dev.agentpanel.core.shared;

import java.util.Objects;
import java.util.Optional;

/**
 * Success-or-error value for operations whose failures are expected outcomes rather than bugs.
 *
 * <p>Callers branch on {@link #isOk()} and read {@link #value()} or {@link #error()}; each accessor
 * throws {@link IllegalStateException} on the wrong variant.
 *
 * @param <T> success type
 * @param <E> error type
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    T value();

    E error();

    default Optional<T> toOptional() {
        return isOk() ? Optional.of(value()) : Optional.empty();
    }

    record Ok<T, E>(T value) implements Result<T, E> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public E error() {
            throw new IllegalStateException("Result is a success: " + value);
        }
    }

    record Err<T, E>(E error) implements Result<T, E> {
        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Result is an error: " + error);
        }
    }
}
