package org.pragmatica.macro.error;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Result of a public operation: either a value or an {@link ExpansionError}.
 * Failures are never thrown; callers inspect or fold the outcome.
 */
public sealed interface Outcome<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(ExpansionError error) {
        return new Failure<>(error);
    }

    <R> R fold(Function<? super ExpansionError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        return this.<Outcome<R>>fold(Outcome::failure, value -> Outcome.success(mapper.apply(value)));
    }

    default <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        return this.<Outcome<R>>fold(Outcome::failure, mapper);
    }

    default Outcome<T> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Outcome<T> onFailure(Consumer<? super ExpansionError> action) {
        if (this instanceof Failure<T> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    /**
     * Value of a successful outcome.
     *
     * @throws IllegalStateException if this is a failure
     */
    default T unwrap() {
        return this.<T>fold(error -> {
                        throw new IllegalStateException("Unwrapping failed outcome: " + error.message());
                    },
                    value -> value);
    }

    /**
     * Error of a failed outcome.
     *
     * @throws IllegalStateException if this is a success
     */
    default ExpansionError error() {
        return this.<ExpansionError>fold(error -> error,
                    value -> {
                        throw new IllegalStateException("Outcome is a success");
                    });
    }

    record Success<T>(T value) implements Outcome<T> {
        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super ExpansionError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(ExpansionError error) implements Outcome<T> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super ExpansionError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }
    }
}
