package org.akton.arn;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of an ARN operation that may be rejected.
 * Either {@link Ok} containing a value, or {@link Fail} containing an {@link ArnError}.
 *
 * <p>Every codec entry point returns an Outcome instead of throwing, so parsing untrusted
 * input is always fallible in the type system:</p>
 * <pre>{@code
 * Outcome<Arn> parsed = codec.parse(input);
 * if (parsed instanceof Outcome.Fail<Arn> fail) {
 *     log(fail.failure().message());
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        public Ok {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public Optional<ArnError> error() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super ArnError, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> onFailure(Consumer<? super ArnError> action) {
            return this;
        }
    }

    /**
     * A failed outcome containing the rejection.
     *
     * @param failure the error describing why the operation was rejected
     */
    record Fail<T>(ArnError failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public Optional<ArnError> error() {
            return Optional.of(failure);
        }

        @Override
        public T getOrThrow() {
            throw new ArnFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Outcome<T> recover(Function<? super ArnError, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }

        @Override
        public Outcome<T> onFailure(Consumer<? super ArnError> action) {
            Objects.requireNonNull(action);
            action.accept(failure);
            return this;
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the error if this outcome failed.
     *
     * @return an Optional containing the error, or empty on success
     */
    Optional<ArnError> error();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    // Recovery
    Outcome<T> recover(Function<? super ArnError, ? extends T> recovery);

    /**
     * Runs the action with the error if this outcome failed, then returns this outcome unchanged.
     */
    Outcome<T> onFailure(Consumer<? super ArnError> action);

    // Static factories
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(ArnError error) {
        return new Fail<>(error);
    }
}
