package org.javai.symcalc.engine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or the error that prevented it.
 *
 * @param <T> the type of the value on success
 */
public sealed interface CasResult<T> {

	record Success<T>(T result) implements CasResult<T> {

		public Success {
			Objects.requireNonNull(result, "result must not be null");
		}
	}

	record Failure<T>(CasError cause) implements CasResult<T> {

		public Failure {
			Objects.requireNonNull(cause, "cause must not be null");
		}
	}

	static <T> CasResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> CasResult<T> failure(CasError error) {
		return new Failure<>(error);
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}

	default Optional<T> value() {
		return this instanceof Success<T> s ? Optional.of(s.result()) : Optional.empty();
	}

	default Optional<CasError> error() {
		return this instanceof Failure<T> f ? Optional.of(f.cause()) : Optional.empty();
	}

	/**
	 * Applies {@code mapper} to a successful value; a failure passes through unchanged.
	 * Exceptions thrown by {@code mapper} propagate to the caller.
	 */
	default <U> CasResult<U> map(Function<? super T, ? extends U> mapper) {
		if (this instanceof Success<T> s) {
			return success(mapper.apply(s.result()));
		}
		return failure(((Failure<T>) this).cause());
	}

	/**
	 * Returns the value, or throws {@link IllegalStateException} carrying the error message.
	 */
	default T orElseThrow() {
		if (this instanceof Success<T> s) {
			return s.result();
		}
		throw new IllegalStateException(((Failure<T>) this).cause().toString());
	}
}
