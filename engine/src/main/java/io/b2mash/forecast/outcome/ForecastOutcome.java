package io.b2mash.forecast.outcome;

import java.util.Objects;
import java.util.function.Function;

/**
 * Result of an engine operation: either a computed value or a tagged failure. Failures are returned
 * rather than thrown so that a rendering caller can degrade gracefully; {@link #orElseThrow()} is
 * available for callers that prefer exceptions.
 *
 * @param <T> the type of the computed value
 */
public sealed interface ForecastOutcome<T>
    permits ForecastOutcome.Success, ForecastOutcome.Failure {

  static <T> ForecastOutcome<T> success(T value) {
    return new Success<>(value);
  }

  static <T> ForecastOutcome<T> failure(ForecastError error) {
    return new Failure<>(error);
  }

  boolean isSuccess();

  /** Applies {@code mapper} to a successful value; failures pass through unchanged. */
  <R> ForecastOutcome<R> map(Function<? super T, ? extends R> mapper);

  /** Chains another operation that may itself fail. */
  <R> ForecastOutcome<R> flatMap(Function<? super T, ForecastOutcome<R>> mapper);

  /**
   * Returns the value of a successful outcome.
   *
   * @throws ForecastException if this outcome is a failure
   */
  T orElseThrow();

  record Success<T>(T value) implements ForecastOutcome<T> {

    public Success {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public <R> ForecastOutcome<R> map(Function<? super T, ? extends R> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <R> ForecastOutcome<R> flatMap(Function<? super T, ForecastOutcome<R>> mapper) {
      return mapper.apply(value);
    }

    @Override
    public T orElseThrow() {
      return value;
    }
  }

  record Failure<T>(ForecastError error) implements ForecastOutcome<T> {

    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public <R> ForecastOutcome<R> map(Function<? super T, ? extends R> mapper) {
      return new Failure<>(error);
    }

    @Override
    public <R> ForecastOutcome<R> flatMap(Function<? super T, ForecastOutcome<R>> mapper) {
      return new Failure<>(error);
    }

    @Override
    public T orElseThrow() {
      throw new ForecastException(error);
    }
  }
}
