package io.b2mash.forecast.outcome;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class ForecastOutcomeTest {

  @Test
  void successMapsValue() {
    var outcome = ForecastOutcome.success(20).map(value -> value * 2);

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.orElseThrow()).isEqualTo(40);
  }

  @Test
  void failurePassesThroughMapAndFlatMap() {
    var error = ForecastError.validation("SOME_CODE", "went wrong");
    ForecastOutcome<Integer> failed = ForecastOutcome.failure(error);

    var mapped = failed.map(value -> value + 1).flatMap(value -> ForecastOutcome.success("x"));

    assertThat(mapped).isEqualTo(new ForecastOutcome.Failure<String>(error));
  }

  @Test
  void flatMapPropagatesInnerFailure() {
    var error = ForecastError.configuration("INNER", "inner failed");

    var outcome = ForecastOutcome.success(1).flatMap(value -> ForecastOutcome.failure(error));

    assertThat(outcome.isSuccess()).isFalse();
  }

  @Test
  void configurationFailureThrowsUnprocessableEntity() {
    ForecastOutcome<String> outcome =
        ForecastOutcome.failure(
            ForecastError.configuration("NON_POSITIVE_HORIZON", "Horizon must be positive"));

    assertThatThrownBy(outcome::orElseThrow)
        .isInstanceOfSatisfying(
            ForecastException.class,
            ex -> {
              assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
              assertThat(ex.getBody().getTitle()).isEqualTo("Invalid projection configuration");
              assertThat(ex.getBody().getDetail()).isEqualTo("Horizon must be positive");
              assertThat(ex.getBody().getProperties())
                  .containsEntry("code", "NON_POSITIVE_HORIZON");
              assertThat(ex.getError().kind()).isEqualTo(ErrorKind.CONFIGURATION);
            });
  }

  @Test
  void validationFailureThrowsBadRequest() {
    ForecastOutcome<String> outcome =
        ForecastOutcome.failure(ForecastError.validation("SERIES_LENGTH_MISMATCH", "Lengths"));

    assertThatThrownBy(outcome::orElseThrow)
        .isInstanceOfSatisfying(
            ForecastException.class,
            ex -> {
              assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
              assertThat(ex.getBody().getTitle()).isEqualTo("Invalid forecast input");
            });
  }

  @Test
  void successRejectsNullValue() {
    assertThatThrownBy(() -> ForecastOutcome.success(null))
        .isInstanceOf(NullPointerException.class);
  }
}
