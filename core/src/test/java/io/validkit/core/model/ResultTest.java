package io.validkit.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link Result} combinators. */
@DisplayName("Result")
class ResultTest {

    private static final ErrorCollection ERRORS =
            ErrorCollection.of(ValidationError.of(List.of("name"), "is required", ErrorCode.REQUIRED));

    @Nested
    @DisplayName("Success")
    class SuccessVariant {

        @Test
        void exposesData() {
            Result<String> result = Result.success("ok");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isFailure()).isFalse();
            assertThat(result.data()).isEqualTo("ok");
            assertThat(result.errors().isEmpty()).isTrue();
        }

        @Test
        void mapAndFlatMapApplyFunction() {
            Result<Integer> mapped = Result.success("abc").map(String::length);
            Result<Integer> chained = mapped.flatMap(n -> Result.success(n * 2));

            assertThat(mapped.data()).isEqualTo(3);
            assertThat(chained.data()).isEqualTo(6);
        }

        @Test
        void valueOrReturnsData() {
            assertThat(Result.success("ok").valueOr("fallback")).isEqualTo("ok");
            assertThat(Result.success("ok").valueOrGet(errors -> "fallback")).isEqualTo("ok");
        }

        @Test
        void flatMapCanTurnIntoFailure() {
            Result<String> result = Result.success("x").flatMap(x -> Result.failure(ERRORS));

            assertThat(result.isFailure()).isTrue();
            assertThat(result.errors()).isEqualTo(ERRORS);
        }
    }

    @Nested
    @DisplayName("Failure")
    class FailureVariant {

        @Test
        void exposesErrorsAndNoData() {
            Result<String> result = Result.failure(ERRORS);

            assertThat(result.isFailure()).isTrue();
            assertThat(result.data()).isNull();
            assertThat(result.errors().size()).isEqualTo(1);
        }

        @Test
        void mapDoesNotRunFunction() {
            AtomicBoolean called = new AtomicBoolean();
            Result<String> failure = Result.failure(ERRORS);

            Result<Integer> mapped = failure.map(s -> {
                called.set(true);
                return s.length();
            });
            Result<Integer> chained = failure.flatMap(s -> {
                called.set(true);
                return Result.success(1);
            });

            assertThat(called).isFalse();
            assertThat(mapped.errors()).isEqualTo(ERRORS);
            assertThat(chained.errors()).isEqualTo(ERRORS);
        }

        @Test
        void valueOrReturnsFallback() {
            Result<String> failure = Result.failure(ERRORS);

            assertThat(failure.valueOr("fallback")).isEqualTo("fallback");
            assertThat(failure.valueOrGet(errors -> "errors: " + errors.size())).isEqualTo("errors: 1");
        }
    }
}
