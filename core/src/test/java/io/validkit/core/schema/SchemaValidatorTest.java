package io.validkit.core.schema;

import static org.assertj.core.api.Assertions.assertThat;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.ValidationError;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/** Tests for cross-field {@link SchemaValidator}s. */
class SchemaValidatorTest {

    private static final SchemaValidator PASSWORDS_MATCH = (data, errors, ctx) -> {
        if (!data.get("password").equals(data.get("confirmation"))) {
            errors.error("confirmation", "does not match password");
        }
    };

    @Test
    void validatorSeesCoercedDataAndReportsCustomErrors() {
        Schema schema = Schema.builder()
                .field("password", "string")
                .field("confirmation", "string")
                .validate(PASSWORDS_MATCH)
                .build();

        var result = schema.safeParse(Map.of("password", "secret1", "confirmation", "secret2"));

        assertThat(result.errors().toList()).singleElement().satisfies(error -> {
            assertThat(error.path()).containsExactly("confirmation");
            assertThat(error.code()).isEqualTo(ErrorCode.CUSTOM);
            assertThat(error.message()).isEqualTo("does not match password");
        });
    }

    @Test
    void validatorsRunOnlyWhenEveryFieldPassed() {
        var calls = new AtomicInteger();
        Schema schema = Schema.builder()
                .field("start", "integer")
                .field("end", "integer")
                .validate((data, errors, ctx) -> calls.incrementAndGet())
                .build();

        schema.safeParse(Map.of("start", "x"));

        assertThat(calls).hasValue(0);
    }

    @Test
    void everyValidatorRunsAndErrorsAccumulate() {
        Schema schema = Schema.builder()
                .field("start", "integer")
                .field("end", "integer")
                .validate((data, errors, ctx) -> {
                    if ((Long) data.get("start") > (Long) data.get("end")) {
                        errors.error("end", "must not be before start");
                    }
                })
                .validate((data, errors, ctx) -> errors.baseError("range is closed"))
                .build();

        var result = schema.safeParse(Map.of("start", 5, "end", 1));

        assertThat(result.errors().toList()).extracting(ValidationError::fullPath).containsExactly("end", "");
    }

    @Test
    void nestedValidatorErrorsArePrefixed() {
        Schema range = Schema.builder()
                .field("from", "integer")
                .field("to", "integer")
                .validate((data, errors, ctx) -> errors.baseError("empty range"))
                .build();
        Schema schema = Schema.builder().field("window", range).build();

        var result = schema.safeParse(Map.of("window", Map.of("from", 1, "to", 2)));

        assertThat(result.errors().first().path()).isEqualTo(List.of("window"));
    }
}
