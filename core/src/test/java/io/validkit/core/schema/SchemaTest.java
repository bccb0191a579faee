package io.validkit.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.validkit.core.engine.ValueSerializer;
import io.validkit.core.error.DuplicateFieldException;
import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.error.InvalidInputException;
import io.validkit.core.error.UnknownConstraintException;
import io.validkit.core.error.UnknownTypeException;
import io.validkit.core.error.ValidationException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.Result;
import io.validkit.core.model.ValidationContext;
import io.validkit.core.model.ValidationError;
import io.validkit.core.spi.DefaultMessageRenderer;
import io.validkit.core.spi.MessageKey;
import io.validkit.core.type.Coercion;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** End-to-end tests for {@link Schema} parsing. */
class SchemaTest {

    private enum Tag {
        a
    }

    private enum Key {
        name
    }

    private static final Schema USER = Schema.builder()
            .field("name", "string", FieldOptions.options().min(2))
            .optional("age", "integer", FieldOptions.options().min(0))
            .build();

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("coerces a numeric string into an integer")
        void coercesNumericString() {
            Result<Map<String, Object>> result = USER.safeParse(Map.of("name", "Al", "age", "17"));

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.data()).isEqualTo(Map.of("name", "Al", "age", 17L));
        }

        @Test
        @DisplayName("reports a too-short name as one min error")
        void reportsMinError() {
            Result<Map<String, Object>> result = USER.safeParse(Map.of("name", "A"));

            assertThat(result.isFailure()).isTrue();
            assertThat(result.errors().toList()).singleElement().satisfies(error -> {
                assertThat(error.path()).containsExactly("name");
                assertThat(error.code()).isEqualTo(ErrorCode.MIN);
                assertThat(error.message()).isEqualTo("length must be at least 2 (got 1)");
            });
        }

        @Test
        @DisplayName("fills a missing field from its default")
        void appliesDefault() {
            Schema schema = Schema.builder()
                    .field("role", "string", FieldOptions.options().enumOf("admin", "user").defaultValue("user"))
                    .build();

            assertThat(schema.parse(Map.of())).isEqualTo(Map.of("role", "user"));
        }

        @Test
        @DisplayName("stringifies enum constants and numbers in a string array")
        void coercesArrayItems() {
            Schema schema = Schema.builder().field("tags", "array", FieldOptions.options().of("string")).build();

            assertThat(schema.parse(Map.of("tags", List.of(Tag.a, 1, "b"))))
                    .isEqualTo(Map.of("tags", List.of("a", "1", "b")));
        }

        @Test
        @DisplayName("rejects a malformed email with one format error")
        void rejectsMalformedEmail() {
            Schema schema = Schema.builder().field("email", "string", FieldOptions.options().format("email")).build();

            Result<Map<String, Object>> result = schema.safeParse(Map.of("email", "not-an-email"));

            assertThat(result.errors().toList()).singleElement().satisfies(error -> {
                assertThat(error.code()).isEqualTo(ErrorCode.FORMAT);
                assertThat(error.path()).containsExactly("email");
            });
        }
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        void everyInvalidFieldIsReported() {
            Schema schema = Schema.builder()
                    .field("a", "integer")
                    .field("b", "boolean")
                    .field("c", "date")
                    .field("d", "string")
                    .build();

            Result<Map<String, Object>> result = schema.safeParse(Map.of("a", "x", "b", "maybe", "c", "never"));

            assertThat(result.errors().toList()).extracting(ValidationError::fullPath).containsExactly("a", "b", "c", "d");
            assertThat(result.errors().toList()).extracting(ValidationError::code).containsExactly(
                    ErrorCode.TYPE_ERROR, ErrorCode.TYPE_ERROR, ErrorCode.TYPE_ERROR, ErrorCode.REQUIRED);
        }

        @Test
        void multipleConstraintErrorsOnOneField() {
            Schema schema = Schema.builder()
                    .field("code", "string", FieldOptions.options().min(5).format("numeric"))
                    .build();

            assertThat(schema.safeParse(Map.of("code", "ab")).errors().toList())
                    .extracting(ValidationError::code)
                    .containsExactly(ErrorCode.MIN, ErrorCode.FORMAT);
        }

        @Test
        void arrayOfObjectsReportsTheElementPath() {
            Schema city = Schema.builder().field("city", "string").build();
            Schema schema = Schema.builder().field("field", "array", FieldOptions.options().of(city)).build();

            Result<Map<String, Object>> result = schema.safeParse(Map.of("field", List.of(Map.of(), Map.of("city", "X"))));

            assertThat(result.errors().toList()).singleElement()
                    .satisfies(error -> assertThat(error.path()).containsExactly("field", 0, "city"));
        }

        @Test
        void nestedObjectPathsAreAbsolute() {
            Schema address = Schema.builder().field("zip", "string", FieldOptions.options().length(5)).build();
            Schema schema = Schema.builder()
                    .field("user", "object", FieldOptions.options().schema(Schema.builder()
                            .field("addresses", "array", FieldOptions.options().of(address))
                            .build()))
                    .build();

            var result = schema.safeParse(Map.of("user", Map.of("addresses", List.of(Map.of("zip", "123")))));

            assertThat(result.errors().first().fullPath()).isEqualTo("user.addresses.0.zip");
        }

        @Test
        void reparsingDumpedOutputIsStable() {
            Schema schema = Schema.builder()
                    .field("price", "decimal")
                    .field("on", "date")
                    .field("count", "integer")
                    .field("ratio", "float")
                    .field("tags", "array", FieldOptions.options().of("string"))
                    .build();

            Map<String, Object> first = schema.parse(
                    Map.of("price", "19.90", "on", "2024-02-29", "count", 3, "ratio", 0.5, "tags", List.of(Tag.a)));
            Map<String, Object> second = schema.parse(schema.dump(first));

            assertThat(second).isEqualTo(first);
        }

        @Test
        void outputNeverContainsInternalMarkers() {
            Schema schema = Schema.builder()
                    .optional("maybe", "integer")
                    .field("when", "string", FieldOptions.options().when("flag"))
                    .optional("nick", "string", FieldOptions.options().nullable())
                    .optional("flag", "boolean")
                    .build();

            Map<String, Object> data = schema.parse(Map.of());

            assertThat(data).isEmpty();
            assertThat(data.values()).allSatisfy(value -> assertThat(value)
                    .isNotInstanceOf(RawValue.class)
                    .isNotInstanceOf(Coercion.class));
        }

        @Test
        void outputIsImmutable() {
            Map<String, Object> data = USER.parse(Map.of("name", "Ada"));

            assertThatThrownBy(() -> data.put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Input handling")
    class InputHandling {

        @Test
        void enumKeysAddressTheSameField() {
            Map<Object, Object> input = new HashMap<>();
            input.put(Key.name, "Ada");

            assertThat(USER.parse(input)).isEqualTo(Map.of("name", "Ada"));
        }

        @Test
        void nullInputIsAnEmptyMap() {
            assertThat(USER.safeParse((Object) null).errors().toList())
                    .extracting(ValidationError::code)
                    .containsExactly(ErrorCode.REQUIRED);
        }

        @Test
        void nonMapInputIsACallerError() {
            assertThatThrownBy(() -> USER.safeParse(List.of("name")))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageStartingWith("Expected a key-value map, got");
        }

        @Test
        void jsonObjectsAreAccepted() throws Exception {
            var node = new ObjectMapper().readTree("{\"name\": \"Ada\", \"age\": 36}");

            assertThat(USER.parse(node)).isEqualTo(Map.of("name", "Ada", "age", 36L));
        }

        @Test
        void jsonNonObjectsAreRejected() throws Exception {
            var node = new ObjectMapper().readTree("[1, 2]");

            assertThatThrownBy(() -> USER.safeParse(node))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessage("Expected a JSON object, got ARRAY");
        }

        @Test
        void outOfRangeEpochIsATypeError() {
            Schema schema = Schema.builder().field("on", "date").field("at", "datetime").build();

            var result = schema.safeParse(Map.of("on", Long.MAX_VALUE, "at", 31556889864403199L));

            assertThat(result.errors().toList())
                    .extracting(ValidationError::fullPath, ValidationError::code)
                    .containsExactly(tuple("on", ErrorCode.TYPE_ERROR), tuple("at", ErrorCode.TYPE_ERROR));
        }

        @Test
        void jsonIntegerSelectsAnIntegerDiscriminator() throws Exception {
            Schema v1 = Schema.builder().field("kind", "integer").field("x", "string").build();
            Schema schema = Schema.builder()
                    .field("v", "discriminated_union", FieldOptions.options().discriminator("kind", Map.of(1, v1)))
                    .build();
            var node = new ObjectMapper().readTree("{\"v\": {\"kind\": 1, \"x\": \"hi\"}}");

            assertThat(schema.parse(node)).isEqualTo(Map.of("v", Map.of("kind", 1L, "x", "hi")));
        }

        @Test
        void unknownKeysAreDroppedByDefault() {
            assertThat(USER.parse(Map.of("name", "Ada", "admin", true))).doesNotContainKey("admin");
        }

        @Test
        void passthroughKeepsUnknownKeys() {
            Schema schema = Schema.builder().field("name", "string").passthrough().build();

            assertThat(schema.parse(Map.of("name", "Ada", "admin", true)))
                    .isEqualTo(Map.of("name", "Ada", "admin", true));
        }

        @Test
        void strictIsOnlyASignal() {
            Schema schema = Schema.builder().field("name", "string").strict().build();

            assertThat(schema.options().strict()).isTrue();
            assertThat(schema.parse(Map.of("name", "Ada", "admin", true))).isEqualTo(Map.of("name", "Ada"));
        }
    }

    @Nested
    @DisplayName("Concurrent use")
    class ConcurrentUse {

        @Test
        void sharedSchemaParsesInParallel() throws Exception {
            Schema schema = Schema.builder()
                    .field("id", "integer", FieldOptions.options().min(0))
                    .field("tags", "array", FieldOptions.options().of("string").length(Map.of("max", 3)))
                    .optional("on", "date")
                    .build();
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<Result<Map<String, Object>>>> futures = new ArrayList<>();
                for (int i = 0; i < 400; i++) {
                    int id = i % 2 == 0 ? i : -i;
                    futures.add(executor.submit(() -> schema.safeParse(
                            Map.of("id", String.valueOf(id), "tags", List.of(id, "t"), "on", "2024-01-01"))));
                }

                for (int i = 0; i < futures.size(); i++) {
                    Result<Map<String, Object>> result = futures.get(i).get(10, TimeUnit.SECONDS);
                    if (i % 2 == 0) {
                        assertThat(result.data())
                                .containsEntry("id", (long) i)
                                .containsEntry("tags", List.of(String.valueOf(i), "t"))
                                .containsEntry("on", LocalDate.of(2024, 1, 1));
                    } else {
                        assertThat(result.errors().toList())
                                .singleElement()
                                .extracting(ValidationError::fullPath, ValidationError::code)
                                .containsExactly("id", ErrorCode.MIN);
                    }
                }
            } finally {
                executor.shutdown();
            }
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        void throwsWithTheCompleteErrorCollection() {
            assertThatThrownBy(() -> USER.parse(Map.of("age", -1)))
                    .isInstanceOfSatisfying(ValidationException.class, e -> {
                        assertThat(e.errors().size()).isEqualTo(2);
                        assertThat(e.errors().toMap()).containsOnlyKeys("name", "age");
                        assertThat(e).hasMessage("Validation failed: name: is required; age: must be at least 0");
                    });
        }

        @Test
        void dumpSerializesTheData() {
            Schema schema = Schema.builder().field("price", "decimal").field("on", "date").build();

            assertThat(schema.dump(Map.of("price", new BigDecimal("1.50"), "on", LocalDate.of(2024, 1, 2))))
                    .isEqualTo(Map.of("price", "1.50", "on", "2024-01-02"));
            assertThat(ValueSerializer.dump(schema.safeDump(Map.of())))
                    .isEqualTo(Map.of("errors", List.of(
                            Map.of("path", List.of("price"), "message", "is required", "code", "required"),
                            Map.of("path", List.of("on"), "message", "is required", "code", "required"))));
        }
    }

    @Nested
    @DisplayName("Definition errors")
    class DefinitionErrors {

        @Test
        void unknownTypeFailsAtBuildTime() {
            assertThatThrownBy(() -> Schema.builder().field("price", "money"))
                    .isInstanceOf(UnknownTypeException.class);
        }

        @Test
        void unknownConstraintFailsAtBuildTime() {
            assertThatThrownBy(() -> Schema.builder().field("n", "integer", FieldOptions.options().constraint("even", true)))
                    .isInstanceOf(UnknownConstraintException.class);
        }

        @Test
        void duplicateFieldFailsAtBuildTime() {
            assertThatThrownBy(() -> Schema.builder().field("name", "string").field("name", "integer"))
                    .isInstanceOf(DuplicateFieldException.class)
                    .hasMessage("Field 'name' already defined");
        }

        @Test
        void nonNumericBoundOnAStringFailsAtBuildTime() {
            assertThatThrownBy(() -> Schema.builder().field("code", "string", FieldOptions.options().min("a")))
                    .isInstanceOfSatisfying(InvalidFieldConfigException.class, e -> {
                        assertThat(e).hasMessage("min bound for type 'string' must be a number, got String");
                        assertThat(e.fieldName()).isEqualTo("code");
                    });
            assertThatThrownBy(() -> Schema.builder().field("n", "integer", FieldOptions.options().max("9")))
                    .isInstanceOf(InvalidFieldConfigException.class)
                    .hasMessage("max bound for type 'integer' must be a number, got String");
        }

        @Test
        void comparableBoundsStayAllowedForOtherTypes() {
            Schema schema = Schema.builder()
                    .field("on", "date", FieldOptions.options().min(LocalDate.of(2024, 1, 1)))
                    .build();

            assertThat(schema.safeParse(Map.of("on", "2023-12-31")).errors().first().code()).isEqualTo(ErrorCode.MIN);
            assertThat(schema.parse(Map.of("on", "2024-01-02"))).containsEntry("on", LocalDate.of(2024, 1, 2));
        }
    }

    @Nested
    @DisplayName("Context and messages")
    class ContextAndMessages {

        @Test
        void contextReachesCallbacks() {
            Schema schema = Schema.builder()
                    .field("amount", "integer", FieldOptions.options()
                            .refineWithContext((value, ctx) -> ((Long) value) <= (Integer) ctx.get("limit"),
                                    "exceeds limit"))
                    .build();

            assertThat(schema.safeParse(Map.of("amount", 5), ValidationContext.of("limit", 10)).isSuccess()).isTrue();
            assertThat(schema.safeParse(Map.of("amount", 50), ValidationContext.of("limit", 10)).errors().messages())
                    .containsExactly("exceeds limit");
        }

        @Test
        void rendererOverridesApplyToNestedSchemas() {
            Schema inner = Schema.builder().field("zip", "string").build();
            Schema schema = Schema.builder()
                    .field("address", inner)
                    .messages(DefaultMessageRenderer.INSTANCE.withOverride(MessageKey.REQUIRED, "fehlt"))
                    .build();

            assertThat(schema.safeParse(Map.of("address", new LinkedHashMap<>())).errors().fullMessages())
                    .containsExactly("address.zip: fehlt");
        }
    }
}
