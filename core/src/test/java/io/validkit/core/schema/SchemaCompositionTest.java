package io.validkit.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.validkit.core.error.DuplicateFieldException;
import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.ValidationError;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Schema#extend}, {@link Schema#pick}, {@link Schema#omit}, {@link Schema#merge} and {@link Schema#partial}. */
class SchemaCompositionTest {

    private final Schema base = Schema.builder()
            .field("id", "integer")
            .field("name", "string", FieldOptions.options().min(2))
            .optional("email", "string", FieldOptions.options().format("email"))
            .validate((data, errors, ctx) -> {
                if ("root".equals(data.get("name"))) {
                    errors.error("name", "is reserved");
                }
            })
            .build();

    @Test
    void extendAddsFieldsAndKeepsValidators() {
        Schema extended = base.extend(builder -> builder.field("role", "string"));

        assertThat(extended.fieldNames()).containsExactly("id", "name", "email", "role");
        assertThat(extended.validatorCount()).isEqualTo(1);
        assertThat(base.fieldNames()).containsExactly("id", "name", "email");
    }

    @Test
    void extendRejectsRedefinedFields() {
        assertThatThrownBy(() -> base.extend(builder -> builder.field("name", "integer")))
                .isInstanceOf(DuplicateFieldException.class);
    }

    @Test
    void pickKeepsDeclarationOrderAndDropsValidators() {
        Schema picked = base.pick("email", "id");

        assertThat(picked.fieldNames()).containsExactly("id", "email");
        assertThat(picked.validatorCount()).isZero();
    }

    @Test
    void omitRemovesFields() {
        Schema rest = base.omit("email");

        assertThat(rest.fieldNames()).containsExactly("id", "name");
        assertThat(rest.parse(Map.of("id", 1, "name", "Ada", "email", "bad"))).isEqualTo(Map.of("id", 1L, "name", "Ada"));
    }

    @Test
    void pickAndOmitRejectUnknownNames() {
        assertThatThrownBy(() -> base.pick("nope")).isInstanceOf(InvalidFieldConfigException.class)
                .hasMessage("Unknown field 'nope'");
        assertThatThrownBy(() -> base.omit("nope")).isInstanceOf(InvalidFieldConfigException.class);
    }

    @Test
    void mergeLetsTheOtherSchemaWin() {
        Schema other = Schema.builder()
                .field("name", "string", FieldOptions.options().min(5))
                .field("age", "integer")
                .passthrough()
                .validate((data, errors, ctx) -> errors.baseError("always fails"))
                .build();

        Schema merged = base.merge(other);

        assertThat(merged.fieldNames()).containsExactly("id", "name", "email", "age");
        assertThat(merged.validatorCount()).isEqualTo(2);
        assertThat(merged.options().passthrough()).isTrue();
        assertThat(merged.safeParse(Map.of("id", 1, "name", "Ada", "age", 3)).errors().toList())
                .extracting(ValidationError::code)
                .containsExactly(ErrorCode.MIN);
    }

    @Test
    void partialMakesEveryFieldOptional() {
        Schema partial = base.partial();

        assertThat(partial.requiredFields()).isEmpty();
        assertThat(partial.parse(Map.of("name", "Ada"))).isEqualTo(Map.of("name", "Ada"));
        assertThat(partial.safeParse(Map.of("name", "A")).isFailure()).isTrue();
        assertThat(partial.safeParse(Map.of("name", "root")).errors().messages()).containsExactly("is reserved");
    }
}
