package io.validkit.core.constraint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link EnumConstraint}. */
class EnumConstraintTest {

    @Test
    void acceptsListedValues() {
        var constraint = EnumConstraint.fromConfig(List.of("admin", "user"));

        assertThat(constraint.isValid("admin")).isTrue();
        assertThat(constraint.isValid("root")).isFalse();
    }

    @Test
    void numbersCompareByValue() {
        var constraint = EnumConstraint.fromConfig(new Object[] {1, 2, 3});

        assertThat(constraint.isValid(2L)).isTrue();
        assertThat(constraint.isValid(3.0)).isTrue();
        assertThat(constraint.isValid("2")).isFalse();
    }

    @Test
    void messageListsAllowedValues() {
        var constraint = new EnumConstraint(List.of("admin", "user"));

        var errors = constraint.evaluate("root", List.of("role"), EvaluationScope.defaults());

        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.message()).isEqualTo("must be one of: \"admin\", \"user\"");
            assertThat(error.code()).isEqualTo(ErrorCode.ENUM);
        });
    }

    @Test
    void emptyListIsAConfigurationError() {
        assertThatThrownBy(() -> new EnumConstraint(List.of())).isInstanceOf(InvalidFieldConfigException.class);
        assertThatThrownBy(() -> EnumConstraint.fromConfig("admin")).isInstanceOf(InvalidFieldConfigException.class);
    }
}
