package io.validkit.core.constraint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link FormatConstraint} and {@link NamedFormat}. */
class FormatConstraintTest {

    private static final EvaluationScope SCOPE = EvaluationScope.defaults();

    @Nested
    @DisplayName("Named formats")
    class Named {

        @ParameterizedTest(name = "{0} accepts \"{1}\": {2}")
        @CsvSource({
            "email, user@example.com, true",
            "email, USER+tag@Example.ORG, true",
            "email, user@, false",
            "email, not an email, false",
            "url, https://example.com/path?q=1, true",
            "url, ftp://example.com, false",
            "uuid, 123E4567-e89b-12d3-a456-426614174000, true",
            "uuid, 123e4567-e89b-12d3-a456, false",
            "phone, +1 (555) 123-4567, true",
            "phone, 12345, false",
            "alphanumeric, abc123, true",
            "alphanumeric, abc-123, false",
            "alpha, abc, true",
            "alpha, abc1, false",
            "numeric, 007, true",
            "numeric, 7.0, false",
            "hex, DEADbeef, true",
            "hex, xyz, false",
            "slug, my-first-post, true",
            "slug, My-Post, false",
            "slug, double--dash, false"
        })
        void matchesWholeValue(String format, String value, boolean expected) {
            assertThat(FormatConstraint.fromConfig(format).isValid(value)).isEqualTo(expected);
        }

        @Test
        void anchorsRejectTrailingLines() {
            assertThat(FormatConstraint.fromConfig("numeric").isValid("123\nabc")).isFalse();
        }

        @Test
        void lookupIsCaseInsensitive() {
            assertThat(NamedFormat.lookup("EMAIL")).contains(NamedFormat.EMAIL);
            assertThat(NamedFormat.lookup("zip")).isEmpty();
        }

        @Test
        void unknownNameListsAvailableFormats() {
            assertThatThrownBy(() -> FormatConstraint.fromConfig("zip"))
                    .isInstanceOf(InvalidFieldConfigException.class)
                    .hasMessageStartingWith("Unknown format: zip. Available: email, url, uuid");
        }

        @Test
        void messageNamesTheFormat() {
            var constraint = FormatConstraint.fromConfig(NamedFormat.EMAIL);

            assertThat(constraint.errorMessage("x", SCOPE)).isEqualTo("must be a valid email");
            assertThat(constraint.errorCode()).isEqualTo(ErrorCode.FORMAT);
            assertThat(constraint.options()).containsEntry("name", "email");
        }
    }

    @Nested
    @DisplayName("Caller patterns")
    class Custom {

        @Test
        void matchAnywhereUnlessAnchored() {
            assertThat(new FormatConstraint(Pattern.compile("\\d{3}")).isValid("abc123def")).isTrue();
            assertThat(new FormatConstraint(Pattern.compile("^\\d{3}$")).isValid("abc123def")).isFalse();
        }

        @Test
        void nonStringsFail() {
            assertThat(new FormatConstraint(Pattern.compile("\\d+")).isValid(123)).isFalse();
        }

        @Test
        void messageShowsThePattern() {
            var constraint = new FormatConstraint(Pattern.compile("^[A-Z]{2}$"));

            assertThat(constraint.errorMessage("abc", SCOPE)).isEqualTo("must match format /^[A-Z]{2}$/");
            assertThat(constraint.namedFormat()).isNull();
        }

        @Test
        void rejectsOtherConfigs() {
            assertThatThrownBy(() -> FormatConstraint.fromConfig(42)).isInstanceOf(InvalidFieldConfigException.class);
        }
    }
}
