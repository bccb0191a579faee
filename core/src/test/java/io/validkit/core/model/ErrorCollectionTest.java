package io.validkit.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ErrorCollection} and {@link ValidationError}. */
@DisplayName("ErrorCollection")
class ErrorCollectionTest {

    private final ValidationError nameRequired =
            ValidationError.of(List.of("name"), "is required", ErrorCode.REQUIRED);
    private final ValidationError zipFormat =
            ValidationError.of(List.of("user", "addresses", 0, "zip"), "must be a valid numeric", ErrorCode.FORMAT);
    private final ValidationError zipLength =
            ValidationError.of(List.of("user", "addresses", 0, "zip"), "length must be exactly 5 (got 3)", ErrorCode.LENGTH);
    private final ValidationError base = ValidationError.of(List.of(), "passwords differ", ErrorCode.CUSTOM);

    @Test
    void fullPathJoinsSegmentsWithDots() {
        assertThat(zipFormat.fullPath()).isEqualTo("user.addresses.0.zip");
        assertThat(zipFormat.toString()).isEqualTo("user.addresses.0.zip: must be a valid numeric");
        assertThat(base.toString()).isEqualTo("passwords differ");
    }

    @Test
    void errorsAreStructurallyEqual() {
        ValidationError copy = ValidationError.of(List.of("name"), "is required", ErrorCode.of("required"));

        assertThat(copy).isEqualTo(nameRequired).hasSameHashCodeAs(nameRequired);
    }

    @Test
    void pathSegmentsMustBeKeysOrIndexes() {
        assertThatThrownBy(() -> ValidationError.of(List.of("a", 1.5), "bad", ErrorCode.MIN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withPathPrefixPrependsSegments() {
        ValidationError nested = nameRequired.withPathPrefix(List.of("users", 2));

        assertThat(nested.path()).containsExactly("users", 2, "name");
        assertThat(nested.code()).isEqualTo(ErrorCode.REQUIRED);
    }

    @Test
    void toMapGroupsMessagesByDottedPath() {
        ErrorCollection errors = ErrorCollection.of(nameRequired, zipFormat, zipLength, base);

        Map<String, List<String>> grouped = errors.toMap();

        assertThat(grouped).containsOnlyKeys("name", "user.addresses.0.zip", "");
        assertThat(grouped.get("user.addresses.0.zip"))
                .containsExactly("must be a valid numeric", "length must be exactly 5 (got 3)");
    }

    @Test
    void forPathFiltersByPrefix() {
        ErrorCollection errors = ErrorCollection.of(nameRequired, zipFormat, zipLength);

        assertThat(errors.forPath("user", "addresses", 0).toList()).containsExactly(zipFormat, zipLength);
        assertThat(errors.forPath("user", "addresses", 1).isEmpty()).isTrue();
    }

    @Test
    void addAndMergeReturnNewCollections() {
        ErrorCollection original = ErrorCollection.of(nameRequired);

        ErrorCollection added = original.add(zipFormat);
        ErrorCollection merged = added.merge(ErrorCollection.of(base));

        assertThat(original.size()).isEqualTo(1);
        assertThat(added.size()).isEqualTo(2);
        assertThat(merged.toList()).containsExactly(nameRequired, zipFormat, base);
    }

    @Test
    void fullMessagesIncludePaths() {
        ErrorCollection errors = ErrorCollection.of(nameRequired, base);

        assertThat(errors.messages()).containsExactly("is required", "passwords differ");
        assertThat(errors.fullMessages()).containsExactly("name: is required", "passwords differ");
        assertThat(errors.first()).isEqualTo(nameRequired);
    }
}
