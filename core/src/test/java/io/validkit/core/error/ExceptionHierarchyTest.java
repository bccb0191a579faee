package io.validkit.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.ErrorCollection;
import io.validkit.core.model.ValidationError;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: the two phases, common fields and each concrete type. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void validkitExceptionIsAbstractAndRoot() {
        assertThat(ValidkitException.class).isAbstract();
        assertThat(ValidkitException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void schemaDefinitionExceptionIsAbstract() {
        assertThat(SchemaDefinitionException.class).isAbstract();
        assertThat(SchemaDefinitionException.class.getSuperclass()).isEqualTo(ValidkitException.class);
    }

    // --- Definition-time exceptions ---

    @Test
    void unknownTypeCarriesField() {
        var ex = new UnknownTypeException("money", "price");

        assertThat(ex).isInstanceOf(SchemaDefinitionException.class);
        assertThat(ex.getMessage()).isEqualTo("Unknown type: 'money'");
        assertThat(ex.fieldName()).isEqualTo("price");
        assertThat(ex.phase()).isEqualTo(ValidkitException.Phase.DEFINITION);
    }

    @Test
    void unknownConstraintCarriesName() {
        var ex = new UnknownConstraintException("even", "count");

        assertThat(ex.constraintName()).isEqualTo("even");
        assertThat(ex.detail()).isEqualTo("Unknown constraint: 'even'");
        assertThat(ex.phase()).isEqualTo(ValidkitException.Phase.DEFINITION);
    }

    @Test
    void duplicateFieldNamesTheField() {
        var ex = new DuplicateFieldException("email");

        assertThat(ex).hasMessage("Field 'email' already defined");
        assertThat(ex.fieldName()).isEqualTo("email");
    }

    @Test
    void invalidFieldConfigKeepsCause() {
        var cause = new IllegalArgumentException("negative");
        var ex = new InvalidFieldConfigException("length must not be negative", cause, "code");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.fieldName()).isEqualTo("code");
        assertThat(ex.phase()).isEqualTo(ValidkitException.Phase.DEFINITION);
    }

    @Test
    void schemaParseExceptionCarriesSource() {
        var ex = new SchemaParseException("bad yaml", "name", "/defs/user.yaml");

        assertThat(ex).isInstanceOf(SchemaDefinitionException.class);
        assertThat(ex.source()).isEqualTo("/defs/user.yaml");
        assertThat(ex.fieldName()).isEqualTo("name");
        assertThat(ex.detail()).isEqualTo("bad yaml");
    }

    // --- Validation-time exceptions ---

    @Test
    void validationExceptionJoinsFullMessages() {
        var errors = ErrorCollection.of(
                ValidationError.of(List.of("name"), "is required", ErrorCode.REQUIRED),
                ValidationError.of(List.of("address", "zip"), "must be a string", ErrorCode.TYPE_ERROR));
        var ex = new ValidationException(errors);

        assertThat(ex.phase()).isEqualTo(ValidkitException.Phase.VALIDATION);
        assertThat(ex).hasMessage("Validation failed: name: is required; address.zip: must be a string");
        assertThat(ex.errors()).isSameAs(errors);
    }

    @Test
    void emptyValidationException() {
        assertThat(new ValidationException(ErrorCollection.empty())).hasMessage("Validation failed");
    }

    @Test
    void invalidInputIsValidationPhase() {
        var ex = new InvalidInputException("input must be a map");

        assertThat(ex).isNotInstanceOf(SchemaDefinitionException.class);
        assertThat(ex.phase()).isEqualTo(ValidkitException.Phase.VALIDATION);
    }
}
