package io.validkit.core.type;

import io.validkit.core.schema.Schema;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural configuration handed to a {@link io.validkit.core.spi.TypeFactory}. Scalar types
 * ignore it.
 *
 * @param of array item type: a registered type name, a {@link FieldType} or a {@link Schema}
 * @param schema nested object schema
 * @param discriminator discriminator field name for discriminated unions
 * @param mapping discriminator value to schema
 * @param members union members, each a type name or a {@link FieldType}
 * @param literals accepted literal values
 */
public record TypeOptions(
        Object of,
        Schema schema,
        String discriminator,
        Map<Object, Schema> mapping,
        List<Object> members,
        List<Object> literals) {

    private static final TypeOptions NONE = new TypeOptions(null, null, null, null, null, null);

    public TypeOptions {
        mapping = mapping != null ? Collections.unmodifiableMap(new LinkedHashMap<>(mapping)) : null;
        members = members != null ? Collections.unmodifiableList(new ArrayList<>(members)) : null;
        literals = literals != null ? Collections.unmodifiableList(new ArrayList<>(literals)) : null;
    }

    /** No structural configuration. */
    public static TypeOptions none() {
        return NONE;
    }

    public TypeOptions withOf(Object itemType) {
        return new TypeOptions(itemType, schema, discriminator, mapping, members, literals);
    }

    public TypeOptions withSchema(Schema nested) {
        return new TypeOptions(of, nested, discriminator, mapping, members, literals);
    }

    public TypeOptions withDiscriminator(String field, Map<?, Schema> schemas) {
        return new TypeOptions(of, schema, field, schemas != null ? new LinkedHashMap<Object, Schema>(schemas) : null,
                members, literals);
    }

    public TypeOptions withMembers(List<?> types) {
        return new TypeOptions(of, schema, discriminator, mapping, types != null ? new ArrayList<Object>(types) : null,
                literals);
    }

    public TypeOptions withLiterals(List<?> values) {
        return new TypeOptions(of, schema, discriminator, mapping, members,
                values != null ? new ArrayList<Object>(values) : null);
    }
}
