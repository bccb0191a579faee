package io.validkit.core.type;

import io.validkit.core.model.ErrorCode;
import io.validkit.core.model.EvaluationScope;
import io.validkit.core.model.ValidationError;
import io.validkit.core.spi.MessageKey;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Accepts a value matching any member type. Members are tried in declaration order and the first
 * full success wins. When every member fails, member errors are discarded and a single {@code
 * union_type_error} naming all members is reported.
 */
public final class UnionType extends FieldType {

    private final List<FieldType> members;

    public UnionType(List<FieldType> members) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("union requires at least one member type");
        }
        this.members = List.copyOf(members);
    }

    /** Member types in trial order. */
    public List<FieldType> members() {
        return members;
    }

    @Override
    public TypeKind kind() {
        return TypeKind.UNION;
    }

    @Override
    public String typeName() {
        return "union<" + String.join(" | ", memberNames()) + ">";
    }

    @Override
    public Coercion coerce(Object value) {
        for (FieldType member : members) {
            Coercion coercion = member.coerce(value);
            if (!coercion.isFailed()) {
                return coercion;
            }
        }
        return Coercion.failed();
    }

    @Override
    public boolean isValid(Object value) {
        return members.stream().anyMatch(member -> member.isValid(value));
    }

    @Override
    public Evaluation evaluate(Object value, List<Object> path, EvaluationScope scope) {
        for (FieldType member : members) {
            Evaluation attempt = member.evaluate(value, path, scope);
            if (attempt.isValid()) {
                return attempt;
            }
        }
        String message = scope.messages().render(MessageKey.UNION, Map.of("types", String.join(", ", memberNames())));
        return Evaluation.failed(ValidationError.of(path, message, ErrorCode.UNION_TYPE_ERROR));
    }

    private List<String> memberNames() {
        return members.stream().map(FieldType::typeName).collect(Collectors.toList());
    }
}
