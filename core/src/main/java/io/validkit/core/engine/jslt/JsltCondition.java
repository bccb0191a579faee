package io.validkit.core.engine.jslt;

import com.fasterxml.jackson.databind.JsonNode;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import io.validkit.core.engine.JsonValues;
import io.validkit.core.engine.ValueSerializer;
import io.validkit.core.error.InvalidFieldConfigException;
import io.validkit.core.model.ValidationContext;
import io.validkit.core.schema.Condition;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Condition} backed by a JSLT expression, as written in declarative definitions ({@code
 * when: {expr: ".kind == \"company\""}}).
 *
 * <p>The expression sees the schema's input (serialized to JSON) as {@code .} and the call
 * context as {@code $context}. The result is truthy by the same rule as a sibling-field
 * condition: only {@code null} and {@code false} are falsy. An evaluation failure is logged and
 * counts as {@code false}.
 *
 * <p>Thread-safe: the compiled expression is immutable.
 */
public final class JsltCondition implements Condition {

    private static final Logger LOG = LoggerFactory.getLogger(JsltCondition.class);

    private final String source;
    private final Expression expression;

    private JsltCondition(String source, Expression expression) {
        this.source = source;
        this.expression = expression;
    }

    /**
     * Compiles a condition.
     *
     * @param source the JSLT expression
     * @param fieldName the field the condition gates, for error reporting; may be {@code null}
     * @throws InvalidFieldConfigException if the expression does not compile
     */
    public static JsltCondition compile(String source, String fieldName) {
        if (source == null || source.isBlank()) {
            throw new InvalidFieldConfigException("condition expression must not be blank", fieldName);
        }
        try {
            return new JsltCondition(source, Parser.compileString(source));
        } catch (JsltException e) {
            throw new InvalidFieldConfigException(
                    "Failed to compile JSLT condition: " + e.getMessage(), e, fieldName);
        }
    }

    /** The expression text. */
    public String source() {
        return source;
    }

    @Override
    public boolean test(Map<String, Object> data, ValidationContext context) {
        try {
            JsonNode input = ValueSerializer.toJsonNode(data);
            JsonNode result = expression.apply(Map.of("context", ValueSerializer.toJsonNode(context.asMap())), input);
            boolean matched = JsonValues.isTruthy(result);
            LOG.trace("Condition '{}' evaluated to {}", source, matched);
            return matched;
        } catch (JsltException e) {
            LOG.warn("Condition '{}' evaluation failed, treating as false: {}", source, e.getMessage());
            return false;
        }
    }

    @Override
    public String toString() {
        return "JsltCondition[" + source + "]";
    }
}
