package de.netcompliance.infrastructure.transform;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.schibsted.spt.data.jslt.Expression;
import com.schibsted.spt.data.jslt.JsltException;
import com.schibsted.spt.data.jslt.Parser;
import de.netcompliance.core.exception.ExpressionException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

/**
 * Runs JSLT transforms over step data. Scripts are pure functions of their input: the
 * non-deterministic built-ins are rejected at compile time.
 */
public class JsltTransformEngine {

    private static final List<String> NON_DETERMINISTIC_FUNCTIONS = List.of("now", "random", "uuid");
    private static final Pattern FUNCTION_CALL = Pattern.compile("\\b(%s)\\s*\\("
            .formatted(String.join("|", NON_DETERMINISTIC_FUNCTIONS)));

    private final ObjectMapper mapper;
    private final Cache<String, Expression> cache = CacheBuilder.newBuilder()
            .maximumSize(200)
            .build();

    public JsltTransformEngine() {
        this(JsonMapper.builder().findAndAddModules().build());
    }

    public JsltTransformEngine(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws ExpressionException when the script does not compile or calls a non-deterministic function
     */
    public Expression compile(final String script) {
        if (Strings.isNullOrEmpty(script) || script.isBlank()) {
            throw new ExpressionException("Transform script must not be empty");
        }
        var forbidden = FUNCTION_CALL.matcher(script);
        if (forbidden.find()) {
            throw new ExpressionException("Transform scripts must be deterministic; '%s()' is not allowed"
                    .formatted(forbidden.group(1)));
        }
        try {
            return cache.get(script, () -> Parser.compileString(script));
        } catch (ExecutionException | UncheckedExecutionException e) {
            throw new ExpressionException("Failed to compile JSLT script: " + e.getCause().getMessage(), e.getCause());
        }
    }

    public Object transform(final String script, final Object input) {
        var expression = compile(script);
        JsonNode inputNode = mapper.valueToTree(input);
        try {
            var result = expression.apply(Objects.isNull(inputNode) ? mapper.nullNode() : inputNode);
            return toPlain(result);
        } catch (JsltException e) {
            throw new ExpressionException("JSLT evaluation failed: " + e.getMessage(), e);
        }
    }

    private Object toPlain(final JsonNode node) {
        if (Objects.isNull(node) || node.isNull() || node.isMissingNode()) return null;
        if (node.isObject()) return mapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
        if (node.isArray()) return mapper.convertValue(node, new TypeReference<List<Object>>() {});
        if (node.isBoolean()) return node.booleanValue();
        if (node.isIntegralNumber()) return node.longValue();
        if (node.isNumber()) return node.decimalValue();
        return node.asText();
    }
}
