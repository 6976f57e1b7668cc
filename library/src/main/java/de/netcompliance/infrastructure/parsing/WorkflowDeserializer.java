package de.netcompliance.infrastructure.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.netcompliance.core.model.ExecutionMode;
import de.netcompliance.core.model.OnError;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.Workflow;
import de.netcompliance.core.model.WorkflowSettings;
import de.netcompliance.core.model.payload.StepPayload;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a workflow document onto the model. Step payload keys sit next to the common step keys;
 * the step {@code type} decides which payload class receives them.
 */
@SuppressWarnings("java:S1192") // magic strings
public class WorkflowDeserializer {

    protected static final Set<String> ROOT_KEYS = new LinkedHashSet<>(List.of(
            "name", "description", "execution_mode", "variables", "settings", "steps", "completion_criteria"
    ));
    protected static final Set<String> SETTINGS_KEYS = new LinkedHashSet<>(List.of(
            "max_parallel"
    ));
    protected static final Set<String> STEP_KEYS = new LinkedHashSet<>(List.of(
            "name", "type", "description", "output_var", "depends_on", "condition",
            "retry_count", "max_retries", "retry_delay", "timeout", "on_error"
    ));
    protected static final Map<StepType, Set<String>> PAYLOAD_KEYS = new EnumMap<>(StepType.class);
    // older definitions prefix api_call keys
    protected static final Map<String, String> API_CALL_ALIASES = Map.of(
            "api_url", "url",
            "api_method", "method",
            "api_headers", "headers",
            "api_body", "body",
            "api_params", "params",
            "api_auth", "auth"
    );

    static {
        PAYLOAD_KEYS.put(StepType.QUERY, Set.of("path", "xpath", "filter", "filter_xml", "vendor_specific"));
        PAYLOAD_KEYS.put(StepType.TEMPLATE, Set.of("template", "template_vars", "format", "vendor_specific"));
        PAYLOAD_KEYS.put(StepType.AUDIT, Set.of("compare", "operator", "fields", "pass_threshold", "fail_on_mismatch"));
        PAYLOAD_KEYS.put(StepType.REMEDIATE, Set.of("config_source", "rollback_on_error", "vendor_specific"));
        PAYLOAD_KEYS.put(StepType.TRANSFORM, Set.of("script", "input"));
        PAYLOAD_KEYS.put(StepType.API_CALL, Set.of("method", "url", "headers", "params", "body", "auth"));
        PAYLOAD_KEYS.put(StepType.NOTIFICATION, Set.of("subject", "message", "channels"));
    }

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public WorkflowParseResult deserialize(final JsonNode node, final String path, final WorkflowParseOptions options) {
        var result = new WorkflowParseResult();
        var parseResult = new ParseResult();
        parseResult.setAllowEmptyStrings(options.isAllowEmptyStrings());
        parseResult.setStrict(options.isStrict());
        try {
            var workflow = parseRoot(node, parseResult);
            result.setWorkflow(workflow);
        } catch (Exception e) {
            var message = StringUtils.isNotBlank(e.getMessage()) ? e.getMessage() : "Unexpected error de-serialising workflow";
            parseResult.error("", Objects.isNull(path) ? message : "%s (%s)".formatted(message, path));
        }
        result.setMessages(parseResult.getMessages());
        result.setWarnings(parseResult.getWarnings());
        result.setInvalid(parseResult.isInvalid());
        return result;
    }

    public Workflow parseRoot(final JsonNode rootNode, final ParseResult parseResult) {
        if (!JsonNodeType.OBJECT.equals(rootNode.getNodeType())) {
            parseResult.error("", "workflow document must be an object");
            return null;
        }
        var node = (ObjectNode) rootNode;
        var location = "";
        var workflow = new Workflow();

        workflow.setName(getString("name", node, true, location, parseResult));
        workflow.setDescription(getString("description", node, false, location, parseResult));

        var mode = getString("execution_mode", node, false, location, parseResult);
        if (Objects.nonNull(mode)) {
            try {
                workflow.setExecutionMode(ExecutionMode.of(mode));
            } catch (IllegalArgumentException e) {
                parseResult.error(location, "invalid execution_mode '%s'".formatted(mode));
            }
        }

        var variables = getObject("variables", node, false, location, parseResult);
        if (Objects.nonNull(variables)) {
            workflow.setVariables(MAPPER.convertValue(variables, new TypeReference<LinkedHashMap<String, Object>>() {}));
        }

        var settings = getObject("settings", node, false, location, parseResult);
        if (Objects.nonNull(settings)) {
            workflow.setSettings(getSettings(settings, "settings", parseResult));
        }

        var steps = getArray("steps", node, true, location, parseResult);
        if (Objects.nonNull(steps)) {
            var parsed = new ArrayList<Step>();
            for (int i = 0; i < steps.size(); i++) {
                var stepLocation = "steps[%d]".formatted(i);
                var stepNode = steps.get(i);
                if (!stepNode.isObject()) {
                    parseResult.invalidType(stepLocation, "", "object");
                    continue;
                }
                var step = getStep((ObjectNode) stepNode, stepLocation, parseResult);
                if (Objects.nonNull(step)) parsed.add(step);
            }
            workflow.setSteps(parsed);
        }

        reportUnexpectedKeys(node, ROOT_KEYS, location, parseResult);
        return workflow;
    }

    private WorkflowSettings getSettings(final ObjectNode node, final String location, final ParseResult parseResult) {
        var settings = new WorkflowSettings();
        settings.setMaxParallel(getInteger("max_parallel", node, false, location, parseResult));
        reportUnexpectedKeys(node, SETTINGS_KEYS, location, parseResult);
        return settings;
    }

    public Step getStep(final ObjectNode node, final String location, final ParseResult parseResult) {
        var step = new Step();
        var name = getString("name", node, true, location, parseResult);
        var stepLocation = Objects.isNull(name) ? location : "%s(%s)".formatted(location, name);
        step.setName(name);
        step.setDescription(getString("description", node, false, stepLocation, parseResult));
        step.setOutputVar(getString("output_var", node, false, stepLocation, parseResult));
        step.setCondition(getString("condition", node, false, stepLocation, parseResult));

        var dependsOn = getArray("depends_on", node, false, stepLocation, parseResult);
        if (Objects.nonNull(dependsOn)) {
            var dependencies = new ArrayList<String>();
            dependsOn.forEach(dependency -> {
                if (dependency.isTextual()) {
                    dependencies.add(dependency.asText());
                } else {
                    parseResult.invalidType(stepLocation, "depends_on", "array of string");
                }
            });
            step.setDependsOn(dependencies);
        }

        var retryCount = getInteger("retry_count", node, false, stepLocation, parseResult);
        if (Objects.isNull(retryCount)) retryCount = getInteger("max_retries", node, false, stepLocation, parseResult);
        step.setRetryCount(Objects.isNull(retryCount) ? 0 : retryCount);
        step.setRetryDelay(getDuration("retry_delay", node, stepLocation, parseResult));
        step.setTimeout(getDuration("timeout", node, stepLocation, parseResult));

        var onError = getString("on_error", node, false, stepLocation, parseResult);
        if (Objects.nonNull(onError)) {
            if ("retry".equalsIgnoreCase(onError)) {
                parseResult.warning(stepLocation, "on_error 'retry' is treated as 'fail'; use retry_count");
            } else {
                try {
                    step.setOnError(OnError.of(onError));
                } catch (IllegalArgumentException e) {
                    parseResult.error(stepLocation, "invalid on_error '%s'".formatted(onError));
                }
            }
        }

        var type = getString("type", node, true, stepLocation, parseResult);
        if (Objects.isNull(type)) return step;
        StepType stepType;
        try {
            stepType = StepType.of(type);
        } catch (IllegalArgumentException e) {
            parseResult.error(stepLocation, "invalid step type '%s'".formatted(type));
            return step;
        }
        step.setType(stepType);
        step.setPayload(getPayload(stepType, node, stepLocation, parseResult));
        return step;
    }

    private StepPayload getPayload(final StepType stepType, final ObjectNode node,
                                   final String location, final ParseResult parseResult) {
        var payloadKeys = PAYLOAD_KEYS.get(stepType);
        var payloadNode = MAPPER.createObjectNode();
        var unexpected = new ArrayList<String>();
        node.fieldNames().forEachRemaining(key -> {
            var target = stepType == StepType.API_CALL ? API_CALL_ALIASES.getOrDefault(key, key) : key;
            if (payloadKeys.contains(target)) {
                payloadNode.set(target, node.get(key));
            } else if (!STEP_KEYS.contains(key)) {
                unexpected.add(key);
            }
        });
        unexpected.forEach(key -> parseResult.extra(location, key));
        if (stepType == StepType.API_CALL) normalizeAuth(payloadNode);
        try {
            return MAPPER.treeToValue(payloadNode, stepType.getPayloadType());
        } catch (JsonProcessingException e) {
            parseResult.error(location, "invalid %s payload: %s".formatted(stepType.getValue(), e.getOriginalMessage()));
            return null;
        }
    }

    private static void normalizeAuth(final ObjectNode payloadNode) {
        var auth = payloadNode.get("auth");
        if (auth instanceof ObjectNode authNode) {
            if (authNode.has("user") && !authNode.has("username")) authNode.set("username", authNode.get("user"));
            if (authNode.has("pass") && !authNode.has("password")) authNode.set("password", authNode.get("pass"));
        }
    }

    private Duration getDuration(final String key, final ObjectNode node, final String location, final ParseResult parseResult) {
        var value = node.get(key);
        if (Objects.isNull(value) || value.isNull()) return null;
        if (value.isNumber()) {
            return toDuration(value.decimalValue());
        }
        if (value.isTextual()) {
            var text = value.asText().trim();
            try {
                if (text.toUpperCase().startsWith("PT")) return Duration.parse(text.toUpperCase());
                return toDuration(new BigDecimal(text));
            } catch (NumberFormatException | DateTimeParseException e) {
                parseResult.invalidType(location, key, "seconds");
                return null;
            }
        }
        parseResult.invalidType(location, key, "seconds");
        return null;
    }

    private static Duration toDuration(final BigDecimal seconds) {
        return Duration.ofMillis(seconds.movePointRight(3).longValue());
    }

    private void reportUnexpectedKeys(final ObjectNode node, final Set<String> keys,
                                      final String location, final ParseResult parseResult) {
        node.fieldNames().forEachRemaining(key -> {
            if (!keys.contains(key)) parseResult.extra(location, key);
        });
    }

    public String getString(final String key,
                            final ObjectNode node,
                            final boolean required,
                            final String location,
                            final ParseResult result) {
        JsonNode value = node.get(key);
        String text = null;
        if (Objects.isNull(value) || value.isNull()) {
            if (required) result.missing(location, key);
        } else if (!value.isValueNode() || value.isBinary()) {
            result.invalidType(location, key, "string");
        } else {
            text = value.asText();
            if (text.isEmpty() && !result.isAllowEmptyStrings()) {
                if (required) result.missing(location, key);
                text = null;
            }
        }
        return text;
    }

    public Integer getInteger(final String key,
                              final ObjectNode node,
                              final boolean required,
                              final String location,
                              final ParseResult result) {
        JsonNode value = node.get(key);
        if (Objects.isNull(value) || value.isNull()) {
            if (required) result.missing(location, key);
            return null;
        }
        if (value.isIntegralNumber()) return value.intValue();
        if (value.isTextual() && value.asText().trim().matches("-?\\d+")) return Integer.parseInt(value.asText().trim());
        result.invalidType(location, key, "integer");
        return null;
    }

    public ObjectNode getObject(final String key,
                                final ObjectNode node,
                                final boolean required,
                                final String location,
                                final ParseResult result) {
        JsonNode value = node.get(key);
        ObjectNode object = null;
        if (Objects.isNull(value) || value.isNull()) {
            if (required) result.missing(location, key);
        } else if (!value.getNodeType().equals(JsonNodeType.OBJECT)) {
            result.invalidType(location, key, "object");
        } else {
            object = (ObjectNode) value;
        }
        return object;
    }

    public ArrayNode getArray(final String key,
                              final ObjectNode node,
                              final boolean required,
                              final String location,
                              final ParseResult result) {
        JsonNode value = node.get(key);
        ArrayNode array = null;
        if (Objects.isNull(value) || value.isNull()) {
            if (required) result.missing(location, key);
        } else if (!value.getNodeType().equals(JsonNodeType.ARRAY)) {
            result.invalidType(location, key, "array");
        } else {
            array = (ArrayNode) value;
        }
        return array;
    }

    @Data
    public static class ParseResult {

        private boolean invalid;
        private boolean allowEmptyStrings;
        private boolean strict;
        private final List<Location> errors = new ArrayList<>();
        private final Map<Location, String> invalidType = new LinkedHashMap<>();
        private final List<Location> missing = new ArrayList<>();
        private final List<Location> extra = new ArrayList<>();
        private final List<Location> warnings = new ArrayList<>();

        public void error(final String location, final String message) {
            errors.add(new Location(location, message));
            invalid = true;
        }

        public void missing(final String location, final String key) {
            missing.add(new Location(location, key));
            invalid = true;
        }

        public void invalidType(final String location, final String key, final String expectedType) {
            invalidType.put(new Location(location, key), expectedType);
            invalid = true;
        }

        public void extra(final String location, final String key) {
            extra.add(new Location(location, key));
            if (strict) invalid = true;
        }

        public void warning(final String location, final String message) {
            warnings.add(new Location(location, message));
        }

        public List<String> getMessages() {
            List<String> messages = new ArrayList<>();
            for (Location l : errors) {
                messages.add(prefix(l, ": ") + l.key);
            }
            for (Map.Entry<Location, String> entry : invalidType.entrySet()) {
                var l = entry.getKey();
                messages.add("attribute " + prefix(l, ".") + l.key + " is not of type `" + entry.getValue() + "`");
            }
            for (Location l : missing) {
                messages.add("attribute " + prefix(l, ".") + l.key + " is missing");
            }
            if (strict) {
                for (Location l : extra) {
                    messages.add("attribute " + prefix(l, ".") + l.key + " is unexpected");
                }
            }
            return messages;
        }

        public List<String> getWarnings() {
            List<String> messages = new ArrayList<>();
            if (!strict) {
                for (Location l : extra) {
                    messages.add("attribute " + prefix(l, ".") + l.key + " is unexpected");
                }
            }
            for (Location l : warnings) {
                messages.add(prefix(l, ": ") + l.key);
            }
            return messages;
        }

        private static String prefix(final Location l, final String separator) {
            return l.location.isEmpty() ? "" : l.location + separator;
        }

        protected record Location(String location, String key) {}
    }
}
