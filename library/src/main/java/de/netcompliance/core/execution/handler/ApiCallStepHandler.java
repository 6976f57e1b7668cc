package de.netcompliance.core.execution.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.google.common.base.Strings;
import de.netcompliance.core.exception.StepExecutionException;
import de.netcompliance.core.model.Step;
import de.netcompliance.core.model.StepType;
import de.netcompliance.core.model.payload.ApiCallPayload;
import de.netcompliance.infrastructure.resolving.VariableResolver;
import io.restassured.RestAssured;
import io.restassured.config.HttpClientConfig;
import io.restassured.config.RestAssuredConfig;
import io.restassured.http.ContentType;
import io.restassured.http.Header;
import io.restassured.http.Method;
import io.restassured.response.Response;
import io.restassured.specification.RequestSpecification;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Issues one HTTP request through RestAssured. The step timeout doubles as connect and read
 * timeout; connection failures and 5xx answers are retryable.
 */
@Slf4j
public class ApiCallStepHandler implements StepHandler {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH");

    private final VariableResolver resolver;
    private final ObjectMapper mapper;

    public ApiCallStepHandler(final VariableResolver resolver) {
        this(resolver, JsonMapper.builder().findAndAddModules().build());
    }

    public ApiCallStepHandler(final VariableResolver resolver, final ObjectMapper mapper) {
        this.resolver = resolver;
        this.mapper = mapper;
    }

    @Override
    public StepType type() {
        return StepType.API_CALL;
    }

    @Override
    public StepOutcome execute(final Step step, final VariableScope scope, final DeviceContext device) {
        var payload = step.payloadAs(ApiCallPayload.class);
        var variables = scope.asMap();
        var url = resolver.resolveText(payload.getUrl(), variables);
        if (Strings.isNullOrEmpty(url)) {
            throw new StepExecutionException("Step '%s' resolved to an empty url".formatted(step.getName()), false);
        }
        var method = Objects.requireNonNullElse(payload.getMethod(), "GET").toUpperCase();
        if (!SUPPORTED_METHODS.contains(method)) {
            throw new StepExecutionException("Unsupported HTTP method '%s'".formatted(method), false);
        }

        var request = buildRequest(payload, variables, Objects.requireNonNullElse(step.getTimeout(), DEFAULT_TIMEOUT));
        log.debug("{} {} for step '{}'", method, url, step.getName());
        var response = makeRequest(request, Method.valueOf(method), url);
        return handleResponse(url, response);
    }

    private RequestSpecification buildRequest(final ApiCallPayload payload,
                                              final Map<String, Object> variables,
                                              final Duration timeout) {
        var timeoutMillis = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        var requestSpecification = RestAssured
                .given()
                .config(RestAssuredConfig.config().httpClient(HttpClientConfig.httpClientConfig()
                        .setParam("http.connection.timeout", timeoutMillis)
                        .setParam("http.socket.timeout", timeoutMillis)));

        // apply headers and query params
        var headers = resolveMap(payload.getHeaders(), variables);
        if (!headers.isEmpty()) {
            requestSpecification.headers(headers);
        }
        var params = resolveMap(payload.getParams(), variables);
        if (!params.isEmpty()) {
            requestSpecification.queryParams(params);
        }

        // apply auth
        var auth = payload.getAuth();
        if (Objects.nonNull(auth) && Objects.nonNull(auth.getType())) {
            switch (auth.getType().toLowerCase()) {
                case "basic" -> requestSpecification.auth().preemptive().basic(
                        resolver.resolveText(auth.getUsername(), variables),
                        resolver.resolveText(auth.getPassword(), variables));
                case "bearer" -> requestSpecification.header(
                        "Authorization", "Bearer " + resolver.resolveText(auth.getToken(), variables));
                default -> throw new StepExecutionException("Unsupported auth type '%s'".formatted(auth.getType()), false);
            }
        }

        // apply body
        if (Objects.nonNull(payload.getBody())) {
            var body = resolver.resolve(payload.getBody(), variables);
            if (body instanceof String text) {
                requestSpecification.body(text);
            } else {
                requestSpecification.contentType(ContentType.JSON);
                requestSpecification.body(writeJson(body));
            }
        }
        return requestSpecification;
    }

    private Response makeRequest(final RequestSpecification requestSpecification, final Method method, final String url) {
        try {
            return requestSpecification.request(method, url);
        } catch (Exception e) {
            // RestAssured rethrows socket failures without declaring them
            if (e instanceof IOException || e.getCause() instanceof IOException) {
                throw new StepExecutionException("Request to %s failed: %s".formatted(url, e.getMessage()), e, true);
            }
            throw new StepExecutionException("Request to %s could not be issued: %s".formatted(url, e.getMessage()), e, false);
        }
    }

    private StepOutcome handleResponse(final String url, final Response response) {
        var statusCode = response.getStatusCode();
        var headers = new LinkedHashMap<String, Object>();
        for (Header header : response.getHeaders().asList()) {
            headers.put(header.getName(), header.getValue());
        }

        var output = new LinkedHashMap<String, Object>();
        output.put("status_code", statusCode);
        output.put("success", statusCode < 400);
        output.put("data", readBody(response.asString()));
        output.put("headers", headers);

        if (statusCode >= 500) {
            return StepOutcome.failed("%s answered with status %d".formatted(url, statusCode), true, output);
        }
        return StepOutcome.completed(output, "HTTP " + statusCode);
    }

    private Object readBody(final String body) {
        if (Strings.isNullOrEmpty(body)) {
            return null;
        }
        var trimmed = body.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return body;
        }
        try {
            return mapper.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON, keeping it as text: {}", e.getOriginalMessage());
            return body;
        }
    }

    private String writeJson(final Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StepExecutionException("Request body cannot be written as JSON: " + e.getOriginalMessage(), e, false);
        }
    }

    private Map<String, Object> resolveMap(final Map<String, Object> source, final Map<String, Object> variables) {
        var resolved = new LinkedHashMap<String, Object>();
        if (Objects.isNull(source)) {
            return resolved;
        }
        source.forEach((key, value) -> {
            var resolvedValue = resolver.resolve(value, variables);
            if (Objects.nonNull(resolvedValue)) {
                resolved.put(key, resolvedValue);
            }
        });
        return resolved;
    }
}
