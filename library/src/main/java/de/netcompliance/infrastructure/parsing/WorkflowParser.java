package de.netcompliance.infrastructure.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import de.netcompliance.core.exception.ComplianceIllegalStateException;
import de.netcompliance.infrastructure.validation.ValidationOptions;
import de.netcompliance.infrastructure.validation.ValidatorRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Objects;

@Slf4j
public class WorkflowParser implements WorkflowParserExtension {

    private static final Charset ENCODING = StandardCharsets.UTF_8;

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder().build();
    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder().build();

    private final ValidatorRegistry validatorRegistry;

    public WorkflowParser() {
        this(new ValidatorRegistry());
    }

    public WorkflowParser(final ValidatorRegistry validatorRegistry) {
        this.validatorRegistry = validatorRegistry;
    }

    @Override
    public WorkflowParseResult readLocation(final String workflowUrl, final WorkflowParseOptions options) {
        try {
            var content = readContentFromLocation(workflowUrl);
            return readContents(content, options, workflowUrl);
        } catch (Exception e) {
            return WorkflowParseResult.ofError(e.getMessage());
        }
    }

    @Override
    public WorkflowParseResult readContents(final String workflowAsString, final WorkflowParseOptions options) {
        return readContents(workflowAsString, options, null);
    }

    private String readContentFromLocation(final String location) {
        final String adjustedLocation = location.replace("\\\\", "/");
        try {
            final String fileScheme = "file:";
            final Path path = adjustedLocation.toLowerCase().startsWith(fileScheme) ?
                    Paths.get(URI.create(adjustedLocation)) : Paths.get(adjustedLocation);
            if (Files.exists(path)) {
                return FileUtils.readFileToString(path.toFile(), ENCODING);
            }
            try (var is = getClass().getClassLoader().getResourceAsStream(location)) {
                if (Objects.isNull(is)) {
                    throw new ComplianceIllegalStateException("Workflow definition not found: %s".formatted(location));
                }
                return new String(is.readAllBytes(), ENCODING);
            }
        } catch (IOException e) {
            throw new ComplianceIllegalStateException("Cannot read workflow definition %s: %s"
                    .formatted(location, e.getMessage()), e);
        }
    }

    private WorkflowParseResult readContents(final String workflowAsString,
                                             final WorkflowParseOptions options,
                                             final String location) {
        if (Objects.isNull(workflowAsString) || workflowAsString.trim().isEmpty()) {
            return WorkflowParseResult.ofError("Null or empty definition");
        }
        var effectiveOptions = Objects.nonNull(options) ? options : WorkflowParseOptions.ofDefault();
        try {
            final var mapper = getMapper(workflowAsString);
            JsonNode rootNode = mapper.readTree(workflowAsString);
            var parseResult = new WorkflowDeserializer().deserialize(rootNode, location, effectiveOptions);
            if (!parseResult.isInvalid() && Objects.nonNull(parseResult.getWorkflow()) && effectiveOptions.isMustValidate()) {
                var validation = validatorRegistry.validate(parseResult.getWorkflow(), ValidationOptions.ofDefault());
                var messages = new ArrayList<>(parseResult.getMessages());
                messages.addAll(validation.getMessages());
                var warnings = new ArrayList<>(parseResult.getWarnings());
                warnings.addAll(validation.getWarnings());
                parseResult.setMessages(messages);
                parseResult.setWarnings(warnings);
                parseResult.setInvalid(validation.isInvalid());
            }
            if (!parseResult.getWarnings().isEmpty()) {
                log.warn("Workflow '{}' parsed with warnings: {}",
                        Objects.nonNull(parseResult.getWorkflow()) ? parseResult.getWorkflow().getName() : location,
                        parseResult.getWarnings());
            }
            return parseResult;
        } catch (Exception e) {
            var msg = String.format("location:%s; msg=%s", location, e.getMessage());
            return WorkflowParseResult.ofError(msg);
        }
    }

    private ObjectMapper getMapper(final String data) {
        if (data.trim().startsWith("{")) {
            return JSON_MAPPER;
        }
        return YAML_MAPPER;
    }
}
