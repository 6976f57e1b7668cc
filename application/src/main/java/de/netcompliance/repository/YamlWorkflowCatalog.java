package de.netcompliance.repository;

import de.netcompliance.core.model.Workflow;
import de.netcompliance.infrastructure.parsing.WorkflowParseOptions;
import de.netcompliance.infrastructure.parsing.WorkflowParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow definitions read from YAML or JSON resources. Definitions that do not validate are
 * logged with their messages and left out.
 */
@Slf4j
public class YamlWorkflowCatalog implements WorkflowCatalog {

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    public YamlWorkflowCatalog(final WorkflowParser parser, final List<Resource> resources) {
        resources.forEach(resource -> load(parser, resource));
        log.info("Loaded {} workflow(s)", workflows.size());
    }

    private void load(final WorkflowParser parser, final Resource resource) {
        String content;
        try {
            content = resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read workflow " + resource.getDescription(), e);
        }
        var result = parser.readContents(content, WorkflowParseOptions.ofDefault());
        if (result.isInvalid()) {
            log.error("Workflow {} rejected: {}", resource.getFilename(), result.getMessages());
            return;
        }
        var workflow = result.getWorkflow();
        if (Objects.nonNull(workflows.putIfAbsent(workflow.getName(), workflow))) {
            log.error("Workflow {} rejected: name '{}' is already taken", resource.getFilename(), workflow.getName());
        }
    }

    @Override
    public Optional<Workflow> findWorkflow(final String name) {
        return Optional.ofNullable(name).map(workflows::get);
    }

    @Override
    public Collection<Workflow> findAll() {
        return List.copyOf(workflows.values());
    }
}
