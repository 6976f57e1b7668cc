package de.netcompliance.service;

import de.netcompliance.core.exception.ComplianceDefinitionException;
import de.netcompliance.core.model.Workflow;
import de.netcompliance.core.repository.DeviceInventory;
import de.netcompliance.model.ExecutionRequestDto;
import de.netcompliance.repository.WorkflowCatalog;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComplianceServiceTest {

    private final List<String> lookups = new ArrayList<>();
    private final DeviceInventory inventory = deviceId -> {
        lookups.add(deviceId);
        return Optional.empty();
    };
    private final WorkflowCatalog catalog = new WorkflowCatalog() {
        @Override
        public Optional<Workflow> findWorkflow(final String name) {
            return Optional.of(Workflow.builder().name(name).build());
        }

        @Override
        public Collection<Workflow> findAll() {
            return List.of();
        }
    };

    @Test
    void testExecutionTargetIsResolvedThroughAnyInventory() {
        // given
        final ComplianceService service = new ComplianceService(null, null, catalog, inventory);
        final ExecutionRequestDto request = ExecutionRequestDto.builder().deviceId("ghost").build();

        // when / then
        assertThatThrownBy(() -> service.startExecution("collect", request))
                .isInstanceOf(ComplianceDefinitionException.class)
                .hasMessage("Unknown device 'ghost'");
        assertThat(lookups).containsExactly("ghost");
    }
}
