package de.netcompliance.controller;

import com.jayway.jsonpath.JsonPath;
import de.netcompliance.OfflineTransportConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.oneOf;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(OfflineTransportConfiguration.class)
class WorkflowApiTest {

    private static final Set<String> TERMINAL_STATES = Set.of("completed", "failed", "cancelled");

    @Autowired
    private MockMvc mockMvc;

    @Test
    void testInvalidWorkflowsAreNotListed() throws Exception {
        // when / then
        mockMvc.perform(get("/workflows"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].name").value(contains("collect", "greeting")))
                .andExpect(jsonPath("$[1].executionMode").value("sequential"))
                .andExpect(jsonPath("$[1].steps").value(contains("compose", "announce")));
    }

    @Test
    void testExecutionUsesRequestVariables() throws Exception {
        // given
        final String request = """
                {"variables": {"audience": "lab"}, "startedBy": "tester"}
                """;

        // when
        final String location = mockMvc.perform(post("/workflows/greeting/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isAccepted())
                .andExpect(header().string("location", startsWith("/workflow-executions/")))
                .andExpect(jsonPath("$.workflowName").value("greeting"))
                .andExpect(jsonPath("$.state").value(oneOf("pending", "running", "completed")))
                .andReturn()
                .getResponse()
                .getHeader("location");
        final String execution = awaitFinished(location);

        // then
        assertThat(JsonPath.<String>read(execution, "$.state")).isEqualTo("completed");
        assertThat(JsonPath.<String>read(execution, "$.startedBy")).isEqualTo("tester");
        assertThat(JsonPath.<String>read(execution, "$.variables.audience")).isEqualTo("lab");
        assertThat(JsonPath.<List<String>>read(execution, "$.stepLogs[*].stepName")).containsExactly("compose", "announce");
        assertThat(JsonPath.<String>read(execution, "$.stepLogs[0].output.text")).isEqualTo("hello lab");
        assertThat(JsonPath.<String>read(execution, "$.stepLogs[1].output.message")).isEqualTo("hello lab");
    }

    @Test
    void testExecutionWithoutBodyUsesWorkflowVariables() throws Exception {
        // when
        final String location = mockMvc.perform(post("/workflows/greeting/executions"))
                .andExpect(status().isAccepted())
                .andReturn()
                .getResponse()
                .getHeader("location");
        final String execution = awaitFinished(location);

        // then
        assertThat(JsonPath.<String>read(execution, "$.state")).isEqualTo("completed");
        assertThat(JsonPath.<String>read(execution, "$.stepLogs[0].output.text")).isEqualTo("hello world");
    }

    @Test
    void testUnreachableDeviceFailsExecution() throws Exception {
        // given
        final String request = """
                {"deviceId": "edge-01"}
                """;

        // when
        final String location = mockMvc.perform(post("/workflows/collect/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andExpect(status().isAccepted())
                .andReturn()
                .getResponse()
                .getHeader("location");
        final String execution = awaitFinished(location);

        // then
        assertThat(JsonPath.<String>read(execution, "$.state")).isEqualTo("failed");
        assertThat(JsonPath.<String>read(execution, "$.deviceId")).isEqualTo("edge-01");
        assertThat(JsonPath.<String>read(execution, "$.message")).isEqualTo("Failed step(s): ssh");
        assertThat(JsonPath.<List<String>>read(execution, "$.stepLogs[?(@.stepName == 'report')].status"))
                .containsExactly("skipped_dependency_failed");
    }

    @Test
    void testRequestsForUnknownResources() throws Exception {
        // when / then
        mockMvc.perform(post("/workflows/nope/executions"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.messages[0]").value("Unknown workflow 'nope'"));
        mockMvc.perform(post("/workflows/collect/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"deviceId\": \"ghost\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.messages[0]").value("Unknown device 'ghost'"));
        mockMvc.perform(get("/workflow-executions/unknown"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.messages[0]").value("Unknown workflow execution 'unknown'"));
    }

    @Test
    void testCancellingFinishedExecutionConflicts() throws Exception {
        // given
        final String location = mockMvc.perform(post("/workflows/greeting/executions"))
                .andExpect(status().isAccepted())
                .andReturn()
                .getResponse()
                .getHeader("location");
        awaitFinished(location);

        // when / then
        mockMvc.perform(delete(location))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.messages[0]").value(startsWith("Workflow execution ")));
    }

    private String awaitFinished(final String location) throws Exception {
        final long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            final String content = mockMvc.perform(get(location))
                    .andExpect(status().isOk())
                    .andReturn()
                    .getResponse()
                    .getContentAsString();
            if (TERMINAL_STATES.contains(JsonPath.<String>read(content, "$.state"))) {
                return content;
            }
            Thread.sleep(50);
        }
        return fail("Execution %s did not finish".formatted(location));
    }
}
