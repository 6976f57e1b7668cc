package de.netcompliance;

import com.fasterxml.jackson.core.type.TypeReference;
import de.netcompliance.util.yaml.YamlUtil;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(OfflineTransportConfiguration.class)
class ApiDocumentationTest {

    private static final String URL_API_DOCS = "/openapi.yaml";

    @Autowired
    private MockMvc mockMvc;

    @Test
    @SuppressWarnings("unchecked")
    void testGeneratedDocumentationDescribesEveryOperation() throws Exception {
        // given
        final var request = MockMvcRequestBuilders
                .get(URL_API_DOCS)
                .characterEncoding(StandardCharsets.UTF_8);

        // when
        final String content = mockMvc.perform(request)
                .andExpect(status().isOk())
                .andReturn()
                .getResponse()
                .getContentAsString(StandardCharsets.UTF_8);
        final Map<String, Object> openApi = YamlUtil.load(content, new TypeReference<>() {
        });

        // then
        assertThat((Map<String, Object>) openApi.get("info")).containsEntry("title", "Network Compliance API");
        assertThat((Map<String, Object>) openApi.get("paths")).containsOnlyKeys(
                "/audits",
                "/audits/{runId}",
                "/workflows",
                "/workflows/{name}/executions",
                "/workflow-executions/{id}");
    }
}
