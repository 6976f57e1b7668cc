package de.netcompliance.core.connector.modelpath;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ModelPathFilterTest {

    private static final Map<String, Object> ROUTER = Map.of(
            "router-name", "Base",
            "autonomous-system", "65001",
            "interface", List.of(
                    Map.of("interface-name", "system", "ipv4", Map.of("primary", Map.of("address", "10.0.0.1"))),
                    Map.of("interface-name", "to-core", "ipv4", Map.of("primary", Map.of("address", "10.1.0.1")))));

    @Test
    void testNoFilterReturnsWholeSubtree() {
        assertThat(ModelPathFilter.apply(ROUTER, null)).contains(ROUTER);
        assertThat(ModelPathFilter.apply(ROUTER, Map.of())).contains(ROUTER);
    }

    @Test
    void testPresenceFilterKeepsOnlyNamedKeys() {
        // when
        final Optional<Object> result = ModelPathFilter.apply(ROUTER, Map.of("autonomous-system", ""));

        // then
        assertThat(result).contains(Map.of("autonomous-system", "65001"));
    }

    @Test
    void testContentMatchDropsNonMatchingListEntries() {
        // given
        final Map<String, Object> filter = Map.of("interface", Map.of("interface-name", "to-core", "ipv4", Map.of()));

        // when
        final Optional<Object> result = ModelPathFilter.apply(ROUTER, filter);

        // then
        assertThat(result).contains(Map.of("interface", List.of(Map.of(
                "interface-name", "to-core",
                "ipv4", Map.of("primary", Map.of("address", "10.1.0.1"))))));
    }

    @Test
    void testNothingLeftIsNotFound() {
        assertThat(ModelPathFilter.apply(ROUTER, Map.of("router-name", "Management"))).isEmpty();
        assertThat(ModelPathFilter.apply(ROUTER, Map.of("bgp", Map.of()))).isEmpty();
        assertThat(ModelPathFilter.apply("leaf", Map.of("x", ""))).isEmpty();
    }
}
