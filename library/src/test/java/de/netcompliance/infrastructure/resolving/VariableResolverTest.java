package de.netcompliance.infrastructure.resolving;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VariableResolverTest {

    private final VariableResolver resolver = new VariableResolver(new TemplateRenderer());

    private final Map<String, Object> scope = Map.of(
            "facts", Map.of("interfaces", List.of("Gi0/0", "Gi0/1"), "mtu", 9000),
            "ticket", "CHG-42");

    @Test
    void testSingleExpressionKeepsItsType() {
        // then
        assertThat(resolver.resolve("{{ facts.interfaces }}", scope)).isEqualTo(List.of("Gi0/0", "Gi0/1"));
        assertThat(resolver.resolve("  {{ facts.mtu }} ", scope)).isEqualTo(9000);
        assertThat(resolver.resolve("{{ missing }}", scope)).isNull();
    }

    @Test
    void testMixedTextIsRendered() {
        // then
        assertThat(resolver.resolve("mtu {{ facts.mtu }} for {{ ticket }}", scope)).isEqualTo("mtu 9000 for CHG-42");
        assertThat(resolver.resolve("{{ ticket }}-{{ facts.mtu }}", scope)).isEqualTo("CHG-42-9000");
    }

    @Test
    void testNestedStructuresAreResolvedRecursively() {
        // given
        final Map<String, Object> body = Map.of(
                "summary", "Fix {{ ticket }}",
                "interfaces", List.of("{{ facts.interfaces[0] }}", "static"),
                "count", 3);

        // when
        final Object resolved = resolver.resolve(body, scope);

        // then
        assertThat(resolved).isEqualTo(Map.of(
                "summary", "Fix CHG-42",
                "interfaces", List.of("Gi0/0", "static"),
                "count", 3));
    }

    @Test
    void testResolveTextAlwaysRendersText() {
        // then
        assertThat(resolver.resolveText("{{ facts.mtu }}", scope)).isEqualTo("9000");
        assertThat(resolver.resolveText("plain", scope)).isEqualTo("plain");
        assertThat(resolver.resolveText(null, scope)).isNull();
    }
}
