package work.tikzgraph.props.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.tikzgraph.props.core.DeclarationErrorPolicy;
import work.tikzgraph.props.hierarchy.HierarchyMode;
import work.tikzgraph.props.shared.LogLevel;

class ResolverConfigurationTest {
    @Test
    void defaultsMatchDocumentedValues() {
        var config = ResolverConfiguration.defaults();

        assertEquals(List.of("common", "latex", "vector"), config.compatibleRenderers());
        assertEquals(HierarchyMode.LENIENT, config.hierarchyMode());
        assertEquals(DeclarationErrorPolicy.SKIP, config.declarationErrorPolicy());
        assertEquals(LogLevel.WARN, config.logLevel());
    }

    @Test
    void renderersAreDeduplicatedInOrder() {
        var config = ResolverConfiguration.builder()
            .compatibleRenderers(List.of("latex", "common", "latex"))
            .build();

        assertEquals(List.of("latex", "common"), config.compatibleRenderers());
        assertEquals(config, config.toBuilder().build());
    }

    @Test
    void requiresAtLeastOneRenderer() {
        assertThrows(
            IllegalArgumentException.class,
            () -> ResolverConfiguration.builder().compatibleRenderers(List.of()).build()
        );
    }
}
