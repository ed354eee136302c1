package work.tikzgraph.props.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import work.tikzgraph.props.core.DeclarationErrorPolicy;
import work.tikzgraph.props.hierarchy.HierarchyMode;
import work.tikzgraph.props.shared.LogLevel;

/**
 * Immutable settings for one resolution run.
 */
public record ResolverConfiguration(
    List<String> compatibleRenderers,
    HierarchyMode hierarchyMode,
    DeclarationErrorPolicy declarationErrorPolicy,
    LogLevel logLevel
) {
    public static final List<String> DEFAULT_RENDERERS = List.of("common", "latex", "vector");

    public ResolverConfiguration {
        Objects.requireNonNull(compatibleRenderers, "compatibleRenderers");
        Objects.requireNonNull(hierarchyMode, "hierarchyMode");
        Objects.requireNonNull(declarationErrorPolicy, "declarationErrorPolicy");
        Objects.requireNonNull(logLevel, "logLevel");
        compatibleRenderers = List.copyOf(new LinkedHashSet<>(compatibleRenderers));
        if (compatibleRenderers.isEmpty()) {
            throw new IllegalArgumentException("At least one compatible renderer is required.");
        }
    }

    public static ResolverConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .compatibleRenderers(compatibleRenderers)
            .hierarchyMode(hierarchyMode)
            .declarationErrorPolicy(declarationErrorPolicy)
            .logLevel(logLevel);
    }

    public static final class Builder {
        private List<String> compatibleRenderers = DEFAULT_RENDERERS;
        private HierarchyMode hierarchyMode = HierarchyMode.LENIENT;
        private DeclarationErrorPolicy declarationErrorPolicy = DeclarationErrorPolicy.SKIP;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder compatibleRenderers(List<String> compatibleRenderers) {
            this.compatibleRenderers = new ArrayList<>(compatibleRenderers);
            return this;
        }

        public Builder hierarchyMode(HierarchyMode hierarchyMode) {
            this.hierarchyMode = hierarchyMode;
            return this;
        }

        public Builder declarationErrorPolicy(DeclarationErrorPolicy declarationErrorPolicy) {
            this.declarationErrorPolicy = declarationErrorPolicy;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public ResolverConfiguration build() {
            return new ResolverConfiguration(compatibleRenderers, hierarchyMode, declarationErrorPolicy, logLevel);
        }
    }
}
