package work.tikzgraph.props.style;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.tikzgraph.props.hierarchy.HierarchyBuilder;
import work.tikzgraph.props.merge.PropertyMerger;
import work.tikzgraph.props.model.DataType;
import work.tikzgraph.props.model.PropertyDescriptor;

/**
 * Declarations of one resolution context: named styles, page properties and the order in which
 * they apply.
 *
 * <p>Styles are stored unmerged. A style stack ({@code base}, then each named style in turn) is
 * merged prefix by prefix and every prefix result is cached until another style is added.
 * Element overrides are merged on top of their resolved stack. Not thread-safe.
 */
public final class StyleSheet {
    private static final List<String> PAGE_DEFAULTS = List.of(
        "scale.position.x",
        "scale.position.y",
        "scale.size.w",
        "scale.size.h",
        "margin.w",
        "margin.h"
    );

    private final Set<String> compatibleRenderers;
    private final HierarchyBuilder hierarchyBuilder;
    private final Map<String, List<PropertyDescriptor>> styles = new LinkedHashMap<>();
    private final Map<List<String>, List<PropertyDescriptor>> stackCache = new HashMap<>();
    private List<PropertyDescriptor> pageProperties;

    public StyleSheet(Collection<String> compatibleRenderers, HierarchyBuilder hierarchyBuilder) {
        this.compatibleRenderers = Collections.unmodifiableSet(new LinkedHashSet<>(compatibleRenderers));
        this.hierarchyBuilder = Objects.requireNonNull(hierarchyBuilder, "hierarchyBuilder");
        this.pageProperties = defaultPageProperties();
    }

    public Set<String> compatibleRenderers() {
        return compatibleRenderers;
    }

    public Set<String> styleNames() {
        return Collections.unmodifiableSet(styles.keySet());
    }

    /**
     * Appends the compatible descriptors to the named style; a blank name targets {@code base}.
     */
    public void addStyleProperties(String styleName, List<PropertyDescriptor> properties) {
        if (properties == null) {
            return;
        }
        String name = styleName == null || styleName.isBlank() ? StyleNames.BASE : styleName.trim();
        var existing = styles.computeIfAbsent(name, key -> new ArrayList<>());
        for (PropertyDescriptor property : properties) {
            if (compatibleRenderers.contains(property.renderer())) {
                existing.add(property);
            }
        }
        stackCache.clear();
    }

    public List<PropertyDescriptor> styleProperties(String styleName) {
        return List.copyOf(styles.getOrDefault(styleName, List.of()));
    }

    /**
     * Merges the styles of {@code stack} in order. Unknown style names contribute nothing.
     */
    public List<PropertyDescriptor> resolveStack(List<String> stack) {
        List<PropertyDescriptor> merged = List.of();
        if (stack == null) {
            return merged;
        }
        for (int i = 0; i < stack.size(); i++) {
            List<String> prefix = List.copyOf(stack.subList(0, i + 1));
            var cached = stackCache.get(prefix);
            if (cached != null) {
                merged = cached;
                continue;
            }
            var props = styles.getOrDefault(stack.get(i), List.of());
            merged = List.copyOf(PropertyMerger.mergeInto(merged, props, compatibleRenderers));
            stackCache.put(prefix, merged);
        }
        return merged;
    }

    public List<PropertyDescriptor> resolveStack(String styleNames) {
        return resolveStack(StyleNames.normalize(styleNames));
    }

    public Map<String, Object> style(String styleNames) {
        return hierarchyBuilder.build(resolveStack(styleNames));
    }

    public Map<String, Object> style(List<String> stack) {
        return hierarchyBuilder.build(resolveStack(stack));
    }

    public void addPageProperties(List<PropertyDescriptor> properties) {
        pageProperties = List.copyOf(PropertyMerger.mergeInto(pageProperties, properties, compatibleRenderers));
    }

    public List<PropertyDescriptor> pageProperties() {
        return pageProperties;
    }

    public Map<String, Object> page() {
        return hierarchyBuilder.build(pageProperties);
    }

    /**
     * Resolved stack for {@code styleNames} with the element's own overrides applied last.
     */
    public List<PropertyDescriptor> resolveElement(String styleNames, List<PropertyDescriptor> overrides) {
        return PropertyMerger.mergeInto(resolveStack(styleNames), overrides, compatibleRenderers);
    }

    public Map<String, Object> element(String styleNames, List<PropertyDescriptor> overrides) {
        return hierarchyBuilder.build(resolveElement(styleNames, overrides));
    }

    private static List<PropertyDescriptor> defaultPageProperties() {
        var defaults = new ArrayList<PropertyDescriptor>();
        for (String path : PAGE_DEFAULTS) {
            defaults.add(PropertyDescriptor.builder()
                .namePath(path)
                .dataType(DataType.NUMBER)
                .value(1)
                .build());
        }
        return List.copyOf(defaults);
    }
}
