package work.tikzgraph.props.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw content of a property document: page entries, named styles and elements, each keyed by
 * declaration text or plain property name in file order.
 */
public record PropertyDocument(
    Map<String, Object> page,
    Map<String, Map<String, Object>> styles,
    Map<String, Element> elements
) {
    public PropertyDocument {
        page = Collections.unmodifiableMap(new LinkedHashMap<>(page));
        styles = Collections.unmodifiableMap(new LinkedHashMap<>(styles));
        elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
    }

    /**
     * A node, edge or other styled entity: its style reference and its own overrides.
     */
    public record Element(String style, Map<String, Object> properties) {
        public Element {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }
}
