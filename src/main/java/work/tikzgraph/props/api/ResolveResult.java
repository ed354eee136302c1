package work.tikzgraph.props.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a {@link PropertyResolver} run: the resolved page, style and element trees, the
 * entries that were skipped on the way, or the error that stopped the run.
 *
 * <p>A run that skipped entries still succeeds; {@link #rejections()} lists what was left out.
 */
public record ResolveResult(
    Status status,
    List<String> renderers,
    List<String> documents,
    Map<String, Object> page,
    Map<String, Object> styles,
    Map<String, Object> elements,
    List<Rejection> rejections,
    String error,
    Duration elapsed
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public ResolveResult {
        renderers = List.copyOf(renderers);
        documents = List.copyOf(documents);
        page = Collections.unmodifiableMap(new LinkedHashMap<>(page));
        styles = Collections.unmodifiableMap(new LinkedHashMap<>(styles));
        elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        rejections = List.copyOf(rejections);
    }

    static ResolveResult resolved(
        List<String> renderers,
        List<String> documents,
        Map<String, Object> page,
        Map<String, Object> styles,
        Map<String, Object> elements,
        List<Rejection> rejections,
        Duration elapsed
    ) {
        return new ResolveResult(Status.SUCCESS, renderers, documents, page, styles, elements, rejections, null, elapsed);
    }

    static ResolveResult failed(List<String> renderers, List<String> documents, String error, Duration elapsed) {
        return new ResolveResult(
            Status.FAILURE, renderers, documents, Map.of(), Map.of(), Map.of(), List.of(), error, elapsed
        );
    }

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }

    /** Resolved tree of one element, empty when the id was never declared. */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> element(String id) {
        return Optional.ofNullable((Map<String, Object>) elements.get(id));
    }

    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> style(String name) {
        return Optional.ofNullable((Map<String, Object>) styles.get(name));
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.label());
        serializable.put("renderers", renderers);
        serializable.put("documents", documents);
        if (status == Status.SUCCESS) {
            serializable.put("page", page);
            serializable.put("styles", styles);
            serializable.put("elements", elements);
        }
        if (!rejections.isEmpty()) {
            serializable.put("rejected", rejections.stream().map(Rejection::toMap).toList());
        }
        if (error != null) {
            serializable.put("error", error);
        }
        serializable.put("elapsedMillis", elapsed.toMillis());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize resolve result: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * An entry left out of the result: the unit it came from ({@code page}, {@code styles.bold},
     * {@code elements.A}), its key, a machine code and a readable message.
     */
    public record Rejection(String unit, String key, String code, String message) {
        Map<String, Object> toMap() {
            var map = new LinkedHashMap<String, Object>();
            map.put("unit", unit);
            map.put("key", key);
            map.put("code", code);
            map.put("message", message);
            return map;
        }
    }

    public enum Status {
        SUCCESS("success", 0),
        FAILURE("failure", 1);

        private final String label;
        private final int exitCode;

        Status(String label, int exitCode) {
            this.label = label;
            this.exitCode = exitCode;
        }

        public String label() {
            return label;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
