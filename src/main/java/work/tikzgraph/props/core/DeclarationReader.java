package work.tikzgraph.props.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.tikzgraph.props.model.PropertyDescriptor;

/**
 * Turns the ordered key/value entries of one application unit (a style, the page, an element)
 * into descriptors.
 *
 * <p>Keys starting with {@code _} must be declarations. Any other key is a plain property of the
 * {@code common} renderer with a type inferred from its value; nested maps flatten into dotted
 * paths and lists into index segments.
 */
public final class DeclarationReader {
    private final DeclarationErrorPolicy policy;

    public DeclarationReader(DeclarationErrorPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public DeclarationBatch read(Map<String, ?> entries) {
        var descriptors = new ArrayList<PropertyDescriptor>();
        var rejected = new ArrayList<DeclarationBatch.Rejection>();
        if (entries == null) {
            return new DeclarationBatch(descriptors, rejected);
        }
        for (var entry : entries.entrySet()) {
            String key = entry.getKey();
            try {
                if (key.startsWith("_")) {
                    descriptors.add(DeclarationParser.parseWithValue(key, entry.getValue()));
                } else {
                    var flattened = new ArrayList<PropertyDescriptor>();
                    readPlain(key, entry.getValue(), flattened);
                    descriptors.addAll(flattened);
                }
            } catch (DeclarationParseException ex) {
                reject(key, ex, rejected);
            } catch (IllegalArgumentException ex) {
                reject(key, new DeclarationParseException(DeclarationParseException.INVALID_PATH, ex.getMessage(), key, ex), rejected);
            }
        }
        return new DeclarationBatch(descriptors, rejected);
    }

    private void reject(String key, DeclarationParseException error, List<DeclarationBatch.Rejection> rejected) {
        if (policy == DeclarationErrorPolicy.ABORT) {
            throw error;
        }
        rejected.add(new DeclarationBatch.Rejection(key, error.code(), error.getMessage()));
    }

    private static void readPlain(String path, Object value, List<PropertyDescriptor> out) {
        if (value instanceof Map<?, ?> map) {
            for (var child : map.entrySet()) {
                readPlain(path + "." + child.getKey(), child.getValue(), out);
            }
            return;
        }
        if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                readPlain(path + "." + i, list.get(i), out);
            }
            return;
        }
        out.add(PropertyDescriptor.builder()
            .namePath(path)
            .value(value)
            .build());
    }
}
