package work.tikzgraph.props.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads JSON property documents, keeping key order so declarations apply in file order.
 */
public final class PropertyDocumentLoader {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_REF = new TypeReference<>() {};

    private PropertyDocumentLoader() {}

    public static PropertyDocument loadFromLocalFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromMap(JSON.readValue(in, MAP_REF), path.toString());
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid property document " + path + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read property document: " + path, ex);
        }
    }

    public static PropertyDocument parse(String json) {
        try {
            return fromMap(JSON.readValue(json, MAP_REF), "<inline>");
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid property document: " + ex.getOriginalMessage(), ex);
        }
    }

    static PropertyDocument fromMap(Map<String, Object> root, String source) {
        if (root == null) {
            return new PropertyDocument(Map.of(), Map.of(), Map.of());
        }
        var page = asObject(root.get("page"), source, "page");

        var styles = new LinkedHashMap<String, Map<String, Object>>();
        for (var entry : asObject(root.get("styles"), source, "styles").entrySet()) {
            styles.put(entry.getKey(), asObject(entry.getValue(), source, "styles." + entry.getKey()));
        }

        var elements = new LinkedHashMap<String, PropertyDocument.Element>();
        for (var entry : asObject(root.get("elements"), source, "elements").entrySet()) {
            String where = "elements." + entry.getKey();
            var element = asObject(entry.getValue(), source, where);
            Object style = element.get("style");
            if (style != null && !(style instanceof String)) {
                throw new IllegalArgumentException(source + ": " + where + ".style must be a string");
            }
            elements.put(entry.getKey(), new PropertyDocument.Element(
                (String) style,
                asObject(element.get("properties"), source, where + ".properties")
            ));
        }
        return new PropertyDocument(page, styles, elements);
    }

    private static Map<String, Object> asObject(Object value, String source, String where) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException(source + ": " + where + " must be an object");
        }
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return copy;
    }
}
