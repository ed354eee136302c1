package work.tikzgraph.props.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.tikzgraph.props.core.DeclarationErrorPolicy;
import work.tikzgraph.props.hierarchy.HierarchyMode;
import work.tikzgraph.props.hierarchy.SparseList;
import work.tikzgraph.props.runtime.PropertyDocumentLoader;
import work.tikzgraph.props.style.StyleNames;

class PropertyResolverTest {
    private static final Path DIAGRAM = Path.of("src", "test", "resources", "documents", "diagram.json");
    private static final Path CONFLICT = Path.of("src", "test", "resources", "documents", "conflict.json");

    @Test
    void resolvesPageStylesAndElements() {
        var result = new PropertyResolver().resolve(ResolverConfiguration.defaults(), List.of(DIAGRAM));

        assertEquals(ResolveResult.Status.SUCCESS, result.status());
        assertTrue(result.succeeded());
        assertNull(result.error());
        assertEquals(List.of(DIAGRAM.toString()), result.documents());

        var page = result.page();
        assertEquals(2L, map(map(page.get("scale")).get("position")).get("x"));
        assertEquals(Map.of("w", 1L, "h", 0.5), page.get("margin"));

        var base = result.style("base").orElseThrow();
        assertEquals(Map.of("shape", "rectangle", "draw", "#000000"), base.get("node"));
        assertEquals(Map.of("arrow", "none"), result.style("plain").orElseThrow().get("edge"));

        var a = result.element("A").orElseThrow();
        var label = map(a.get("label"));
        assertEquals("Start", label.get("text"));
        var lines = assertInstanceOf(SparseList.class, label.get("lines"));
        assertEquals(List.of(1L), lines);
        assertEquals(Map.of("font", "\\sffamily", "weight", "\\bfseries"), map(map(a.get("text")).get("__flags")));
        assertEquals("0.04cm", map(a.get("node")).get("line_width"));

        var b = result.element("B").orElseThrow();
        assertEquals(0.5, map(b.get("node")).get("opacity"));
        assertEquals(Map.of("arrow", "none"), b.get("edge"));
        assertTrue(result.element("C").isEmpty());
    }

    @Test
    void reportsSkippedDeclarations() {
        var result = new PropertyResolver().resolve(ResolverConfiguration.defaults(), List.of(DIAGRAM));

        assertEquals(1, result.rejections().size());
        var rejection = result.rejections().get(0);
        assertEquals("styles.plain", rejection.unit());
        assertEquals("_latex_node_string_fill", rejection.key());
        assertEquals("invalid_declaration", rejection.code());
        assertTrue(result.toPrettyJson().contains("\"rejected\""));
    }

    @Test
    void compatibleRenderersFilterEverything() {
        var config = ResolverConfiguration.builder().compatibleRenderers(List.of("common")).build();

        var result = new PropertyResolver().resolve(config, List.of(DIAGRAM));

        assertEquals(Map.of("node", Map.of("shape", "rectangle")), result.style("base").orElseThrow());
        assertEquals(List.of("common"), result.renderers());
    }

    @Test
    void abortPolicyFailsTheRun() {
        var config = ResolverConfiguration.builder().declarationErrorPolicy(DeclarationErrorPolicy.ABORT).build();

        var result = new PropertyResolver().resolve(config, List.of(DIAGRAM));

        assertEquals(ResolveResult.Status.FAILURE, result.status());
        assertTrue(result.error().contains("_latex_node_string_fill"));
        assertTrue(result.elements().isEmpty());
    }

    @Test
    void conflictsAreSkippedUnlessStrict() {
        var lenient = new PropertyResolver().resolve(ResolverConfiguration.defaults(), List.of(CONFLICT));
        assertEquals(ResolveResult.Status.SUCCESS, lenient.status());
        assertEquals("outline", lenient.style("base").orElseThrow().get("node"));

        var strictConfig = ResolverConfiguration.builder().hierarchyMode(HierarchyMode.STRICT).build();
        var strict = new PropertyResolver().resolve(strictConfig, List.of(CONFLICT));
        assertEquals(ResolveResult.Status.FAILURE, strict.status());
        assertTrue(strict.error().contains("node"));
    }

    @Test
    void resolvesParsedDocument() {
        var document = PropertyDocumentLoader.parse(
            "{\"styles\": {\"base\": {\"_::string:node.shape\": \"circle\"}},"
                + " \"elements\": {\"n1\": {\"style\": \"base\", \"properties\": {\"_::string:label.text\": \"one\"}}}}"
        );

        var result = new PropertyResolver().resolve(ResolverConfiguration.defaults(), document);

        assertEquals(ResolveResult.Status.SUCCESS, result.status());
        var n1 = result.element("n1").orElseThrow();
        assertEquals(Map.of("shape", "circle"), n1.get("node"));
        assertEquals(Map.of("text", "one"), n1.get("label"));
        assertTrue(result.rejections().isEmpty());
    }

    @Test
    void unreferenceableStyleNamesAreReported() {
        var document = PropertyDocumentLoader.parse(
            "{\"styles\": {\"my-style\": {\"color\": \"red\"}, \"bold\": {\"weight\": \"heavy\"}},"
                + " \"elements\": {\"n1\": {\"style\": \"bold, my-style\", \"properties\": {}}}}"
        );

        var result = new PropertyResolver().resolve(ResolverConfiguration.defaults(), document);

        assertEquals(ResolveResult.Status.SUCCESS, result.status());
        assertTrue(result.style("my-style").isEmpty());
        assertEquals(List.of("styles", "elements.n1"),
            result.rejections().stream().map(ResolveResult.Rejection::unit).toList());
        for (var rejection : result.rejections()) {
            assertEquals("my-style", rejection.key());
            assertEquals(StyleNames.INVALID_NAME, rejection.code());
        }
        assertEquals(Map.of("weight", "heavy"), result.element("n1").orElseThrow());
    }

    @Test
    void unreferenceableStyleNameAbortsUnderAbortPolicy() {
        var document = PropertyDocumentLoader.parse("{\"styles\": {\"style_1\": {\"color\": \"red\"}}}");
        var config = ResolverConfiguration.builder().declarationErrorPolicy(DeclarationErrorPolicy.ABORT).build();

        var result = new PropertyResolver().resolve(config, document);

        assertEquals(ResolveResult.Status.FAILURE, result.status());
        assertTrue(result.error().contains("style_1"));
    }

    @Test
    void missingDocumentFails() {
        var missing = Path.of("src", "test", "resources", "documents", "missing.json");

        var result = new PropertyResolver().resolve(ResolverConfiguration.defaults(), List.of(missing));

        assertEquals(ResolveResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertFalse(result.toSerializableMap().containsKey("elements"));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"failure\""));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value) {
        return (Map<String, Object>) assertInstanceOf(Map.class, value);
    }
}
