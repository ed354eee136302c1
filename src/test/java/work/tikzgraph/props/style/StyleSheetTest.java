package work.tikzgraph.props.style;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.tikzgraph.props.core.DeclarationParser;
import work.tikzgraph.props.hierarchy.HierarchyBuilder;
import work.tikzgraph.props.hierarchy.HierarchyMode;
import work.tikzgraph.props.model.PropertyDescriptor;

class StyleSheetTest {
    private StyleSheet sheet;

    private static PropertyDescriptor decl(String text, Object value) {
        return DeclarationParser.parseWithValue(text, value);
    }

    @BeforeEach
    void setUp() {
        sheet = new StyleSheet(List.of("common", "latex"), new HierarchyBuilder(HierarchyMode.LENIENT));
        sheet.addStyleProperties("base", List.of(
            decl("_::string:node.shape", "circle"),
            decl("_latex::string:node.draw", "black"),
            decl("_vector::string:node.fill", "grey"),
            decl("_latex::string:edge.arrow.start.shape", "Circle")
        ));
        sheet.addStyleProperties("bold", List.of(
            decl("_latex::string:node.line_width", "thick"),
            decl("_::string:node.shape", "rectangle")
        ));
        sheet.addStyleProperties("plain", List.of(decl("_latex::string:edge.arrow:!clear", "none")));
    }

    @Test
    void incompatibleDescriptorsAreNotStored() {
        assertEquals(3, sheet.styleProperties("base").size());
        assertEquals(List.of("base", "bold", "plain"), List.copyOf(sheet.styleNames()));
    }

    @Test
    void stackMergesBaseThenNamedStyles() {
        var style = sheet.style("bold");

        assertEquals(
            Map.of("shape", "rectangle", "draw", "black", "line_width", "thick"),
            style.get("node")
        );
        assertEquals(List.of("node.shape", "node.draw", "edge.arrow.start.shape", "node.line_width"),
            sheet.resolveStack("bold").stream().map(PropertyDescriptor::namePath).toList());
    }

    @Test
    void clearInsideStackReplacesInheritedSubtree() {
        var style = sheet.style(List.of("base", "plain"));

        assertEquals(Map.of("arrow", "none"), style.get("edge"));
        assertEquals("circle", ((Map<?, ?>) style.get("node")).get("shape"));
    }

    @Test
    void unknownStylesContributeNothing() {
        assertEquals(sheet.resolveStack("base"), sheet.resolveStack("missing"));
    }

    @Test
    void prefixesAreCachedUntilStylesChange() {
        var first = sheet.resolveStack(List.of("base", "bold"));
        assertSame(first, sheet.resolveStack(List.of("base", "bold")));

        sheet.addStyleProperties("bold", List.of(decl("_::string:node.label", "x")));
        var second = sheet.resolveStack(List.of("base", "bold"));

        assertNotSame(first, second);
        assertEquals(first.size() + 1, second.size());
    }

    @Test
    void blankStyleNameTargetsBase() {
        sheet.addStyleProperties(" ", List.of(decl("_::string:node.label", "x")));

        assertEquals(4, sheet.styleProperties("base").size());
    }

    @Test
    void pageStartsFromDefaults() {
        var page = sheet.page();

        assertEquals(Map.of("position", Map.of("x", 1L, "y", 1L), "size", Map.of("w", 1L, "h", 1L)), page.get("scale"));
        assertEquals(Map.of("w", 1L, "h", 1L), page.get("margin"));
    }

    @Test
    void pageOverridesReplaceDefaultsInPlace() {
        sheet.addPageProperties(List.of(
            decl("_::number:scale.position.x", "2"),
            decl("_::float:margin.h", "0.5"),
            decl("_vector::number:margin.w", "9")
        ));

        var page = sheet.page();
        assertEquals(2L, ((Map<?, ?>) ((Map<?, ?>) page.get("scale")).get("position")).get("x"));
        assertEquals(Map.of("w", 1L, "h", 0.5), page.get("margin"));
        assertEquals(6, sheet.pageProperties().size());
    }

    @Test
    void elementOverridesApplyLast() {
        var resolved = sheet.resolveElement("bold", List.of(
            decl("_::string:node.shape", "diamond"),
            decl("_::string:label.text", "Start")
        ));

        assertEquals("diamond", resolved.get(0).value());
        assertEquals("label.text", resolved.get(resolved.size() - 1).namePath());

        var element = sheet.element("bold", List.of());
        assertEquals("rectangle", ((Map<?, ?>) element.get("node")).get("shape"));
        assertFalse(element.containsKey("label"));
        assertTrue(sheet.compatibleRenderers().contains("latex"));
    }
}
