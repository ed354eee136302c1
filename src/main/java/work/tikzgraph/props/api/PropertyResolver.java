package work.tikzgraph.props.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.tikzgraph.props.core.DeclarationBatch;
import work.tikzgraph.props.core.DeclarationErrorPolicy;
import work.tikzgraph.props.core.DeclarationReader;
import work.tikzgraph.props.hierarchy.HierarchyBuilder;
import work.tikzgraph.props.model.PropertyDescriptor;
import work.tikzgraph.props.runtime.PropertyDocument;
import work.tikzgraph.props.runtime.PropertyDocumentLoader;
import work.tikzgraph.props.shared.ResolverLog;
import work.tikzgraph.props.style.StyleNames;
import work.tikzgraph.props.style.StyleSheet;

/**
 * Public entry point: resolves property documents into page, style and element hierarchies.
 *
 * <p>Documents apply in the order given. Within a document the page entries are read first, then
 * the styles, then the elements; each element resolves as its style stack followed by its own
 * overrides (overrides from several documents for the same element id accumulate in order).
 * Style names that a stack could never reference are treated like invalid declarations: skipped
 * and reported, or fatal under {@link DeclarationErrorPolicy#ABORT}.
 */
public final class PropertyResolver {
    public ResolveResult resolve(ResolverConfiguration configuration, List<Path> documents) {
        long started = System.nanoTime();
        var log = new ResolverLog(configuration.logLevel());
        var names = documents.stream().map(Path::toString).toList();
        try {
            var loaded = new ArrayList<PropertyDocument>();
            for (Path path : documents) {
                log.debug("Loading property document %s", path);
                loaded.add(PropertyDocumentLoader.loadFromLocalFile(path));
            }
            return new Run(configuration, log).resolve(loaded, names, started);
        } catch (RuntimeException ex) {
            return failed(configuration, names, ex, log, started);
        }
    }

    public ResolveResult resolve(ResolverConfiguration configuration, PropertyDocument document) {
        long started = System.nanoTime();
        var log = new ResolverLog(configuration.logLevel());
        try {
            return new Run(configuration, log).resolve(List.of(document), List.of(), started);
        } catch (RuntimeException ex) {
            return failed(configuration, List.of(), ex, log, started);
        }
    }

    /**
     * Version of the packaged resolver, {@code development} when running from classes.
     */
    public static String version() {
        String implementationVersion = PropertyResolver.class.getPackage().getImplementationVersion();
        return implementationVersion != null ? implementationVersion : "development";
    }

    private static ResolveResult failed(
        ResolverConfiguration configuration,
        List<String> documents,
        RuntimeException ex,
        ResolverLog log,
        long started
    ) {
        String message = ex.getMessage() == null || ex.getMessage().isBlank()
            ? ex.getClass().getSimpleName()
            : ex.getMessage();
        log.error("Property resolution failed: " + message, ex);
        return ResolveResult.failed(configuration.compatibleRenderers(), documents, message, elapsedSince(started));
    }

    private static Duration elapsedSince(long started) {
        return Duration.ofNanos(System.nanoTime() - started);
    }

    /** State of one resolution: the style sheet, the pending elements and what was rejected. */
    private static final class Run {
        private final ResolverConfiguration configuration;
        private final ResolverLog log;
        private final HierarchyBuilder builder;
        private final StyleSheet sheet;
        private final DeclarationReader reader;
        private final List<ResolveResult.Rejection> rejections = new ArrayList<>();
        private final Map<String, String> elementStyles = new LinkedHashMap<>();
        private final Map<String, List<PropertyDescriptor>> elementOverrides = new LinkedHashMap<>();

        Run(ResolverConfiguration configuration, ResolverLog log) {
            this.configuration = configuration;
            this.log = log;
            this.builder = new HierarchyBuilder(
                configuration.hierarchyMode(),
                conflict -> log.warn("%s", conflict.describe())
            );
            this.sheet = new StyleSheet(configuration.compatibleRenderers(), builder);
            this.reader = new DeclarationReader(configuration.declarationErrorPolicy());
        }

        ResolveResult resolve(List<PropertyDocument> documents, List<String> names, long started) {
            for (PropertyDocument document : documents) {
                sheet.addPageProperties(read("page", document.page()));
                for (var style : document.styles().entrySet()) {
                    addStyle(style.getKey(), style.getValue());
                }
                for (var element : document.elements().entrySet()) {
                    addElement(element.getKey(), element.getValue());
                }
            }

            var styles = new LinkedHashMap<String, Object>();
            for (String name : sheet.styleNames()) {
                styles.put(name, sheet.style(StyleNames.normalize(name)));
            }
            var elements = new LinkedHashMap<String, Object>();
            for (var entry : elementOverrides.entrySet()) {
                String id = entry.getKey();
                var resolved = sheet.resolveElement(elementStyles.get(id), entry.getValue());
                log.debug("Element %s resolved to %d properties", id, resolved.size());
                elements.put(id, builder.build(resolved));
            }
            return ResolveResult.resolved(
                List.copyOf(sheet.compatibleRenderers()),
                names,
                sheet.page(),
                styles,
                elements,
                rejections,
                elapsedSince(started)
            );
        }

        private void addStyle(String name, Map<String, Object> entries) {
            String unit = "styles." + name;
            if (!name.isBlank() && !StyleNames.isValid(name.trim())) {
                rejectStyleName("styles", name);
                return;
            }
            sheet.addStyleProperties(name, read(unit, entries));
        }

        private void addElement(String id, PropertyDocument.Element element) {
            String unit = "elements." + id;
            var batch = read(unit, element.properties());
            String style = element.style();
            if (style != null) {
                for (String invalid : StyleNames.invalidNames(style)) {
                    rejectStyleName(unit, invalid);
                }
            }
            if (style != null || !elementStyles.containsKey(id)) {
                elementStyles.put(id, style);
            }
            elementOverrides.computeIfAbsent(id, key -> new ArrayList<>()).addAll(batch);
        }

        private void rejectStyleName(String unit, String name) {
            String message = "Invalid style name '" + name + "': names start with a letter and contain only letters, digits and spaces";
            if (configuration.declarationErrorPolicy() == DeclarationErrorPolicy.ABORT) {
                throw new IllegalArgumentException(message + " (" + unit + ")");
            }
            log.warn("Skipping style %s in %s: %s", name, unit, message);
            rejections.add(new ResolveResult.Rejection(unit, name, StyleNames.INVALID_NAME, message));
        }

        private List<PropertyDescriptor> read(String unit, Map<String, Object> entries) {
            DeclarationBatch batch = reader.read(entries);
            for (var rejection : batch.rejected()) {
                log.warn("Skipping %s in %s: %s", rejection.key(), unit, rejection.message());
                rejections.add(new ResolveResult.Rejection(unit, rejection.key(), rejection.code(), rejection.message()));
            }
            log.debug("Read %d descriptors from %s", batch.descriptors().size(), unit);
            return batch.descriptors();
        }
    }
}
