package work.tikzgraph.props.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.tikzgraph.props.api.ResolverConfiguration;
import work.tikzgraph.props.core.DeclarationErrorPolicy;
import work.tikzgraph.props.hierarchy.HierarchyMode;
import work.tikzgraph.props.shared.LogLevel;

/**
 * Reads {@link ResolverConfiguration} values from a {@code tikzgraph-props.toml} file.
 *
 * <pre>
 * [renderers]
 * compatible = ["common", "latex"]
 * [hierarchy]
 * mode = "strict"
 * [declarations]
 * on-error = "abort"
 * [log]
 * level = "debug"
 * </pre>
 */
public final class ResolverConfigurationLoader {
    public static final String DEFAULT_FILE_NAME = "tikzgraph-props.toml";

    private ResolverConfigurationLoader() {}

    public static ResolverConfiguration load(Path path) {
        return load(path, ResolverConfiguration.defaults());
    }

    public static ResolverConfiguration load(Path path, ResolverConfiguration base) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Unable to read configuration: " + path, ex);
        }
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new IllegalArgumentException("Invalid configuration " + path + ": " + result.errors().get(0).toString());
        }
        return fromToml(result, base, path.toString());
    }

    /**
     * Looks for {@value #DEFAULT_FILE_NAME} in {@code directory}.
     */
    public static Optional<Path> locate(Path directory) {
        if (directory == null) {
            return Optional.empty();
        }
        Path candidate = directory.resolve(DEFAULT_FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    public static ResolverConfiguration fromToml(TomlParseResult result, ResolverConfiguration base, String source) {
        var builder = base.toBuilder();
        try {
            TomlArray renderers = result.getArray("renderers.compatible");
            if (renderers != null) {
                builder.compatibleRenderers(readStrings(renderers));
            }
            String mode = result.getString("hierarchy.mode");
            if (mode != null) {
                builder.hierarchyMode(HierarchyMode.from(mode));
            }
            String onError = result.getString("declarations.on-error");
            if (onError != null) {
                builder.declarationErrorPolicy(DeclarationErrorPolicy.from(onError));
            }
            String level = result.getString("log.level");
            if (level != null) {
                builder.logLevel(LogLevel.from(level));
            }
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid configuration " + source + ": " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid configuration " + source + ": " + ex.getMessage(), ex);
        }
        return builder.build();
    }

    private static List<String> readStrings(TomlArray array) {
        var values = new ArrayList<String>();
        for (int i = 0; i < array.size(); i++) {
            Object value = array.get(i);
            if (!(value instanceof String str) || str.isBlank()) {
                throw new IllegalArgumentException("renderers.compatible must only contain renderer names");
            }
            values.add(str.trim());
        }
        return values;
    }
}
