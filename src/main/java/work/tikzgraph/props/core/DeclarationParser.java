package work.tikzgraph.props.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.tikzgraph.props.model.DataType;
import work.tikzgraph.props.model.PropertyDescriptor;
import work.tikzgraph.props.model.Undefined;

/**
 * Parser for property declarations of the form {@code _renderer:group:type:name[:tags]}.
 *
 * <p>Renderer and group are optional ({@code _::string:title} is valid), the renderer then
 * defaults to {@code common}. Tags are space separated; {@code !clear} marks a declaration that
 * drops every previously merged descendant of its path. The underscore-delimited and dotted
 * legacy forms are not accepted.
 */
public final class DeclarationParser {
    public static final int GRAMMAR_VERSION = 1;

    private static final String PATH = "[a-zA-Z](?:[_.]?[a-zA-Z0-9]++)*+";
    private static final Pattern DECLARATION = Pattern.compile(
        "^_([a-zA-Z][a-zA-Z0-9]*)?:(" + PATH + ")?:([a-zA-Z]+):(" + PATH + ")(?::(.*))?$"
    );

    private DeclarationParser() {}

    public static boolean isDeclaration(String text) {
        return text != null && DECLARATION.matcher(text).matches();
    }

    /**
     * Parses the declaration without a value; the descriptor's value is {@link Undefined#INSTANCE}.
     */
    public static PropertyDescriptor parseDescription(String text) {
        return parseWithValue(text, Undefined.INSTANCE);
    }

    public static PropertyDescriptor parseWithValue(String text, Object rawValue) {
        Matcher match = text == null ? null : DECLARATION.matcher(text);
        if (match == null || !match.matches()) {
            throw new DeclarationParseException(
                DeclarationParseException.INVALID_DECLARATION,
                "Invalid property declaration: " + text,
                text
            );
        }
        String typeToken = match.group(3);
        DataType type = DataType.fromToken(typeToken).orElseThrow(() -> new DeclarationParseException(
            DeclarationParseException.UNKNOWN_TYPE,
            "Invalid type '" + typeToken + "' in property declaration: " + text,
            text
        ));
        List<String> tags = splitTags(match.group(5));
        try {
            return PropertyDescriptor.builder()
                .renderer(match.group(1))
                .group(match.group(2))
                .namePath(match.group(4))
                .dataType(type)
                .tags(tags)
                .value(rawValue)
                .build();
        } catch (IllegalArgumentException ex) {
            throw new DeclarationParseException(
                DeclarationParseException.INVALID_PATH,
                ex.getMessage() + " in property declaration: " + text,
                text,
                ex
            );
        }
    }

    /**
     * Key sequence addressing the descriptor's location below its group.
     */
    public static List<Object> pathWithIndices(PropertyDescriptor descriptor) {
        return descriptor.pathWithIndices();
    }

    private static List<String> splitTags(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        var tags = new ArrayList<String>();
        for (String tag : raw.split(" ")) {
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }
}
