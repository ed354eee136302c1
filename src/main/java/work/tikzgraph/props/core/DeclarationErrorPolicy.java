package work.tikzgraph.props.core;

import java.util.Locale;

/**
 * What a batch read does with a declaration that fails to parse.
 */
public enum DeclarationErrorPolicy {
    SKIP,
    ABORT;

    public static DeclarationErrorPolicy from(String value) {
        if (value == null || value.isBlank()) {
            return SKIP;
        }
        try {
            return DeclarationErrorPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported declaration error policy: " + value);
        }
    }
}
