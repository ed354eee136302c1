package work.tikzgraph.props.core;

/**
 * Raised when a declaration string does not follow the grammar or names an unknown type.
 */
public final class DeclarationParseException extends RuntimeException {
    public static final String INVALID_DECLARATION = "invalid_declaration";
    public static final String UNKNOWN_TYPE = "unknown_type";
    public static final String INVALID_PATH = "invalid_path";

    private final String code;
    private final String declaration;

    public DeclarationParseException(String code, String message, String declaration) {
        super(message);
        this.code = code;
        this.declaration = declaration;
    }

    public DeclarationParseException(String code, String message, String declaration, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.declaration = declaration;
    }

    public String code() {
        return code;
    }

    /** Offending declaration text. */
    public String declaration() {
        return declaration;
    }
}
