package co.fanki.flowgraph.flow.domain;

import java.util.Locale;
import java.util.Map;

/**
 * The kinds of operation a basic block can hold.
 *
 * <p>Raw kind names reported by the front end are folded into these kinds
 * through {@link #fromString(String)}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum OperationKind {

    /** Assignment to a variable, field or property. */
    ASSIGNMENT("Assignment"),

    /** Declaration of a local variable. */
    VARIABLE_DECLARATION("VariableDeclaration"),

    /** Method or delegate invocation. */
    INVOCATION("Invocation"),

    /** Return from the method. */
    RETURN("Return"),

    /** Conditional expression or statement. */
    CONDITIONAL("Conditional"),

    /** Binary operator expression. */
    BINARY_OPERATOR("BinaryOperator"),

    /** Loop statement. */
    LOOP("Loop"),

    /** Read of an array element. */
    ARRAY_ELEMENT_REFERENCE("ArrayElementReference"),

    /** Read of a property. */
    PROPERTY_REFERENCE("PropertyReference"),

    /** Throw of an exception. */
    THROW("Throw"),

    /** Anything else. */
    OTHER("Other");

    private static final Map<String, OperationKind> ALIASES = Map.of(
            "simpleassignment", ASSIGNMENT,
            "compoundassignment", ASSIGNMENT,
            "coalesceassignment", ASSIGNMENT,
            "variabledeclarator", VARIABLE_DECLARATION,
            "variabledeclarationgroup", VARIABLE_DECLARATION,
            "rethrow", THROW);

    private final String displayName;

    OperationKind(final String theDisplayName) {
        this.displayName = theDisplayName;
    }

    /**
     * Returns the kind name as shown to users and in node properties.
     *
     * @return the display name, e.g. {@code Invocation}
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if an operation of this kind may throw at run time.
     *
     * @return true for invocations, element and property reads and throws
     */
    public boolean mayThrow() {
        return this == INVOCATION
                || this == ARRAY_ELEMENT_REFERENCE
                || this == PROPERTY_REFERENCE
                || this == THROW;
    }

    /**
     * Parses a raw kind name, returning OTHER if not recognized.
     *
     * <p>Matching ignores case and underscores, so {@code Invocation},
     * {@code INVOCATION} and {@code invocation} are the same kind.</p>
     *
     * @param value the raw kind name
     * @return the kind, never null
     */
    public static OperationKind fromString(final String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        final String normalized = value.trim().replace("_", "")
                .toLowerCase(Locale.ROOT);

        final OperationKind alias = ALIASES.get(normalized);
        if (alias != null) {
            return alias;
        }
        for (final OperationKind kind : values()) {
            if (kind.displayName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }

}
