package co.fanki.flowgraph.flow.domain;

import java.util.Locale;

/**
 * The construct a block branches for.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum BranchType {

    /** An if statement or conditional expression. */
    CONDITIONAL,

    /** The condition of a for, foreach or while loop. */
    LOOP,

    /** A switch statement or expression. */
    SWITCH;

    /**
     * Parses a raw branch type, defaulting to CONDITIONAL.
     *
     * @param value the raw branch type, may be null
     * @return the branch type, never null
     */
    public static BranchType fromString(final String value) {
        if (value == null || value.isBlank()) {
            return CONDITIONAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            return CONDITIONAL;
        }
    }

}
