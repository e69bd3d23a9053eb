package co.fanki.flowgraph.knowledge.domain;

import java.util.Locale;

/**
 * Which end of a relationship a node sits on.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RelationshipDirection {

    /** The node is the source of the relationship. */
    OUTGOING,

    /** The node is the target of the relationship. */
    INCOMING;

    /**
     * Returns the direction as written in graph documents.
     *
     * @return {@code outgoing} or {@code incoming}
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

}
