package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.ValueObject;

/**
 * The condition under which a conditional edge is followed.
 *
 * @param booleanValue the branch outcome the edge stands for
 * @param description the summarized condition
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record EdgeCondition(boolean booleanValue, String description)
        implements ValueObject {

    /**
     * Normalizes a missing description to an empty one.
     */
    public EdgeCondition {
        description = description == null ? "" : description;
    }

    @Override
    public String toString() {
        return description + " == " + booleanValue;
    }
}
