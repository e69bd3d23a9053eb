package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * The three-level type of a knowledge node.
 *
 * @param primary the broad family, e.g. {@code method} or {@code basic-block}
 * @param secondary the family member, e.g. {@code entry-block}
 * @param custom a free classification, e.g. {@code loop-method}
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeType(String primary, String secondary, String custom)
        implements ValueObject {

    /**
     * Validates the primary type.
     */
    public NodeType {
        Preconditions.requireNonBlank(primary, "Primary type is required");
    }
}
