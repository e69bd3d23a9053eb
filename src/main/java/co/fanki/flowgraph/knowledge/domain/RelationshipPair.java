package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * One end of a relationship, as stored on a node.
 *
 * @param type the relationship type, named from this node's end
 * @param direction whether this node is the source or the target
 * @param targetId the id of the node at the other end
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RelationshipPair(
        RelationshipType type,
        RelationshipDirection direction,
        String targetId) implements ValueObject {

    /**
     * Validates the pair.
     */
    public RelationshipPair {
        Preconditions.requireNonNull(type, "Relationship type is required");
        Preconditions.requireNonNull(direction, "Direction is required");
        Preconditions.requireNonBlank(targetId, "Target id is required");
    }
}
