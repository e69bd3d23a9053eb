package co.fanki.flowgraph.knowledge.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * A reference from a container node to one of its children.
 *
 * @param nodeId the id of the child node
 * @param role the role of the child in the container
 * @param order the position of the child among its siblings
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NodeReference(String nodeId, String role, int order)
        implements ValueObject {

    /**
     * Validates the reference.
     */
    public NodeReference {
        Preconditions.requireNonBlank(nodeId, "Referenced node id is required");
        Preconditions.requireNonBlank(role, "Role is required");
    }
}
