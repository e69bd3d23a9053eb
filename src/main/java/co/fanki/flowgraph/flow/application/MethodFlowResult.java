package co.fanki.flowgraph.flow.application;

import co.fanki.flowgraph.flow.domain.MethodBlockGraph;
import co.fanki.flowgraph.knowledge.domain.KnowledgeGraph;
import co.fanki.flowgraph.shared.Preconditions;

/**
 * Both artifacts derived from one member: its analyzed flow graph and its
 * knowledge graph projection.
 *
 * @param methodIdentifier the qualified member name
 * @param flowGraph the complete method graph
 * @param knowledgeGraph the flat knowledge graph document
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MethodFlowResult(
        String methodIdentifier,
        MethodBlockGraph flowGraph,
        KnowledgeGraph knowledgeGraph) {

    /**
     * Validates the result.
     */
    public MethodFlowResult {
        Preconditions.requireNonBlank(methodIdentifier,
                "Method identifier is required");
        Preconditions.requireNonNull(flowGraph, "Flow graph is required");
        Preconditions.requireNonNull(knowledgeGraph,
                "Knowledge graph is required");
    }
}
