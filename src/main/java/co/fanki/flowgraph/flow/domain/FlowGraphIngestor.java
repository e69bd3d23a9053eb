package co.fanki.flowgraph.flow.domain;

/**
 * Entry point of the pipeline: checks that a raw flow graph can be
 * converted at all.
 *
 * <p>A missing graph, or a graph whose block list is missing, is reported
 * with {@link FlowGraphException#MISSING_INPUT}. An empty block list is
 * accepted; it produces a graph with no blocks.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowGraphIngestor {

    /**
     * Validates a raw flow graph.
     *
     * @param raw the raw graph handed over by the front end, may be null
     * @return the same graph, once validated
     * @throws FlowGraphException if the graph is missing or unnamed
     */
    public RawFlowGraph ingest(final RawFlowGraph raw) {
        if (raw == null) {
            throw FlowGraphException.missingInput("Raw flow graph");
        }
        if (!raw.constructor() && (raw.name() == null || raw.name().isBlank())) {
            throw FlowGraphException.invalidInput(
                    "Raw flow graph of a method must carry its name", null);
        }
        if (raw.blocks() == null) {
            throw FlowGraphException.missingInput(
                    "Block list of " + raw.qualifiedName());
        }
        for (int i = 0; i < raw.blocks().size(); i++) {
            if (raw.blocks().get(i) == null) {
                throw FlowGraphException.invalidInput("Block at position " + i
                        + " of " + raw.qualifiedName() + " is null", null);
            }
        }
        return raw;
    }

}
