package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a validated raw flow graph into a {@link MethodBlockGraph}.
 *
 * <p>Block ids follow the input order: the first raw block gets id 0 and
 * becomes the entry block. Every block left without successors once its
 * edges are resolved is an exit candidate; the last candidate becomes the
 * exit block of the graph. A block whose only successor was dropped is
 * therefore an exit too.</p>
 *
 * <p>Edges are classified while they are built. A fall-through successor
 * yields a regular edge, a conditional successor yields a conditional
 * edge carrying the branch condition, and any edge whose target does not
 * come after its source becomes a back edge. Successors referencing an
 * ordinal that no block carries are skipped and recorded in the graph
 * diagnostics.</p>
 *
 * <p>The edge list is the single source of the predecessor and successor
 * sets; blocks are only created once all edges are known.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FlowGraphNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(
            FlowGraphNormalizer.class);

    private final OperationSummarizer summarizer;

    /**
     * Creates a new normalizer.
     *
     * @param theSummarizer the summarizer of operations and conditions
     */
    public FlowGraphNormalizer(final OperationSummarizer theSummarizer) {
        this.summarizer = Preconditions.requireNonNull(theSummarizer,
                "Operation summarizer is required");
    }

    /**
     * Normalizes a raw flow graph.
     *
     * @param raw the raw graph, already checked by {@link FlowGraphIngestor}
     * @return the method graph, without metrics
     */
    public MethodBlockGraph normalize(final RawFlowGraph raw) {
        Preconditions.requireNonNull(raw, "Raw flow graph is required");
        Preconditions.requireNonNull(raw.blocks(), "Raw blocks are required");

        final String member = raw.qualifiedName();
        final List<RawBlock> rawBlocks = raw.blocks();
        final List<String> diagnostics = new ArrayList<>();

        final Map<Integer, Integer> idByOrdinal = indexOrdinals(rawBlocks,
                member, diagnostics);
        final List<BranchInfo> branches = new ArrayList<>(rawBlocks.size());
        for (final RawBlock rawBlock : rawBlocks) {
            branches.add(summarizer.summarizeBranch(rawBlock.branchValue()));
        }

        final List<Edge> edges = new ArrayList<>();
        for (int id = 0; id < rawBlocks.size(); id++) {
            final RawBlock rawBlock = rawBlocks.get(id);

            final Integer fallThrough = resolve(idByOrdinal,
                    rawBlock.fallThroughSuccessor(), id, member, diagnostics);
            if (fallThrough != null) {
                edges.add(Edge.fallThrough(id, fallThrough).classified());
            }

            final Integer conditional = resolve(idByOrdinal,
                    rawBlock.conditionalSuccessor(), id, member, diagnostics);
            if (conditional != null) {
                final BranchInfo branch = branches.get(id);
                edges.add(Edge.conditional(id, conditional,
                        branch == null ? null : branch.condition())
                        .classified());
            }
        }

        final List<Set<Integer>> predecessors = new ArrayList<>();
        final List<Set<Integer>> successors = new ArrayList<>();
        for (int i = 0; i < rawBlocks.size(); i++) {
            predecessors.add(new LinkedHashSet<>());
            successors.add(new LinkedHashSet<>());
        }
        for (final Edge edge : edges) {
            successors.get(edge.source()).add(edge.target());
            predecessors.get(edge.target()).add(edge.source());
        }
        final int exitId = findExit(successors);

        final List<BasicBlock> blocks = new ArrayList<>(rawBlocks.size());
        BasicBlock exitBlock = null;
        for (int id = 0; id < rawBlocks.size(); id++) {
            final RawBlock rawBlock = rawBlocks.get(id);
            final List<Operation> operations = new ArrayList<>();
            for (final RawOperation rawOperation : rawBlock.operations()) {
                operations.add(summarizer.summarize(rawOperation));
            }
            final BasicBlock block = new BasicBlock(id,
                    kindOf(id, rawBlock, successors.get(id).isEmpty()),
                    operations,
                    branches.get(id),
                    predecessors.get(id),
                    successors.get(id));
            blocks.add(block);
            if (id == exitId) {
                exitBlock = block;
            }
        }

        LOG.debug("Normalized {}: {} blocks, {} edges, {} diagnostics",
                member, blocks.size(), edges.size(), diagnostics.size());

        return new MethodBlockGraph(raw.displayName(),
                raw.containingTypeName(), raw.sourceLocation(), blocks, edges,
                exitBlock, diagnostics);
    }

    // -- helpers -----------------------------------------------------------

    private Map<Integer, Integer> indexOrdinals(final List<RawBlock> rawBlocks,
            final String member, final List<String> diagnostics) {
        final Map<Integer, Integer> idByOrdinal = new HashMap<>();
        for (int id = 0; id < rawBlocks.size(); id++) {
            final int ordinal = rawBlocks.get(id).ordinal();
            if (idByOrdinal.putIfAbsent(ordinal, id) != null) {
                LOG.warn("Duplicate block ordinal {} in {}, keeping the first",
                        ordinal, member);
                diagnostics.add("Duplicate block ordinal " + ordinal
                        + " at position " + id);
            }
        }
        return idByOrdinal;
    }

    /** Id of the last block with no successor, or -1 when none. */
    private int findExit(final List<Set<Integer>> successors) {
        int exitId = -1;
        for (int id = 0; id < successors.size(); id++) {
            if (successors.get(id).isEmpty()) {
                exitId = id;
            }
        }
        return exitId;
    }

    private Integer resolve(final Map<Integer, Integer> idByOrdinal,
            final Integer ordinal, final int sourceId, final String member,
            final List<String> diagnostics) {
        if (ordinal == null) {
            return null;
        }
        final Integer target = idByOrdinal.get(ordinal);
        if (target == null) {
            LOG.warn("Block {} of {} references unknown block ordinal {},"
                    + " dropping the edge", sourceId, member, ordinal);
            diagnostics.add("Block " + sourceId
                    + " references unknown block ordinal " + ordinal);
        }
        return target;
    }

    private BlockKind kindOf(final int id, final RawBlock rawBlock,
            final boolean noSuccessor) {
        if (id == 0) {
            return BlockKind.ENTRY;
        }
        if (noSuccessor) {
            return BlockKind.EXIT;
        }
        if (rawBlock.exceptionHandler()) {
            return BlockKind.EXCEPTION_HANDLER;
        }
        return BlockKind.BLOCK;
    }

}
