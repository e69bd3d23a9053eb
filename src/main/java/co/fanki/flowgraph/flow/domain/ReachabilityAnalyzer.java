package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Marks the blocks of a method graph that execution can reach.
 *
 * <p>Breadth-first walk over successors starting at the entry block.
 * Blocks the walk never visits keep their unreachable flag and stand for
 * dead code.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReachabilityAnalyzer {

    /**
     * Marks every block reachable from the entry block.
     *
     * @param graph the graph to analyze
     * @return the number of reachable blocks, 0 when there is no entry
     */
    public int analyze(final MethodBlockGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final BasicBlock entry = graph.entryBlock();
        if (entry == null) {
            return 0;
        }

        final Set<Integer> visited = new HashSet<>();
        final Queue<Integer> queue = new ArrayDeque<>();

        visited.add(entry.id());
        queue.add(entry.id());

        while (!queue.isEmpty()) {
            final int blockId = queue.poll();
            final BasicBlock block = graph.block(blockId).orElse(null);
            if (block == null) {
                continue;
            }
            block.markReachable();
            for (final Integer successor : block.successors()) {
                if (visited.add(successor)) {
                    queue.add(successor);
                }
            }
        }

        return visited.size();
    }

}
