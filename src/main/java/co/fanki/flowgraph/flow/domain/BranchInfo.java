package co.fanki.flowgraph.flow.domain;

import co.fanki.flowgraph.shared.Preconditions;
import co.fanki.flowgraph.shared.ValueObject;

/**
 * What a block branches on.
 *
 * @param condition the summarized condition
 * @param branchType the construct owning the branch
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BranchInfo(String condition, BranchType branchType)
        implements ValueObject {

    /**
     * Validates the branch type.
     */
    public BranchInfo {
        Preconditions.requireNonNull(branchType, "Branch type is required");
        condition = condition == null ? "" : condition;
    }
}
