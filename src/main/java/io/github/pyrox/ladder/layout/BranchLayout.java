package io.github.pyrox.ladder.layout;

import io.github.pyrox.ladder.model.Branch;
import io.github.pyrox.ladder.model.BranchBounds;
import io.github.pyrox.ladder.model.BranchKind;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Laid-out branch or rail: the structural links of a {@link Branch} frozen together with its box.
 *
 * @param row    visual row the branch opens on
 * @param maxRow deepest visual row used by the branch
 */
public record BranchLayout(int id,
                           BranchKind kind,
                           @Nullable Integer parentBranchId,
                           int rootBranchId,
                           List<Integer> childBranchIds,
                           int startPosition,
                           int endPosition,
                           int branchLevel,
                           int row,
                           int maxRow,
                           BranchBounds bounds)
{
    public BranchLayout {
        childBranchIds = List.copyOf(childBranchIds);
    }

    static BranchLayout of(Branch branch, BranchBounds bounds) {
        return new BranchLayout(branch.id(), branch.kind(), branch.parentBranchId(), branch.rootBranchId(),
                                branch.childBranchIds(), branch.startPosition(), branch.endPosition(),
                                branch.branchLevel(), branch.row(), branch.maxRow(), bounds);
    }

    public boolean isRail() {
        return kind == BranchKind.RAIL;
    }
}
