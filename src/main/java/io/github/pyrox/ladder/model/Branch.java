package io.github.pyrox.ladder.model;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena entry for one branch or rail of a rung. The id is the arena index; parent and child
 * links are arena indices as well.
 * <p>
 * A {@link BranchKind#STRUCTURE} branch spans its start marker to its end marker. Its parent is
 * the rail hosting it ({@code null} on the main rail). A {@link BranchKind#RAIL} spans its
 * branch-next marker to the element before the next sibling marker; its parent is its structure.
 * <p>
 * Instances are filled in by a single {@link BranchRegistry} walk and are not modified afterwards.
 * Geometry is not stored here; a layout pass reports it separately.
 */
public final class Branch {
    private final int id;
    private final BranchKind kind;
    @Nullable
    private final Integer parentBranchId;
    private final int rootBranchId;
    private final int branchLevel;
    private final int startPosition;
    private final int row;
    private final List<Integer> childBranchIds = new ArrayList<>();
    private int endPosition = -1;
    private int maxRow;

    Branch(int id, BranchKind kind, @Nullable Integer parentBranchId, int rootBranchId,
           int branchLevel, int startPosition, int row)
    {
        this.id = id;
        this.kind = kind;
        this.parentBranchId = parentBranchId;
        this.rootBranchId = rootBranchId;
        this.branchLevel = branchLevel;
        this.startPosition = startPosition;
        this.row = row;
        this.maxRow = row;
    }

    public int id() {
        return id;
    }

    public BranchKind kind() {
        return kind;
    }

    public boolean isRail() {
        return kind == BranchKind.RAIL;
    }

    @Nullable
    public Integer parentBranchId() {
        return parentBranchId;
    }

    public int rootBranchId() {
        return rootBranchId;
    }

    /** Level of the rail this branch sits on; content directly inside has this level + 1. */
    public int branchLevel() {
        return branchLevel;
    }

    public int startPosition() {
        return startPosition;
    }

    public int endPosition() {
        return endPosition;
    }

    /** Sibling rails in discovery order (structures only). */
    public List<Integer> childBranchIds() {
        return Collections.unmodifiableList(childBranchIds);
    }

    /** Visual row the branch opens on, 0 being the main rail. */
    public int row() {
        return row;
    }

    /** Deepest visual row used by the branch, nested content included. */
    public int maxRow() {
        return maxRow;
    }

    void close(int endPosition) {
        this.endPosition = endPosition;
    }

    void addChild(int childId) {
        childBranchIds.add(childId);
    }

    void extendToRow(int row) {
        maxRow = Math.max(maxRow, row);
    }

    @Override
    public String toString() {
        return "Branch{id=%d, %s, parent=%s, positions=%d..%d, level=%d, rows=%d..%d, children=%s}"
                .formatted(id, kind, parentBranchId, startPosition, endPosition, branchLevel, row, maxRow, childBranchIds);
    }
}
