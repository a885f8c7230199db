package io.github.pyrox.ladder.model;

import io.github.pyrox.ladder.BranchNotFoundException;
import io.github.pyrox.ladder.UnbalancedBranchException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracks branches during one left-to-right walk of a rung sequence: a stack of open branches and
 * an arena of every branch discovered so far, indexed by dense id.
 * <p>
 * Both the rung (when re-indexing) and the layout engine drive a fresh registry through the same
 * calls, so ids assigned by one walk match the ids found by the other. Passing the id an element
 * already carries as {@code expectedId} turns any disagreement into an
 * {@link UnbalancedBranchException}.
 */
public final class BranchRegistry {
    private final List<Branch> arena = new ArrayList<>();
    private final Deque<OpenBranch> open = new ArrayDeque<>();
    private final Map<Integer, BranchBounds> bounds = new HashMap<>();
    private int maxRow;

    private static final class OpenBranch {
        final Branch structure;
        Branch rail;

        OpenBranch(Branch structure) {
            this.structure = structure;
            this.rail = structure;
        }
    }

    /**
     * Opens a branch at {@code position} on the current rail and makes its first rail current.
     */
    public Branch openBranch(int position, @Nullable Integer expectedId) {
        int id = allocate(position, expectedId);
        var host = open.peek();
        var branch = new Branch(id,
                                BranchKind.STRUCTURE,
                                host == null ? null : host.rail.id(),
                                host == null ? id : host.structure.rootBranchId(),
                                open.size(),
                                position,
                                currentRow());
        arena.add(branch);
        open.push(new OpenBranch(branch));
        return branch;
    }

    /**
     * Records a sibling rail of the top-of-stack branch. The previous rail ends just before
     * {@code position}; the new rail starts on the row below everything the branch used so far.
     */
    public Branch nextRail(int position, @Nullable Integer expectedId) {
        var top = open.peek();
        if (top == null) {
            throw new UnbalancedBranchException("Branch-next marker outside of any branch", position);
        }
        int id = allocate(position, expectedId);
        closeRail(top, position);
        var structure = top.structure;
        var rail = new Branch(id,
                              BranchKind.RAIL,
                              structure.id(),
                              structure.rootBranchId(),
                              structure.branchLevel(),
                              position,
                              structure.maxRow() + 1);
        arena.add(rail);
        structure.addChild(id);
        structure.extendToRow(rail.row());
        maxRow = Math.max(maxRow, rail.row());
        top.rail = rail;
        return rail;
    }

    /**
     * Pops the top-of-stack branch at its end marker and hands the rows it used to the rail
     * hosting it.
     */
    public Branch closeBranch(int position, @Nullable Integer expectedId) {
        var top = open.poll();
        if (top == null) {
            throw new UnbalancedBranchException("Branch end without a matching branch start", position);
        }
        var structure = top.structure;
        if (expectedId != null && expectedId != structure.id()) {
            throw new UnbalancedBranchException(
                    "Branch end for %d closes open branch %d".formatted(expectedId, structure.id()), position);
        }
        closeRail(top, position);
        structure.close(position);
        var host = open.peek();
        if (host != null) {
            host.rail.extendToRow(structure.maxRow());
            host.structure.extendToRow(structure.maxRow());
        }
        return structure;
    }

    /**
     * Verifies the walk ended with every branch closed.
     */
    public void finish(int position) {
        var top = open.peek();
        if (top != null) {
            throw new UnbalancedBranchException("Branch " + top.structure.id() + " is never closed", position);
        }
    }

    /** Records the laid-out box of a branch or rail found by this walk. */
    public void setBounds(int branchId, BranchBounds box) {
        branch(branchId);
        bounds.put(branchId, box);
    }

    /**
     * Box recorded for {@code branchId}.
     *
     * @throws IllegalStateException if the branch has not been laid out yet
     */
    public BranchBounds bounds(int branchId) {
        var box = bounds.get(branch(branchId).id());
        if (box == null) {
            throw new IllegalStateException("Branch " + branchId + " has no bounds yet");
        }
        return box;
    }

    /**
     * Trims each rail's band to end just above the next sibling's band; the last rail extends to
     * the bottom of its structure. Needs bounds on the structure and all of its rails.
     */
    public void reconcileChildren(Branch structure) {
        int structureEndY = bounds(structure.id()).endY();
        var children = structure.childBranchIds();
        for (int i = 0; i < children.size(); i++) {
            int childId = children.get(i);
            int endY = i + 1 < children.size()
                       ? bounds(children.get(i + 1)).startY() - 1
                       : structureEndY;
            bounds.put(childId, bounds(childId).withEndY(endY));
        }
    }

    /** Number of open branches, i.e. the branch level of an element placed now. */
    public int depth() {
        return open.size();
    }

    /** Rail currently receiving elements, {@code null} for the main rail. */
    @Nullable
    public Integer currentRailId() {
        var top = open.peek();
        return top == null ? null : top.rail.id();
    }

    @Nullable
    public Integer currentRootId() {
        var top = open.peek();
        return top == null ? null : top.structure.rootBranchId();
    }

    @Nullable
    public Branch currentStructure() {
        var top = open.peek();
        return top == null ? null : top.structure;
    }

    public int currentRow() {
        var top = open.peek();
        return top == null ? 0 : top.rail.row();
    }

    /** Deepest row used by any rail so far. */
    public int maxRow() {
        return maxRow;
    }

    public Branch branch(int id) {
        if (id < 0 || id >= arena.size()) {
            throw new BranchNotFoundException(id);
        }
        return arena.get(id);
    }

    public List<Branch> branches() {
        return Collections.unmodifiableList(arena);
    }

    private int allocate(int position, @Nullable Integer expectedId) {
        int id = arena.size();
        if (expectedId != null && expectedId != id) {
            throw new UnbalancedBranchException(
                    "Branch marker carries id %d but the walk produced %d".formatted(expectedId, id), position);
        }
        return id;
    }

    private static void closeRail(OpenBranch top, int position) {
        if (top.rail.isRail()) {
            top.rail.close(position - 1);
        }
    }
}
