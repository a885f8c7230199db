package io.github.pyrox.ladder.layout;

import io.github.pyrox.ladder.BranchNotFoundException;
import io.github.pyrox.ladder.PositionOutOfRangeException;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Geometry of one laid-out rung. The rung occupies {@code [y, y + height)}; its main rail row
 * starts at {@code y + commentHeight}.
 *
 * @param branches    branches of this layout pass, indexed by id
 * @param contentRight right edge of the widest element, used to place the right power rail
 */
public record LayoutResult(int rungNumber,
                           int y,
                           int height,
                           int commentHeight,
                           int maxBranchDepth,
                           int contentRight,
                           List<LayoutElement> elements,
                           List<BranchLayout> branches,
                           List<WireSegment> wires)
{
    public LayoutResult {
        elements = List.copyOf(elements);
        branches = List.copyOf(branches);
        wires = List.copyOf(wires);
    }

    /** First y below the rung. */
    public int bottom() {
        return y + height;
    }

    public boolean containsY(int py) {
        return py >= y && py < bottom();
    }

    public LayoutElement element(int position) {
        if (position < 0 || position >= elements.size()) {
            throw new PositionOutOfRangeException("Element", position, elements.size() - 1);
        }
        return elements.get(position);
    }

    public BranchLayout branch(int branchId) {
        if (branchId < 0 || branchId >= branches.size()) {
            throw new BranchNotFoundException(branchId);
        }
        return branches.get(branchId);
    }

    /**
     * Copy with exactly the element at {@code position} flagged selected, or nothing selected
     * for {@code null}.
     */
    public LayoutResult withSelection(@Nullable Integer position) {
        var marked = elements.stream()
                .map(e -> e.withSelected(position != null && e.position() == position))
                .toList();
        return new LayoutResult(rungNumber, y, height, commentHeight, maxBranchDepth, contentRight,
                                marked, branches, wires);
    }
}
