package io.github.pyrox.ladder.layout;

import io.github.pyrox.ladder.model.Branch;
import io.github.pyrox.ladder.model.BranchBounds;
import io.github.pyrox.ladder.model.BranchRegistry;
import io.github.pyrox.ladder.model.Rung;
import io.github.pyrox.ladder.model.RungElement;
import io.github.pyrox.ladder.model.RungElementType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Computes coordinates for every element of a single rung in one left-to-right pass.
 * <p>
 * Each rail keeps its own x cursor. A branch-next marker returns to the x of its branch's start
 * marker and opens a new row below everything the branch used so far; the end marker lands right
 * of the widest rail. Elements are centred vertically on their row's wire line.
 * <p>
 * The engine is stateless: laying out the same rung twice yields equal results.
 */
public final class LayoutEngine {
    private static final Logger logger = LogManager.getLogger(LayoutEngine.class);

    private static final int NO_CURSOR = Integer.MIN_VALUE;

    private final LayoutConfig config;

    public LayoutEngine(LayoutConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public LayoutConfig config() {
        return config;
    }

    /**
     * Lays out {@code rung} with its top edge at {@code rungY}.
     *
     * @throws io.github.pyrox.ladder.UnbalancedBranchException if the marker ids stored on the rung
     *         disagree with the branch structure found by the walk
     */
    public LayoutResult layout(Rung rung, int rungNumber, int rungY) {
        var result = new Pass(rung, rungNumber, rungY).run();
        logger.trace("Rung {} laid out at y={} height={} ({} elements, {} branches)",
                     rungNumber, rungY, result.height(), result.elements().size(), result.branches().size());
        return result;
    }

    /** Height of the comment band above the main row. */
    public int commentHeight(Rung rung) {
        return rung.commentLineCount() * config.commentLineHeight();
    }

    private record Anchor(int x, int y) {}

    /** Geometry state of one open branch; mirrors the registry's open stack. */
    private static final class OpenGeometry {
        final Branch structure;
        final LayoutElement start;
        final List<Branch> rails = new ArrayList<>();
        final List<Anchor> railEnds = new ArrayList<>();
        int cursor;
        Anchor tail;
        int widest;

        OpenGeometry(Branch structure, LayoutElement start) {
            this.structure = structure;
            this.start = start;
            this.cursor = start.right();
            this.tail = new Anchor(start.right(), start.centerY());
            this.widest = start.right();
        }

        void endRail() {
            railEnds.add(tail);
            widest = Math.max(widest, cursor);
        }
    }

    private final class Pass {
        private final Rung rung;
        private final int rungNumber;
        private final int rungY;
        private final int commentHeight;
        private final BranchRegistry registry = new BranchRegistry();
        private final Deque<OpenGeometry> open = new ArrayDeque<>();
        private final List<LayoutElement> elements = new ArrayList<>();
        private final List<WireSegment> wires = new ArrayList<>();
        private int mainCursor = NO_CURSOR;
        private Anchor mainTail;
        private int contentRight;

        Pass(Rung rung, int rungNumber, int rungY) {
            this.rung = rung;
            this.rungNumber = rungNumber;
            this.rungY = rungY;
            this.commentHeight = commentHeight(rung);
            this.mainTail = new Anchor(config.leftRailX(), wireY(0));
            this.contentRight = config.leftRailX();
        }

        LayoutResult run() {
            for (var element : rung.elements()) {
                switch (element.kind()) {
                    case INSTRUCTION -> placeInstruction(element);
                    case BRANCH_START -> placeStart(element);
                    case BRANCH_NEXT -> placeNext(element);
                    case BRANCH_END -> placeEnd(element);
                }
            }
            registry.finish(rung.size());
            int maxRow = registry.maxRow();
            int height = commentHeight + config.rungHeight() + maxRow * config.branchSpacing();
            var branches = registry.branches().stream()
                    .map(b -> BranchLayout.of(b, registry.bounds(b.id())))
                    .toList();
            return new LayoutResult(rungNumber, rungY, height, commentHeight, maxRow, contentRight,
                                    elements, branches, wires);
        }

        private void placeInstruction(RungElement element) {
            int row = registry.currentRow();
            var placed = place(element, nextX(), row, registry.depth(), registry.currentRailId());
            connect(placed);
            advance(placed);
        }

        private void placeStart(RungElement element) {
            int level = registry.depth();
            int row = registry.currentRow();
            int x = nextX();
            var structure = registry.openBranch(element.position(), element.branchId());
            var placed = place(element, x, row, level, structure.id());
            connect(placed);
            open.push(new OpenGeometry(structure, placed));
        }

        private void placeNext(RungElement element) {
            var rail = registry.nextRail(element.position(), element.branchId());
            var top = Objects.requireNonNull(open.peek());
            top.endRail();
            var placed = place(element, top.start.x(), rail.row(), registry.depth(), rail.id());
            wires.add(new WireSegment(top.start.centerX(), top.start.centerY(), placed.centerX(), placed.centerY()));
            top.rails.add(rail);
            top.cursor = placed.right();
            top.tail = new Anchor(placed.right(), placed.centerY());
        }

        private void placeEnd(RungElement element) {
            var structure = registry.closeBranch(element.position(), element.branchId());
            var top = Objects.requireNonNull(open.poll());
            top.endRail();
            int x = top.widest + config.horizontalGap();
            var placed = place(element, x, structure.row(), registry.depth(), structure.id());

            for (var end : top.railEnds) {
                if (end.y() == placed.centerY()) {
                    addWire(end.x(), end.y(), placed.x(), end.y());
                } else {
                    addWire(end.x(), end.y(), placed.centerX(), end.y());
                    addWire(placed.centerX(), end.y(), placed.centerX(), placed.centerY());
                }
            }

            int startX = top.start.x();
            int endX = placed.right();
            registry.setBounds(structure.id(), new BranchBounds(startX, endX, wireY(structure.row()),
                                                                rowTop(structure.row()), rowBottom(structure.maxRow())));
            for (var rail : top.rails) {
                registry.setBounds(rail.id(), new BranchBounds(startX, endX, wireY(rail.row()),
                                                               rowTop(rail.row()), rowBottom(rail.maxRow())));
            }
            registry.reconcileChildren(structure);
            advance(placed);
        }

        private LayoutElement place(RungElement element, int x, int row, int level, @Nullable Integer branchId) {
            int width = config.widthOf(element);
            int height = config.heightOf(element);
            int y = wireY(row) - height / 2;
            var instructionKind = element.kind() == RungElementType.INSTRUCTION
                                  ? Objects.requireNonNull(element.instruction()).kind()
                                  : null;
            var placed = new LayoutElement(element.kind(), instructionKind, x, y, width, height,
                                           rungNumber, level, branchId, row, element, false);
            elements.add(placed);
            contentRight = Math.max(contentRight, placed.right());
            return placed;
        }

        private int nextX() {
            int cursor = open.isEmpty() ? mainCursor : open.peek().cursor;
            return cursor == NO_CURSOR ? config.leftRailX() + config.railOffset() : cursor + config.horizontalGap();
        }

        private void connect(LayoutElement placed) {
            var tail = open.isEmpty() ? mainTail : open.peek().tail;
            addWire(tail.x(), tail.y(), placed.x(), placed.centerY());
        }

        private void advance(LayoutElement placed) {
            var tail = new Anchor(placed.right(), placed.centerY());
            var top = open.peek();
            if (top == null) {
                mainCursor = placed.right();
                mainTail = tail;
            } else {
                top.cursor = placed.right();
                top.tail = tail;
            }
        }

        private void addWire(int x1, int y1, int x2, int y2) {
            if (x1 != x2 || y1 != y2) {
                wires.add(new WireSegment(x1, y1, x2, y2));
            }
        }

        private int rowTop(int row) {
            return rungY + commentHeight + row * config.branchSpacing();
        }

        private int rowBottom(int row) {
            return rowTop(row) + config.rungHeight() - 1;
        }

        private int wireY(int row) {
            return rowTop(row) + config.rungHeight() / 2;
        }
    }
}
