package io.github.pyrox.ladder.edit;

import io.github.pyrox.ladder.InvalidInsertionPointException;
import io.github.pyrox.ladder.PositionOutOfRangeException;
import io.github.pyrox.ladder.layout.RoutineLayout;
import io.github.pyrox.ladder.locate.InsertionLocator;
import io.github.pyrox.ladder.model.Instruction;
import io.github.pyrox.ladder.model.Routine;
import io.github.pyrox.ladder.model.Rung;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Single writer for a routine and its layout. Every edit validates first, mutates the rung
 * sequence, then re-lays the touched rung and cascades to the rungs below it.
 * <p>
 * A rejected edit throws before anything is modified.
 */
public final class MutationController {
    private static final Logger logger = LogManager.getLogger(MutationController.class);

    private final Routine routine;
    private final RoutineLayout layout;
    private final InsertionLocator locator;

    public MutationController(RoutineLayout layout) {
        this.layout = Objects.requireNonNull(layout);
        this.routine = layout.routine();
        this.locator = new InsertionLocator(layout);
    }

    public Routine routine() {
        return routine;
    }

    public RoutineLayout layout() {
        return layout;
    }

    public InsertionLocator locator() {
        return locator;
    }

    /**
     * Inserts an instruction at a logical position. {@code branchContext} names the rail the
     * position must be on ({@code null} for the main rail).
     */
    public Invalidation insertElementAt(int rungNumber, int position, @Nullable Integer branchContext,
                                       Instruction instruction)
    {
        var rung = routine.rung(rungNumber);
        var rail = rung.railAt(position);
        if (branchContext != null) {
            rung.branch(branchContext);
        }
        if (!Objects.equals(rail, branchContext)) {
            throw new InvalidInsertionPointException(
                    "Position %d of rung %d is on rail %s, not %s".formatted(position, rungNumber, rail, branchContext));
        }
        var inserted = rung.insertInstruction(position, instruction);
        logger.info("Inserted {} into rung {}", inserted, rungNumber);
        return relayout(rungNumber);
    }

    /**
     * Inserts an instruction at the rail and position under a canvas point.
     */
    public Invalidation insertElementAt(int x, int y, Instruction instruction) {
        if (x < layout.config().leftRailX()) {
            throw new InvalidInsertionPointException("x %d is left of the power rail".formatted(x));
        }
        var target = locator.tryLocate(x, y)
                .orElseThrow(() -> new InvalidInsertionPointException("No rung at (%d, %d)".formatted(x, y)));
        int position = locator.findInsertionPosition(x, target.rungNumber(), target.branchLevel(), target.branchId());
        return insertElementAt(target.rungNumber(), position, target.branchId(), instruction);
    }

    /**
     * Deletes the element at {@code position}. A branch start or end marker removes the whole
     * branch; a branch-next marker removes that rail.
     */
    public Invalidation deleteElementAt(int rungNumber, int position) {
        var rung = routine.rung(rungNumber);
        var element = rung.element(position);
        switch (element.kind()) {
            case INSTRUCTION -> rung.removeInstruction(position);
            case BRANCH_START, BRANCH_END, BRANCH_NEXT -> rung.removeBranch(Objects.requireNonNull(element.branchId()));
        }
        logger.info("Deleted {} from rung {}", element, rungNumber);
        return relayout(rungNumber);
    }

    /** Wraps {@code [start, end)} of one rail in a new two-rail branch. */
    public Invalidation insertBranch(int rungNumber, int start, int end) {
        int id = routine.rung(rungNumber).insertBranch(start, end);
        logger.info("Inserted branch {} at {}..{} of rung {}", id, start, end, rungNumber);
        return relayout(rungNumber);
    }

    /** Adds an empty rail below the rail opened by the marker at {@code markerPosition}. */
    public Invalidation insertBranchLevel(int rungNumber, int markerPosition) {
        int id = routine.rung(rungNumber).insertBranchLevel(markerPosition);
        logger.info("Inserted rail {} into rung {}", id, rungNumber);
        return relayout(rungNumber);
    }

    public Invalidation removeBranch(int rungNumber, int branchId) {
        routine.rung(rungNumber).removeBranch(branchId);
        logger.info("Removed branch {} from rung {}", branchId, rungNumber);
        return relayout(rungNumber);
    }

    /** Moves a whole branch within its rung; {@code to} is an insertion point before the move. */
    public Invalidation moveBranch(int rungNumber, int branchId, int to) {
        int start = routine.rung(rungNumber).moveBranch(branchId, to);
        logger.info("Moved branch {} of rung {} to {}", branchId, rungNumber, start);
        return relayout(rungNumber);
    }

    /**
     * Moves an instruction, within a rung or to another rung. {@code toPosition} is an insertion
     * point in the target rung as it is before the move.
     */
    public Invalidation moveElement(int fromRung, int fromPosition, int toRung, int toPosition) {
        var source = routine.rung(fromRung);
        if (fromRung == toRung) {
            var moved = source.moveInstruction(fromPosition, toPosition);
            logger.info("Moved {} within rung {}", moved, fromRung);
            return relayout(fromRung);
        }

        var target = routine.rung(toRung);
        var element = source.element(fromPosition);
        if (!element.isInstruction()) {
            throw new IllegalArgumentException(
                    "Position %d of rung %d holds %s, not an instruction".formatted(fromPosition, fromRung, element.kind()));
        }
        if (toPosition < 0 || toPosition > target.size()) {
            throw new PositionOutOfRangeException("Insertion point", toPosition, target.size());
        }
        source.removeInstruction(fromPosition);
        var moved = target.insertInstruction(toPosition, Objects.requireNonNull(element.instruction()));
        logger.info("Moved {} from rung {} to rung {}", moved, fromRung, toRung);
        // upper rung first: the lower rung's y derives from it
        var first = relayout(Math.min(fromRung, toRung));
        return first.merge(relayout(Math.max(fromRung, toRung)));
    }

    public Invalidation replaceInstruction(int rungNumber, int position, Instruction instruction) {
        var replaced = routine.rung(rungNumber).replaceInstruction(position, instruction);
        logger.info("Replaced instruction at {} of rung {} with {}", position, rungNumber, replaced);
        return relayout(rungNumber);
    }

    public Invalidation setComment(int rungNumber, @Nullable String comment) {
        routine.rung(rungNumber).setComment(comment);
        logger.info("Set comment of rung {}", rungNumber);
        return relayout(rungNumber);
    }

    public Invalidation addRung(Rung rung) {
        return addRung(routine.size(), rung);
    }

    public Invalidation addRung(int rungNumber, Rung rung) {
        routine.addRung(rungNumber, rung);
        logger.info("Added rung {} to routine {}", rungNumber, routine.name());
        return new Invalidation(layout.rungInserted(rungNumber));
    }

    public Invalidation removeRung(int rungNumber) {
        routine.removeRung(rungNumber);
        logger.info("Removed rung {} from routine {}", rungNumber, routine.name());
        return new Invalidation(layout.rungRemoved(rungNumber));
    }

    private Invalidation relayout(int rungNumber) {
        return new Invalidation(layout.relayoutFrom(rungNumber));
    }
}
