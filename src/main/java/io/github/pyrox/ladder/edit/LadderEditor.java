package io.github.pyrox.ladder.edit;

import io.github.pyrox.ladder.LadderException;
import io.github.pyrox.ladder.layout.LayoutResult;
import io.github.pyrox.ladder.locate.InsertionLocator;
import io.github.pyrox.ladder.locate.InsertionPoint;
import io.github.pyrox.ladder.model.RungElementType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Pointer-driven editing state for one open routine.
 * <p>
 * Insert modes drop their template instruction at the clicked point and fall back to
 * {@link EditorMode#VIEW}. {@link EditorMode#INSERT_BRANCH} remembers the clicked point as the
 * branch start and waits in {@link EditorMode#CONNECT_BRANCH} for the end point, which must lie on
 * the same rail. Pressing on the selected instruction starts a {@link EditorMode#DRAG} that ends
 * on release. Clicks that hit nothing usable are logged and leave the routine untouched.
 */
public final class LadderEditor {
    private static final Logger logger = LogManager.getLogger(LadderEditor.class);

    /** Selected element, by rung and sequence position. */
    public record Selection(int rungNumber, int position) {}

    private final MutationController controller;
    private final InsertionLocator locator;
    private EditorMode mode = EditorMode.VIEW;
    @Nullable
    private Selection selection;
    @Nullable
    private InsertionPoint branchAnchor;
    @Nullable
    private Selection dragSource;

    public LadderEditor(MutationController controller) {
        this.controller = Objects.requireNonNull(controller);
        this.locator = controller.locator();
    }

    public EditorMode mode() {
        return mode;
    }

    public void setMode(EditorMode newMode) {
        if (!newMode.isSelectable()) {
            throw new IllegalArgumentException(newMode + " cannot be entered directly");
        }
        logger.debug("Editor mode {} -> {}", mode, newMode);
        resetTo(newMode);
    }

    public void cancel() {
        resetTo(EditorMode.VIEW);
    }

    public Optional<Selection> selection() {
        return Optional.ofNullable(selection);
    }

    /** Drops the selection; callers editing the routine outside this editor must call it. */
    public void clearSelection() {
        selection = null;
    }

    public Optional<InsertionPoint> branchAnchor() {
        return Optional.ofNullable(branchAnchor);
    }

    /** Layout of a rung with the current selection flagged. */
    public LayoutResult renderedRung(int rungNumber) {
        var result = controller.layout().result(rungNumber);
        var selected = selection != null && selection.rungNumber() == rungNumber ? selection.position() : null;
        return result.withSelection(selected);
    }

    /**
     * Handles a click at {@code (x, y)} according to the current mode.
     *
     * @return the rungs that were re-laid, empty when nothing changed
     */
    public Invalidation click(int x, int y) {
        return switch (mode) {
            case VIEW -> {
                select(x, y);
                yield Invalidation.none();
            }
            case INSERT_CONTACT, INSERT_COIL, INSERT_BLOCK -> insertTemplate(x, y);
            case INSERT_BRANCH -> {
                beginBranch(x, y);
                yield Invalidation.none();
            }
            case CONNECT_BRANCH -> connectBranch(x, y);
            case DRAG -> release(x, y);
        };
    }

    /**
     * Starts dragging when the press lands on the selected instruction.
     *
     * @return whether a drag started
     */
    public boolean press(int x, int y) {
        if (mode != EditorMode.VIEW || selection == null) {
            return false;
        }
        var hit = locator.elementAt(x, y);
        if (hit.isEmpty() || hit.get().kind() != RungElementType.INSTRUCTION) {
            return false;
        }
        var element = hit.get();
        if (element.rungNumber() != selection.rungNumber() || element.position() != selection.position()) {
            return false;
        }
        dragSource = selection;
        mode = EditorMode.DRAG;
        logger.debug("Dragging {}", element.source());
        return true;
    }

    /** Drops a dragged instruction at {@code (x, y)}; always ends the drag. */
    public Invalidation release(int x, int y) {
        if (mode != EditorMode.DRAG) {
            return Invalidation.none();
        }
        var source = Objects.requireNonNull(dragSource);
        var point = pointAt(x, y);
        resetTo(EditorMode.VIEW);
        selection = null;
        if (point == null) {
            return Invalidation.none();
        }
        try {
            return controller.moveElement(source.rungNumber(), source.position(), point.rungNumber(), point.position());
        } catch (LadderException e) {
            logger.warn("Drop of {} at ({}, {}) rejected: {}", source, x, y, e.getMessage());
            return Invalidation.none();
        }
    }

    /** Where an insert or drop at {@code (x, y)} would land, in modes that have one. */
    public Optional<InsertionPoint> hover(int x, int y) {
        if (mode == EditorMode.VIEW) {
            return Optional.empty();
        }
        return Optional.ofNullable(pointAt(x, y));
    }

    /** Deletes the selected element; markers take their branch or rail with them. */
    public Invalidation deleteSelection() {
        if (selection == null) {
            return Invalidation.none();
        }
        var target = selection;
        selection = null;
        return controller.deleteElementAt(target.rungNumber(), target.position());
    }

    private void select(int x, int y) {
        selection = locator.elementAt(x, y)
                .map(e -> new Selection(e.rungNumber(), e.position()))
                .orElse(null);
        logger.debug("Selection {}", selection);
    }

    private Invalidation insertTemplate(int x, int y) {
        var template = Objects.requireNonNull(mode.template());
        var point = pointAt(x, y);
        resetTo(EditorMode.VIEW);
        if (point == null) {
            return Invalidation.none();
        }
        var invalidation = controller.insertElementAt(point.rungNumber(), point.position(), point.branchId(), template);
        shiftSelection(point.rungNumber(), point.position(), 1);
        return invalidation;
    }

    private void beginBranch(int x, int y) {
        var point = pointAt(x, y);
        if (point == null) {
            resetTo(EditorMode.VIEW);
            return;
        }
        branchAnchor = point;
        mode = EditorMode.CONNECT_BRANCH;
        logger.debug("Branch anchored at {}", point);
    }

    private Invalidation connectBranch(int x, int y) {
        var anchor = Objects.requireNonNull(branchAnchor);
        var point = pointAt(x, y);
        resetTo(EditorMode.VIEW);
        if (point == null) {
            return Invalidation.none();
        }
        if (point.rungNumber() != anchor.rungNumber() || !Objects.equals(point.branchId(), anchor.branchId())) {
            logger.warn("Branch end {} is not on the rail of its start {}, abandoning", point, anchor);
            return Invalidation.none();
        }
        int start = Math.min(anchor.position(), point.position());
        int end = Math.max(anchor.position(), point.position());
        var invalidation = controller.insertBranch(anchor.rungNumber(), start, end);
        // start marker lands at start; next and end markers land at end
        shiftSelection(anchor.rungNumber(), end, 2);
        shiftSelection(anchor.rungNumber(), start, 1);
        return invalidation;
    }

    /**
     * Keeps the selection on the same element after {@code count} elements were spliced in at
     * {@code position} of {@code rungNumber}.
     */
    private void shiftSelection(int rungNumber, int position, int count) {
        if (selection != null && selection.rungNumber() == rungNumber && selection.position() >= position) {
            selection = new Selection(rungNumber, selection.position() + count);
        }
    }

    @Nullable
    private InsertionPoint pointAt(int x, int y) {
        if (x < controller.layout().config().leftRailX()) {
            logger.warn("Click at ({}, {}) is left of the power rail", x, y);
            return null;
        }
        var target = locator.tryLocate(x, y);
        if (target.isEmpty()) {
            logger.warn("Click at ({}, {}) hits no rung", x, y);
            return null;
        }
        var t = target.get();
        int position = locator.findInsertionPosition(x, t.rungNumber(), t.branchLevel(), t.branchId());
        return new InsertionPoint(t.rungNumber(), position, t.branchLevel(), t.branchId());
    }

    private void resetTo(EditorMode newMode) {
        mode = newMode;
        branchAnchor = null;
        dragSource = null;
    }
}
