package io.github.pyrox.ladder.edit;

import io.github.pyrox.ladder.BranchNotFoundException;
import io.github.pyrox.ladder.InvalidInsertionPointException;
import io.github.pyrox.ladder.PositionOutOfRangeException;
import io.github.pyrox.ladder.layout.LayoutConfig;
import io.github.pyrox.ladder.layout.RoutineLayout;
import io.github.pyrox.ladder.model.Instruction;
import io.github.pyrox.ladder.model.Routine;
import io.github.pyrox.ladder.model.Rung;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MutationControllerTest {

    private static final Instruction NEW_CONTACT = Instruction.of("XIC", "new");

    private Routine routine;
    private RoutineLayout layout;
    private MutationController controller;

    @BeforeEach
    public void setUp() {
        routine = Routine.ofText("MainRoutine", "XIC(a)XIC(b)OTE(c)", "XIC(x)[XIC(y),XIC(z)]OTE(w)", "OTE(q)");
        layout = new RoutineLayout(routine, LayoutConfig.defaults());
        controller = new MutationController(layout);
    }

    private String text(int rungNumber) {
        return routine.rung(rungNumber).text();
    }

    @Test
    public void testInsertOnMainRail() {
        var invalidation = controller.insertElementAt(0, 2, null, NEW_CONTACT);

        assertEquals("XIC(a)XIC(b)XIC(new)OTE(c);", text(0));
        assertEquals(List.of(0), invalidation.rungNumbers(), "Height unchanged, no cascade");
        assertEquals(2, layout.result(0).element(2).position());
        assertEquals(170, layout.result(0).element(2).x());
        assertEquals(230, layout.result(0).element(3).x(), "Trailing element shifted right");
    }

    @Test
    public void testInsertDeleteRoundTrip() {
        var before = layout.result(1);
        controller.insertElementAt(1, 5, 1, NEW_CONTACT);
        controller.deleteElementAt(1, 5);

        assertEquals("XIC(x)[XIC(y),XIC(z)]OTE(w);", text(1));
        assertEquals(before, layout.result(1), "Geometry restored exactly, branches included");
    }

    @Test
    public void testDeleteRenumbers() {
        controller.deleteElementAt(0, 1);
        assertEquals("XIC(a)OTE(c);", text(0));
        assertEquals(1, routine.rung(0).element(1).position());
    }

    @Test
    public void testInsertOnBranchRail() {
        controller.insertElementAt(1, 5, 1, NEW_CONTACT);
        assertEquals("XIC(x)[XIC(y),XIC(z)XIC(new)]OTE(w);", text(1));
        assertEquals(1, routine.rung(1).element(5).branchId());
        assertEquals(0, routine.rung(1).element(2).branchId(), "Other rail keeps its id");
    }

    @Test
    public void testRejectedInsertsChangeNothing() {
        assertThrows(InvalidInsertionPointException.class, () -> controller.insertElementAt(1, 5, null, NEW_CONTACT));
        assertThrows(BranchNotFoundException.class, () -> controller.insertElementAt(1, 5, 7, NEW_CONTACT));
        assertThrows(PositionOutOfRangeException.class, () -> controller.insertElementAt(1, 99, null, NEW_CONTACT));
        assertThrows(PositionOutOfRangeException.class, () -> controller.insertElementAt(9, 0, null, NEW_CONTACT));

        assertEquals("XIC(x)[XIC(y),XIC(z)]OTE(w);", text(1));
    }

    @Test
    public void testInsertByCoordinates() {
        // x=200 is nearest OTE(c) (centre 190) and right of it
        controller.insertElementAt(200, 80, NEW_CONTACT);
        assertEquals("XIC(a)XIC(b)OTE(c)XIC(new);", text(0));

        // second rail of rung 1 (rows at y=130 and y=190)
        controller.insertElementAt(150, 220, NEW_CONTACT);
        assertEquals("XIC(x)[XIC(y),XIC(new)XIC(z)]OTE(w);", text(1));

        assertThrows(InvalidInsertionPointException.class, () -> controller.insertElementAt(10, 80, NEW_CONTACT),
                     "Left of the power rail");
        assertThrows(InvalidInsertionPointException.class, () -> controller.insertElementAt(100, 5, NEW_CONTACT),
                     "Above every rung");
    }

    @Test
    public void testDeletingMarkersRemovesBranches() {
        var invalidation = controller.deleteElementAt(1, 3);
        assertEquals("XIC(x)[XIC(y)]OTE(w);", text(1));
        assertEquals(List.of(1, 2), invalidation.rungNumbers(), "Rung got shorter, rung below moves up");
        assertEquals(210, layout.rungY(2));

        controller.deleteElementAt(1, 1);
        assertEquals("XIC(x)OTE(w);", text(1));
    }

    @Test
    public void testBranchEdits() {
        var invalidation = controller.insertBranch(0, 0, 2);
        assertEquals("[XIC(a)XIC(b),]OTE(c);", text(0));
        assertEquals(List.of(0, 1, 2), invalidation.rungNumbers());
        assertEquals(190, layout.rungY(1));

        controller.insertBranchLevel(0, 0);
        assertEquals("[XIC(a)XIC(b),,]OTE(c);", text(0));
        assertEquals(2, layout.result(0).maxBranchDepth());

        controller.removeBranch(0, 0);
        assertEquals("OTE(c);", text(0));
        assertEquals(130, layout.rungY(1));
    }

    @Test
    public void testMoveBranch() {
        var invalidation = controller.moveBranch(1, 0, 7);
        assertEquals("XIC(x)OTE(w)[XIC(y),XIC(z)];", text(1));
        assertEquals(List.of(1), invalidation.rungNumbers(), "Same height, no cascade");
        assertEquals(2, layout.result(1).branch(0).startPosition(), "Layout follows the moved branch");
        assertEquals(routine.rung(1).branches().size(), layout.result(1).branches().size());

        assertThrows(InvalidInsertionPointException.class, () -> controller.moveBranch(1, 1, 0));
        assertThrows(BranchNotFoundException.class, () -> controller.moveBranch(0, 0, 0), "Rung 0 has no branches");
        assertEquals("XIC(x)OTE(w)[XIC(y),XIC(z)];", text(1));
    }

    @Test
    public void testMoveAcrossRungs() {
        var invalidation = controller.moveElement(0, 0, 2, 0);
        assertEquals("XIC(b)OTE(c);", text(0));
        assertEquals("XIC(a)OTE(q);", text(2));
        assertTrue(invalidation.rungNumbers().containsAll(List.of(0, 2)));

        controller.moveElement(2, 0, 2, 2);
        assertEquals("OTE(q)XIC(a);", text(2));

        assertThrows(IllegalArgumentException.class, () -> controller.moveElement(1, 1, 0, 0), "Markers do not move");
        assertThrows(PositionOutOfRangeException.class, () -> controller.moveElement(0, 0, 2, 9));
        assertEquals("XIC(b)OTE(c);", text(0), "Rejected move leaves the source alone");
    }

    @Test
    public void testReplaceAndComment() {
        assertEquals(List.of(0), controller.replaceInstruction(0, 0, Instruction.of("TON", "T1", "1000", "0")).rungNumbers());
        assertEquals(80, layout.result(0).element(0).width());

        var invalidation = controller.setComment(0, "Start conditions");
        assertEquals(List.of(0, 1, 2), invalidation.rungNumbers());
        assertEquals(145, layout.rungY(1));
    }

    @Test
    public void testRungEdits() {
        var added = controller.addRung(1, Rung.parse("XIC(k)"));
        assertEquals(List.of(1, 2, 3), added.rungNumbers());
        assertEquals(4, layout.size());
        assertEquals("XIC(k);", text(1));

        var removed = controller.removeRung(0);
        assertEquals(List.of(0, 1, 2), removed.rungNumbers());
        assertEquals(50, layout.rungY(0));

        assertTrue(controller.addRung(new Rung()).rungNumbers().contains(3));
        assertThrows(PositionOutOfRangeException.class, () -> controller.removeRung(10));
    }
}
