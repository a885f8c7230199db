package io.github.pyrox.ladder.model;

import io.github.pyrox.ladder.BranchNotFoundException;
import io.github.pyrox.ladder.InvalidInsertionPointException;
import io.github.pyrox.ladder.PositionOutOfRangeException;
import io.github.pyrox.ladder.UnbalancedBranchException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RungTest {

    private static final String TWO_RAILS = "XIC(a)[XIC(b),XIC(c)]OTE(d)";

    @Test
    public void testSingleBranchIndexing() {
        var rung = Rung.parse("XIC(a)[XIC(b)]");

        var branch = rung.branch(0);
        assertEquals(1, branch.startPosition());
        assertEquals(3, branch.endPosition());
        assertEquals(1, rung.element(2).branchLevel(), "Content inside the branch is one level deeper");
        assertEquals(0, rung.element(2).branchId());
        assertEquals(0, rung.element(3).branchLevel(), "End marker sits on the hosting rail");
        assertNull(rung.element(0).branchId());
    }

    @Test
    public void testNestedBranchIndexing() {
        var rung = Rung.parse("XIC(a)[XIC(b),XIO(c)[XIC(d),XIC(e)]]OTE(f)");

        assertEquals(4, rung.branches().size());
        var outer = rung.branch(0);
        assertEquals(BranchKind.STRUCTURE, outer.kind());
        assertEquals(List.of(1), outer.childBranchIds());
        assertEquals(10, outer.endPosition());

        var rail = rung.branch(1);
        assertTrue(rail.isRail());
        assertEquals(3, rail.startPosition());
        assertEquals(9, rail.endPosition());

        var nested = rung.branch(2);
        assertEquals(1, nested.parentBranchId(), "Nested branch hangs off the rail hosting it");
        assertEquals(0, nested.rootBranchId());
        assertEquals(1, nested.branchLevel());
        assertEquals(List.of(3), nested.childBranchIds());

        assertEquals(2, rung.element(8).branchLevel());
        assertEquals(3, rung.element(8).branchId());
        assertEquals(0, rung.element(8).rootBranchId());
        assertEquals(2, rung.maxBranchDepth());
        assertEquals(0, rung.element(11).branchLevel());
    }

    @Test
    public void testUnbalancedMarkersRejected() {
        assertThrows(UnbalancedBranchException.class, () -> Rung.parse("XIC(a)]"));
        assertThrows(UnbalancedBranchException.class, () -> Rung.parse("[XIC(a)"));
        assertThrows(UnbalancedBranchException.class, () -> Rung.parse(",XIC(a)"));
    }

    @Test
    public void testInsertShiftsTrailingPositions() {
        var rung = Rung.parse("XIC(a)XIC(b)OTE(c)");
        var inserted = rung.insertInstruction(2, Instruction.of("XIC", "new"));

        assertEquals(2, inserted.position());
        assertEquals("XIC(a)XIC(b)XIC(new)OTE(c);", rung.text());
        assertEquals(3, rung.element(3).position());
        for (int i = 0; i < rung.size(); i++) {
            assertEquals(i, rung.element(i).position(), "Positions stay dense");
        }
    }

    @Test
    public void testRemoveRenumbersAndKeepsBranchesConsistent() {
        var rung = Rung.parse("XIC(a)XIC(b)XIC(c)OTE(d)");
        rung.removeInstruction(1);
        assertEquals("XIC(a)XIC(c)OTE(d);", rung.text());
        assertEquals(1, rung.element(1).position());
        assertEquals(2, rung.element(2).position());

        var branched = Rung.parse("XIC(a)XIC(b)[XIC(c),XIC(d)]");
        branched.removeInstruction(1);
        assertEquals(1, branched.branch(0).startPosition());
        assertEquals(5, branched.branch(0).endPosition());
        assertEquals(3, branched.branch(1).startPosition());
    }

    @Test
    public void testFailedEditLeavesRungUntouched() {
        var rung = Rung.parse(TWO_RAILS);
        var before = rung.elements();

        assertThrows(PositionOutOfRangeException.class, () -> rung.insertInstruction(99, Instruction.of("XIC", "x")));
        assertThrows(InvalidInsertionPointException.class, () -> rung.insertBranch(1, 3),
                     "Endpoints on the main rail and inside the branch");
        assertThrows(InvalidInsertionPointException.class, () -> rung.insertBranch(3, 1));
        assertThrows(IllegalArgumentException.class, () -> rung.removeInstruction(1), "Markers are not instructions");

        assertEquals(before, rung.elements());
        assertEquals(TWO_RAILS + ";", rung.text());
    }

    @Test
    public void testInsertBranch() {
        var rung = Rung.parse("XIC(a)XIC(b)OTE(c)");
        int id = rung.insertBranch(0, 2);

        assertEquals(0, id);
        assertEquals("[XIC(a)XIC(b),]OTE(c);", rung.text());
        assertEquals(1, rung.branch(0).childBranchIds().size());
        assertEquals(1, rung.maxBranchDepth());
    }

    @Test
    public void testInsertBranchLevel() {
        var fromStart = Rung.parse("XIC(a)[XIC(b),XIC(c)]");
        assertEquals(1, fromStart.insertBranchLevel(1));
        assertEquals("XIC(a)[XIC(b),,XIC(c)];", fromStart.text(), "New rail goes directly below the first rail");

        var fromNext = Rung.parse("XIC(a)[XIC(b),XIC(c)]");
        assertEquals(2, fromNext.insertBranchLevel(3));
        assertEquals("XIC(a)[XIC(b),XIC(c),];", fromNext.text());
        assertEquals(2, fromNext.maxBranchDepth());

        assertThrows(InvalidInsertionPointException.class, () -> fromNext.insertBranchLevel(0));
    }

    @Test
    public void testRemoveBranchAndRail() {
        var rung = Rung.parse(TWO_RAILS);
        rung.removeBranch(1);
        assertEquals("XIC(a)[XIC(b)]OTE(d);", rung.text());

        rung.removeBranch(0);
        assertEquals("XIC(a)OTE(d);", rung.text());
        assertFalse(rung.hasBranches());
        assertEquals(0, rung.maxBranchDepth());
    }

    @Test
    public void testMoveInstruction() {
        var rung = Rung.parse("XIC(a)XIC(b)OTE(c)");
        rung.moveInstruction(0, 2);
        assertEquals("XIC(b)XIC(a)OTE(c);", rung.text());

        rung.moveInstruction(2, 0);
        assertEquals("OTE(c)XIC(b)XIC(a);", rung.text());

        var branched = Rung.parse("XIC(a)[XIC(b),]");
        var moved = branched.moveInstruction(0, 4);
        assertEquals("[XIC(b),XIC(a)];", branched.text());
        assertEquals(1, moved.branchId(), "Moved onto the second rail");
    }

    @Test
    public void testMoveBranch() {
        var rung = Rung.parse(TWO_RAILS);
        assertEquals(2, rung.moveBranch(0, 7), "Start marker lands after the trailing coil");
        assertEquals("XIC(a)OTE(d)[XIC(b),XIC(c)];", rung.text());

        assertEquals(0, rung.moveBranch(0, 0));
        assertEquals("[XIC(b),XIC(c)]XIC(a)OTE(d);", rung.text());
        assertEquals(List.of(Instruction.of("XIC", "c")), rung.instructionsOnRail(1), "Rails travel with their branch");
        assertIndexed(rung);

        assertEquals(0, rung.moveBranch(0, 5), "Right after the end marker is where it already is");
        assertEquals("[XIC(b),XIC(c)]XIC(a)OTE(d);", rung.text());
    }

    @Test
    public void testRejectedBranchMovesLeaveRungUntouched() {
        var rung = Rung.parse(TWO_RAILS);
        assertThrows(InvalidInsertionPointException.class, () -> rung.moveBranch(1, 0), "Rails cannot leave their branch");
        assertThrows(InvalidInsertionPointException.class, () -> rung.moveBranch(0, 3), "Not into itself");
        assertThrows(InvalidInsertionPointException.class, () -> rung.moveBranch(0, 5), "Not before its own end marker");
        assertThrows(PositionOutOfRangeException.class, () -> rung.moveBranch(0, 8));
        assertThrows(BranchNotFoundException.class, () -> rung.moveBranch(4, 0));
        assertEquals("XIC(a)[XIC(b),XIC(c)]OTE(d);", rung.text());
    }

    @Test
    public void testMoveNestedBranchOut() {
        var rung = Rung.parse("XIC(a)[XIC(b),XIO(c)[XIC(d),XIC(e)]]OTE(f)");
        rung.moveBranch(2, 0);
        assertEquals("[XIC(d),XIC(e)]XIC(a)[XIC(b),XIO(c)]OTE(f);", rung.text());
        assertNull(rung.branch(0).parentBranchId(), "Now hosted by the main rail");
        assertIndexed(rung);
    }

    @Test
    public void testInstructionQueries() {
        var rung = Rung.parse("XIC(a)[XIC(b),XIO(c)[XIC(d),XIC(e)]]OTE(f)");
        assertEquals(List.of(Instruction.of("XIC", "a"), Instruction.of("OTE", "f")), rung.mainRailInstructions());
        assertEquals(List.of(Instruction.of("XIC", "b")), rung.instructionsOnRail(0), "First rail shares the branch id");
        assertEquals(List.of(Instruction.of("XIO", "c")), rung.instructionsOnRail(1), "Nested content excluded");
        assertEquals(List.of(Instruction.of("XIC", "b"), Instruction.of("XIO", "c"), Instruction.of("XIC", "d"),
                             Instruction.of("XIC", "e")),
                     rung.branchInstructions(0));
        assertEquals(List.of(Instruction.of("XIO", "c"), Instruction.of("XIC", "d"), Instruction.of("XIC", "e")),
                     rung.branchInstructions(1), "Rail content includes its nested branch");
        assertThrows(BranchNotFoundException.class, () -> rung.instructionsOnRail(9));

        assertTrue(rung.hasInstruction("XIC(d)"));
        assertTrue(rung.hasInstruction("OTE(f)"));
        assertFalse(rung.hasInstruction("XIO(d)"), "Mnemonic must match too");
        assertFalse(rung.hasInstruction("XIC(z)"));
    }

    @Test
    public void testReplaceInstruction() {
        var rung = Rung.parse("XIC(a)OTE(b)");
        rung.replaceInstruction(1, Instruction.of("OTL", "b"));
        assertEquals("XIC(a)OTL(b);", rung.text());
        assertThrows(PositionOutOfRangeException.class, () -> rung.replaceInstruction(5, Instruction.of("OTE", "x")));
    }

    @Test
    public void testRailAt() {
        var rung = Rung.parse(TWO_RAILS);
        assertNull(rung.railAt(0));
        assertEquals(0, rung.railAt(2));
        assertEquals(1, rung.railAt(4));
        assertNull(rung.railAt(6), "After the end marker we are back on the main rail");
    }

    @Test
    public void testCommentLines() {
        var rung = Rung.parse("XIC(a)", "first\nsecond");
        assertEquals(2, rung.commentLineCount());
        rung.setComment("  ");
        assertEquals(0, rung.commentLineCount());
        rung.setComment(null);
        assertEquals(0, rung.commentLineCount());
    }

    @Test
    public void testIndexingInvariantsSurviveEdits() {
        var rung = Rung.parse("XIC(a)[XIC(b),XIO(c)[XIC(d),XIC(e)]]OTE(f)");
        assertIndexed(rung);
        rung.insertInstruction(6, Instruction.of("XIC", "g"));
        assertIndexed(rung);
        rung.insertBranchLevel(5);
        assertIndexed(rung);
        rung.insertBranch(0, 1);
        assertIndexed(rung);
        rung.removeBranch(3);
        assertIndexed(rung);
        rung.moveInstruction(rung.size() - 1, 0);
        assertIndexed(rung);
    }

    private static void assertIndexed(Rung rung) {
        for (int i = 0; i < rung.size(); i++) {
            assertEquals(i, rung.element(i).position(), "Positions are 0..n-1 in " + rung.text());
        }
        for (var branch : rung.branches()) {
            assertTrue(branch.startPosition() <= branch.endPosition(), "Closed branch " + branch);
            if (branch.isRail()) {
                continue;
            }
            for (int p = branch.startPosition() + 1; p < branch.endPosition(); p++) {
                var element = rung.element(p);
                assertTrue(element.branchLevel() >= branch.branchLevel() + 1, "Level inside " + branch);
                assertEquals(branch.rootBranchId(), element.rootBranchId(), "Root shared by descendants");
            }
        }
    }
}
