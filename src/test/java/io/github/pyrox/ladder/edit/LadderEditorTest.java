package io.github.pyrox.ladder.edit;

import io.github.pyrox.ladder.layout.LayoutConfig;
import io.github.pyrox.ladder.layout.RoutineLayout;
import io.github.pyrox.ladder.locate.InsertionPoint;
import io.github.pyrox.ladder.model.Routine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class LadderEditorTest {

    private Routine routine;
    private LadderEditor editor;

    @BeforeEach
    public void setUp() {
        // rung 0 spans y 50..109 (wire at 80), rung 1 spans y 130..189 (wire at 160)
        routine = Routine.ofText("MainRoutine", "XIC(a)OTE(b)", "XIC(c)");
        var layout = new RoutineLayout(routine, LayoutConfig.defaults());
        editor = new LadderEditor(new MutationController(layout));
    }

    @Test
    public void testInsertModesDropTemplateAndReturnToView() {
        editor.setMode(EditorMode.INSERT_CONTACT);
        var invalidation = editor.click(200, 80);

        assertEquals("XIC(a)OTE(b)XIC(NewContact);", routine.rung(0).text());
        assertEquals(EditorMode.VIEW, editor.mode());
        assertFalse(invalidation.isEmpty());

        editor.setMode(EditorMode.INSERT_BLOCK);
        editor.click(60, 160);
        assertEquals("TON(Timer1,1000,0)XIC(c);", routine.rung(1).text());

        editor.setMode(EditorMode.INSERT_COIL);
        editor.click(500, 160);
        assertEquals("TON(Timer1,1000,0)XIC(c)OTE(NewCoil);", routine.rung(1).text());
    }

    @Test
    public void testMissIsANoOp() {
        editor.setMode(EditorMode.INSERT_COIL);
        var invalidation = editor.click(200, 10);

        assertTrue(invalidation.isEmpty());
        assertEquals(EditorMode.VIEW, editor.mode());
        assertEquals("XIC(a)OTE(b);", routine.rung(0).text());
    }

    @Test
    public void testBranchInsertion() {
        editor.setMode(EditorMode.INSERT_BRANCH);
        editor.click(60, 80);
        assertEquals(EditorMode.CONNECT_BRANCH, editor.mode());
        assertEquals(Optional.of(new InsertionPoint(0, 0, 0, null)), editor.branchAnchor());

        editor.click(200, 80);
        assertEquals("[XIC(a)OTE(b),];", routine.rung(0).text());
        assertEquals(EditorMode.VIEW, editor.mode());
        assertTrue(editor.branchAnchor().isEmpty());
    }

    @Test
    public void testBranchAcrossRungsIsAbandoned() {
        editor.setMode(EditorMode.INSERT_BRANCH);
        editor.click(60, 80);
        var invalidation = editor.click(60, 160);

        assertTrue(invalidation.isEmpty());
        assertEquals(EditorMode.VIEW, editor.mode());
        assertEquals("XIC(a)OTE(b);", routine.rung(0).text());
        assertEquals("XIC(c);", routine.rung(1).text());
    }

    @Test
    public void testCancelAndIllegalModes() {
        editor.setMode(EditorMode.INSERT_BRANCH);
        editor.click(60, 80);
        editor.cancel();
        assertEquals(EditorMode.VIEW, editor.mode());
        assertTrue(editor.branchAnchor().isEmpty());

        assertThrows(IllegalArgumentException.class, () -> editor.setMode(EditorMode.DRAG));
        assertThrows(IllegalArgumentException.class, () -> editor.setMode(EditorMode.CONNECT_BRANCH));
    }

    @Test
    public void testSelectAndDrag() {
        editor.click(60, 80);
        assertEquals(Optional.of(new LadderEditor.Selection(0, 0)), editor.selection());
        assertTrue(editor.renderedRung(0).element(0).selected());
        assertFalse(editor.renderedRung(0).element(1).selected());
        assertFalse(editor.renderedRung(1).element(0).selected());

        assertFalse(editor.press(120, 80), "Press on an unselected element does not drag");
        assertTrue(editor.press(60, 80));
        assertEquals(EditorMode.DRAG, editor.mode());

        editor.release(200, 160);
        assertEquals(EditorMode.VIEW, editor.mode());
        assertTrue(editor.selection().isEmpty());
        assertEquals("OTE(b);", routine.rung(0).text());
        assertEquals("XIC(c)XIC(a);", routine.rung(1).text());
    }

    @Test
    public void testDropOnNothingEndsDrag() {
        editor.click(60, 80);
        editor.press(60, 80);
        var invalidation = editor.release(200, 5);

        assertTrue(invalidation.isEmpty());
        assertEquals(EditorMode.VIEW, editor.mode());
        assertEquals("XIC(a)OTE(b);", routine.rung(0).text());
    }

    @Test
    public void testHoverAndDeleteSelection() {
        assertTrue(editor.hover(200, 80).isEmpty(), "No preview while viewing");
        editor.setMode(EditorMode.INSERT_CONTACT);
        assertEquals(Optional.of(new InsertionPoint(0, 2, 0, null)), editor.hover(200, 80));

        editor.cancel();
        editor.click(120, 80);
        editor.deleteSelection();
        assertEquals("XIC(a);", routine.rung(0).text());
        assertTrue(editor.deleteSelection().isEmpty(), "Nothing left selected");
    }

    @Test
    public void testSelectionFollowsInsertedTemplate() {
        editor.click(120, 80);
        assertEquals(Optional.of(new LadderEditor.Selection(0, 1)), editor.selection());

        editor.setMode(EditorMode.INSERT_CONTACT);
        editor.click(45, 80);
        assertEquals("XIC(NewContact)XIC(a)OTE(b);", routine.rung(0).text());
        assertEquals(Optional.of(new LadderEditor.Selection(0, 2)), editor.selection());
        assertTrue(editor.renderedRung(0).element(2).selected());

        editor.deleteSelection();
        assertEquals("XIC(NewContact)XIC(a);", routine.rung(0).text(), "The selected coil is the one deleted");
    }

    @Test
    public void testSelectionFollowsConnectedBranch() {
        editor.click(120, 80);

        editor.setMode(EditorMode.INSERT_BRANCH);
        editor.click(60, 80);
        editor.click(100, 80);
        assertEquals("[XIC(a),]OTE(b);", routine.rung(0).text());
        assertEquals(Optional.of(new LadderEditor.Selection(0, 4)), editor.selection());

        editor.deleteSelection();
        assertEquals("[XIC(a),];", routine.rung(0).text());
    }

    @Test
    public void testSelectionOnOtherRungUntouched() {
        editor.click(60, 160);
        editor.setMode(EditorMode.INSERT_CONTACT);
        editor.click(45, 80);

        assertEquals(Optional.of(new LadderEditor.Selection(1, 0)), editor.selection());
        editor.clearSelection();
        assertTrue(editor.selection().isEmpty());
    }
}
