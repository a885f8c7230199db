package io.github.pyrox.ladder.edit;

import io.github.pyrox.ladder.model.Instruction;
import org.jetbrains.annotations.Nullable;

/**
 * Interaction modes of a {@link LadderEditor}. Insert modes carry the instruction they drop.
 */
public enum EditorMode {
    VIEW(null),
    INSERT_CONTACT(Instruction.of("XIC", "NewContact")),
    INSERT_COIL(Instruction.of("OTE", "NewCoil")),
    INSERT_BLOCK(Instruction.of("TON", "Timer1", "1000", "0")),
    INSERT_BRANCH(null),
    CONNECT_BRANCH(null),
    DRAG(null);

    @Nullable
    private final Instruction template;

    EditorMode(@Nullable Instruction template) {
        this.template = template;
    }

    @Nullable
    public Instruction template() {
        return template;
    }

    public boolean insertsInstruction() {
        return template != null;
    }

    /** Modes a caller may switch to directly; the others are entered through clicks and presses. */
    public boolean isSelectable() {
        return this != CONNECT_BRANCH && this != DRAG;
    }
}
