package io.github.pyrox.ladder.model;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One entry of a rung sequence. Instances are immutable; a rung re-indexes its whole sequence
 * after every edit, so {@code position}, {@code branchId}, {@code rootBranchId} and
 * {@code branchLevel} always describe the committed sequence.
 *
 * @param kind         element kind
 * @param position     zero-based ordinal within the rung
 * @param branchId     rail an instruction sits on, or the branch a marker opens/extends/closes;
 *                     {@code null} for instructions on the main rail
 * @param rootBranchId outermost branch of the nesting chain, {@code null} on the main rail
 * @param branchLevel  number of unclosed enclosing branches at this position
 * @param instruction  present only for {@link RungElementType#INSTRUCTION}
 */
public record RungElement(RungElementType kind,
                          int position,
                          @Nullable Integer branchId,
                          @Nullable Integer rootBranchId,
                          int branchLevel,
                          @Nullable Instruction instruction)
{
    public RungElement {
        Objects.requireNonNull(kind, "kind");
        if ((kind == RungElementType.INSTRUCTION) != (instruction != null)) {
            throw new IllegalArgumentException("Only instruction elements carry an instruction: " + kind);
        }
    }

    /** Unindexed instruction element, ready to be spliced into a sequence. */
    public static RungElement instruction(Instruction instruction) {
        return new RungElement(RungElementType.INSTRUCTION, 0, null, null, 0, Objects.requireNonNull(instruction));
    }

    /** Unindexed marker element, ready to be spliced into a sequence. */
    public static RungElement marker(RungElementType kind) {
        if (!kind.isMarker()) {
            throw new IllegalArgumentException("Not a branch marker: " + kind);
        }
        return new RungElement(kind, 0, null, null, 0, null);
    }

    public boolean isInstruction() {
        return kind == RungElementType.INSTRUCTION;
    }

    RungElement reindexed(int position, @Nullable Integer branchId, @Nullable Integer rootBranchId, int branchLevel) {
        return new RungElement(kind, position, branchId, rootBranchId, branchLevel, instruction);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case INSTRUCTION -> "%s@%d".formatted(instruction, position);
            case BRANCH_START -> "[%s@%d".formatted(branchId, position);
            case BRANCH_NEXT -> ",%s@%d".formatted(branchId, position);
            case BRANCH_END -> "]%s@%d".formatted(branchId, position);
        };
    }
}
