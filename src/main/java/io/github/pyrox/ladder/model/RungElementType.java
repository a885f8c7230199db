package io.github.pyrox.ladder.model;

/**
 * Kinds of elements in a rung sequence.
 */
public enum RungElementType {
    INSTRUCTION,
    BRANCH_START,
    BRANCH_NEXT,
    BRANCH_END;

    public boolean isMarker() {
        return this != INSTRUCTION;
    }
}
