package io.github.pyrox.ladder;

/**
 * An ordinal index (element position or rung number) lies outside the valid range.
 */
public class PositionOutOfRangeException extends LadderException {
    private final int position;
    private final int limit;

    public PositionOutOfRangeException(String what, int position, int limit) {
        super("%s %d out of range [0, %d]".formatted(what, position, limit));
        this.position = position;
        this.limit = limit;
    }

    public int position() {
        return position;
    }

    /** Largest accepted value (inclusive). */
    public int limit() {
        return limit;
    }
}
