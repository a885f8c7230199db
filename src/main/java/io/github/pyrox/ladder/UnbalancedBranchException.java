package io.github.pyrox.ladder;

/**
 * Branch markers do not pair up. This is structural corruption: it is always surfaced and
 * never repaired.
 */
public class UnbalancedBranchException extends LadderException {
    private final int position;

    public UnbalancedBranchException(String message, int position) {
        super(message + " (position " + position + ")");
        this.position = position;
    }

    public int position() {
        return position;
    }
}
