package io.github.pyrox.ladder;

public class NoRungAtCoordinateException extends LadderException {
    private final int y;

    public NoRungAtCoordinateException(int y) {
        super("No rung at y=" + y);
        this.y = y;
    }

    public int y() {
        return y;
    }
}
