package io.github.pyrox.ladder.layout;

/**
 * Straight wire between two points; always horizontal or vertical.
 */
public record WireSegment(int x1, int y1, int x2, int y2) {
    public boolean isHorizontal() {
        return y1 == y2;
    }

    public int length() {
        return Math.abs(x2 - x1) + Math.abs(y2 - y1);
    }
}
