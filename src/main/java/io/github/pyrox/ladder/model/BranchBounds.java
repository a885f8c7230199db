package io.github.pyrox.ladder.model;

/**
 * Bounding box of a laid-out branch or rail. All coordinates are inclusive virtual units.
 *
 * @param startX  left edge (start marker)
 * @param endX    right edge (end marker)
 * @param branchY wire line of the rail the branch opens on
 * @param startY  top of the branch's band
 * @param endY    bottom of the branch's band
 */
public record BranchBounds(int startX, int endX, int branchY, int startY, int endY) {
    public boolean contains(int x, int y) {
        return x >= startX && x <= endX && y >= startY && y <= endY;
    }

    public long area() {
        return (long) (endX - startX + 1) * (endY - startY + 1);
    }

    public BranchBounds withEndY(int newEndY) {
        return new BranchBounds(startX, endX, branchY, startY, newEndY);
    }
}
