package io.github.pyrox.ladder.locate;

import org.jetbrains.annotations.Nullable;

/**
 * Rail under a point: the rung, the level an element inserted there would get, and the rail id
 * ({@code null} for the main rail).
 */
public record InsertionTarget(int rungNumber, int branchLevel, @Nullable Integer branchId) {
    public boolean isMainRail() {
        return branchId == null;
    }
}
