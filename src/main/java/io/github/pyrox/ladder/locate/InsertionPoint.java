package io.github.pyrox.ladder.locate;

import org.jetbrains.annotations.Nullable;

/**
 * Fully resolved insertion point: a rail plus the sequence position an element would take on it.
 */
public record InsertionPoint(int rungNumber, int position, int branchLevel, @Nullable Integer branchId) {
    public InsertionTarget target() {
        return new InsertionTarget(rungNumber, branchLevel, branchId);
    }
}
