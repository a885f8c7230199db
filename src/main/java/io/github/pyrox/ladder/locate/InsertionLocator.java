package io.github.pyrox.ladder.locate;

import io.github.pyrox.ladder.InvalidInsertionPointException;
import io.github.pyrox.ladder.NoRungAtCoordinateException;
import io.github.pyrox.ladder.layout.BranchLayout;
import io.github.pyrox.ladder.layout.LayoutElement;
import io.github.pyrox.ladder.layout.LayoutResult;
import io.github.pyrox.ladder.layout.RoutineLayout;
import io.github.pyrox.ladder.model.RungElementType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps canvas coordinates to rungs, rails and sequence positions using the cached geometry of a
 * {@link RoutineLayout}. Read-only; the layout must be current.
 */
public final class InsertionLocator {
    private static final Logger logger = LogManager.getLogger(InsertionLocator.class);

    private final RoutineLayout layout;

    public InsertionLocator(RoutineLayout layout) {
        this.layout = Objects.requireNonNull(layout);
    }

    /**
     * Finds the rail under {@code (x, y)}. The smallest branch box containing the point wins, so
     * rails beat their structure and nested branches beat the branch hosting them. A point in the
     * rung but outside every branch box is on the main rail.
     *
     * @throws NoRungAtCoordinateException if no rung's vertical extent contains {@code y}
     */
    public InsertionTarget locate(int x, int y) {
        int rungNumber = layout.rungAt(y).orElseThrow(() -> new NoRungAtCoordinateException(y));
        var result = layout.result(rungNumber);

        @Nullable BranchLayout best = null;
        long bestArea = Long.MAX_VALUE;
        for (var branch : result.branches()) {
            var bounds = branch.bounds();
            if (!bounds.contains(x, y)) {
                continue;
            }
            // later ties are deeper in the nesting chain
            if (bounds.area() <= bestArea) {
                best = branch;
                bestArea = bounds.area();
            }
        }
        if (best == null) {
            return new InsertionTarget(rungNumber, 0, null);
        }
        return new InsertionTarget(rungNumber, best.branchLevel() + 1, best.id());
    }

    public Optional<InsertionTarget> tryLocate(int x, int y) {
        try {
            return Optional.of(locate(x, y));
        } catch (NoRungAtCoordinateException e) {
            logger.debug("No rung at ({}, {})", x, y);
            return Optional.empty();
        }
    }

    private record Candidate(int startPosition, int endPosition, int centerX) {}

    /**
     * Picks the sequence position for an element dropped at {@code x} on one rail.
     * <p>
     * Candidates are the rail's instructions and the branches it hosts, each branch counting as a
     * single unit from its start marker to its end marker. The candidate with the nearest centre
     * wins (the later one on equal distance); left of its centre inserts before it, otherwise
     * after it. An empty rail yields 0 on the main rail and the slot right after the rail's
     * opening marker otherwise.
     */
    public int findInsertionPosition(int x, int rungNumber, int branchLevel, @Nullable Integer branchId) {
        var result = layout.result(rungNumber);
        int expectedLevel = branchId == null ? 0 : result.branch(branchId).branchLevel() + 1;
        if (branchLevel != expectedLevel) {
            throw new InvalidInsertionPointException(
                    "Rail %s of rung %d holds level %d, not %d".formatted(branchId, rungNumber, expectedLevel, branchLevel));
        }

        var candidates = candidates(result, branchId);
        if (candidates.isEmpty()) {
            return branchId == null ? 0 : result.branch(branchId).startPosition() + 1;
        }

        Candidate nearest = candidates.get(0);
        int nearestDistance = Integer.MAX_VALUE;
        for (var candidate : candidates) {
            int distance = Math.abs(x - candidate.centerX());
            if (distance <= nearestDistance) {
                nearest = candidate;
                nearestDistance = distance;
            }
        }
        return x < nearest.centerX() ? nearest.startPosition() : nearest.endPosition() + 1;
    }

    private static List<Candidate> candidates(LayoutResult result, @Nullable Integer branchId) {
        var candidates = new ArrayList<Candidate>();
        for (var element : result.elements()) {
            if (element.kind() == RungElementType.INSTRUCTION && Objects.equals(element.branchId(), branchId)) {
                candidates.add(new Candidate(element.position(), element.position(), element.centerX()));
            } else if (element.kind() == RungElementType.BRANCH_START) {
                var nested = result.branch(Objects.requireNonNull(element.branchId()));
                if (Objects.equals(nested.parentBranchId(), branchId)) {
                    var bounds = nested.bounds();
                    candidates.add(new Candidate(nested.startPosition(), nested.endPosition(),
                                                 (bounds.startX() + bounds.endX()) / 2));
                }
            }
        }
        return candidates;
    }

    /**
     * Resolves a point all the way to a sequence position.
     *
     * @throws NoRungAtCoordinateException if no rung contains {@code y}
     */
    public InsertionPoint resolve(int x, int y) {
        var target = locate(x, y);
        int position = findInsertionPosition(x, target.rungNumber(), target.branchLevel(), target.branchId());
        return new InsertionPoint(target.rungNumber(), position, target.branchLevel(), target.branchId());
    }

    /** Element whose rectangle contains the point, for selection. */
    public Optional<LayoutElement> elementAt(int x, int y) {
        var rung = layout.rungAt(y);
        if (rung.isEmpty()) {
            return Optional.empty();
        }
        return layout.result(rung.getAsInt()).elements().stream()
                .filter(e -> e.contains(x, y))
                .findFirst();
    }
}
