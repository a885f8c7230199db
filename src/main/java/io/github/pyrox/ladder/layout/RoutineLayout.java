package io.github.pyrox.ladder.layout;

import io.github.pyrox.ladder.PositionOutOfRangeException;
import io.github.pyrox.ladder.model.Routine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Stacks the rungs of a routine vertically and keeps one {@link LayoutResult} per rung.
 * <p>
 * After an edit only the edited rung is laid out again; following rungs are revisited one at a
 * time while the bottom edge of the rung before them keeps moving. Adding or removing a rung
 * shifts every rung after it, so those passes always run to the end of the routine.
 * <p>
 * Not thread-safe; callers serialise access together with the routine it lays out.
 */
public final class RoutineLayout {
    private static final Logger logger = LogManager.getLogger(RoutineLayout.class);

    private final Routine routine;
    private final LayoutEngine engine;
    private final List<@Nullable LayoutResult> results = new ArrayList<>();

    public RoutineLayout(Routine routine, LayoutConfig config) {
        this(routine, new LayoutEngine(config));
    }

    public RoutineLayout(Routine routine, LayoutEngine engine) {
        this.routine = Objects.requireNonNull(routine);
        this.engine = Objects.requireNonNull(engine);
        layoutAll();
    }

    public Routine routine() {
        return routine;
    }

    public LayoutEngine engine() {
        return engine;
    }

    public LayoutConfig config() {
        return engine.config();
    }

    /** Discards every cached result and lays out the whole routine top to bottom. */
    public void layoutAll() {
        results.clear();
        int y = config().topMargin();
        for (int i = 0; i < routine.size(); i++) {
            var result = engine.layout(routine.rung(i), i, y);
            results.add(result);
            y = result.bottom() + config().rungSpacing();
        }
        logger.debug("Laid out routine {} ({} rungs)", routine.name(), routine.size());
    }

    /**
     * Re-lays rung {@code rungNumber} after its content changed and cascades to following rungs
     * whose top edge moved.
     *
     * @return rung numbers laid out again, in order
     */
    public List<Integer> relayoutFrom(int rungNumber) {
        checkRung(rungNumber, results.size());
        return cascade(rungNumber, false);
    }

    /**
     * Lays out a rung just added to the routine at {@code rungNumber} and shifts every rung below.
     */
    public List<Integer> rungInserted(int rungNumber) {
        checkRung(rungNumber, results.size() + 1);
        results.add(rungNumber, null);
        return cascade(rungNumber, true);
    }

    /**
     * Drops the result of a rung just removed from the routine and shifts every rung below.
     */
    public List<Integer> rungRemoved(int rungNumber) {
        checkRung(rungNumber, results.size());
        results.remove(rungNumber);
        if (rungNumber == results.size()) {
            return List.of();
        }
        return cascade(rungNumber, true);
    }

    private List<Integer> cascade(int first, boolean throughEnd) {
        if (results.size() != routine.size()) {
            throw new IllegalStateException("Layout holds %d rungs but routine %s has %d"
                                                    .formatted(results.size(), routine.name(), routine.size()));
        }
        var touched = new ArrayList<Integer>();
        var queue = new ArrayDeque<Integer>();
        queue.add(first);
        while (!queue.isEmpty()) {
            int n = queue.poll();
            var previous = results.get(n);
            var fresh = engine.layout(routine.rung(n), n, topOf(n));
            results.set(n, fresh);
            touched.add(n);
            boolean moved = previous == null || previous.bottom() != fresh.bottom();
            if (n + 1 < results.size() && (moved || throughEnd)) {
                queue.add(n + 1);
            }
        }
        logger.debug("Re-laid rungs {} of routine {}", touched, routine.name());
        return touched;
    }

    private int topOf(int rungNumber) {
        if (rungNumber == 0) {
            return config().topMargin();
        }
        return Objects.requireNonNull(results.get(rungNumber - 1)).bottom() + config().rungSpacing();
    }

    public int size() {
        return results.size();
    }

    public LayoutResult result(int rungNumber) {
        checkRung(rungNumber, results.size());
        return Objects.requireNonNull(results.get(rungNumber));
    }

    public List<LayoutResult> results() {
        return Collections.unmodifiableList(results);
    }

    public int rungY(int rungNumber) {
        return result(rungNumber).y();
    }

    public List<Integer> rungYPositions() {
        return results().stream().map(LayoutResult::y).toList();
    }

    /** Rung whose vertical extent contains {@code y}, if any. */
    public OptionalInt rungAt(int y) {
        for (int i = 0; i < results.size(); i++) {
            if (result(i).containsY(y)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /** x of the right power rail: clear of the widest rung, never left of the configured minimum. */
    public int rightRailX() {
        int widest = results().stream().mapToInt(LayoutResult::contentRight).max().orElse(0);
        return Math.max(config().minRightRailX(), widest + config().horizontalGap());
    }

    public Extent extent() {
        int bottom = results.isEmpty() ? config().topMargin() : result(results.size() - 1).bottom();
        return new Extent(rightRailX() + config().leftRailX(), bottom + config().topMargin());
    }

    private static void checkRung(int rungNumber, int count) {
        if (rungNumber < 0 || rungNumber >= count) {
            throw new PositionOutOfRangeException("Rung", rungNumber, count - 1);
        }
    }
}
