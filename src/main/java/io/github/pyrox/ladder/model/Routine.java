package io.github.pyrox.ladder.model;

import io.github.pyrox.ladder.PositionOutOfRangeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of rungs; a rung's number is its index.
 */
public final class Routine {
    private final String name;
    private final List<Rung> rungs = new ArrayList<>();

    public Routine(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Routine(String name, List<Rung> rungs) {
        this(name);
        this.rungs.addAll(rungs);
    }

    /** Convenience for rungs given as neutral rung text, without comments. */
    public static Routine ofText(String name, String... rungTexts) {
        var routine = new Routine(name);
        for (var text : rungTexts) {
            routine.addRung(Rung.parse(text));
        }
        return routine;
    }

    public String name() {
        return name;
    }

    public List<Rung> rungs() {
        return Collections.unmodifiableList(rungs);
    }

    public int size() {
        return rungs.size();
    }

    public Rung rung(int rungNumber) {
        if (rungNumber < 0 || rungNumber >= rungs.size()) {
            throw new PositionOutOfRangeException("Rung", rungNumber, rungs.size() - 1);
        }
        return rungs.get(rungNumber);
    }

    public void addRung(Rung rung) {
        rungs.add(Objects.requireNonNull(rung, "rung"));
    }

    public void addRung(int rungNumber, Rung rung) {
        if (rungNumber < 0 || rungNumber > rungs.size()) {
            throw new PositionOutOfRangeException("Rung", rungNumber, rungs.size());
        }
        rungs.add(rungNumber, Objects.requireNonNull(rung, "rung"));
    }

    public Rung removeRung(int rungNumber) {
        rung(rungNumber);
        return rungs.remove(rungNumber);
    }
}
