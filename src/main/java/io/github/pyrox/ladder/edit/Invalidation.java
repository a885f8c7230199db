package io.github.pyrox.ladder.edit;

import java.util.List;
import java.util.TreeSet;

/**
 * Rungs whose layout was recomputed by an edit, in ascending order. Renderers repaint exactly
 * these.
 */
public record Invalidation(List<Integer> rungNumbers) {
    private static final Invalidation NONE = new Invalidation(List.of());

    public Invalidation {
        rungNumbers = List.copyOf(new TreeSet<>(rungNumbers));
    }

    public static Invalidation none() {
        return NONE;
    }

    public boolean isEmpty() {
        return rungNumbers.isEmpty();
    }

    public Invalidation merge(Invalidation other) {
        var all = new TreeSet<>(rungNumbers);
        all.addAll(other.rungNumbers);
        return new Invalidation(List.copyOf(all));
    }
}
