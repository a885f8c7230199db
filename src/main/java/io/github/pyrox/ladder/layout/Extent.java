package io.github.pyrox.ladder.layout;

/** Total drawing area of a routine, for scroll regions. */
public record Extent(int width, int height) {
}
