package io.github.pyrox.ladder.model;

public enum BranchKind {
    /** Opened by a branch start; stands for the whole branch and its first rail. */
    STRUCTURE,
    /** Opened by a branch-next marker; a sibling rail of its structure. */
    RAIL
}
