package io.github.pyrox.ladder.model;

import io.github.pyrox.ladder.BranchNotFoundException;
import io.github.pyrox.ladder.InvalidInsertionPointException;
import io.github.pyrox.ladder.PositionOutOfRangeException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One ladder-logic line: an ordered sequence of instructions and branch markers plus an optional
 * comment. The rung exclusively owns its elements and only changes them through the operations
 * below. Every operation builds a candidate sequence, re-indexes it and commits it only if the
 * result is structurally valid, so a failed call never leaves a partial edit behind.
 */
public final class Rung {
    private List<RungElement> elements = List.of();
    private List<Branch> branches = List.of();
    private int maxBranchDepth;
    @Nullable
    private String comment;

    private record Indexed(List<RungElement> elements, List<Branch> branches, int maxRow) {}

    public Rung() {
    }

    /**
     * Creates a rung from a (possibly unindexed) element sequence.
     *
     * @throws io.github.pyrox.ladder.UnbalancedBranchException if the markers do not pair up
     */
    public Rung(List<RungElement> sequence, @Nullable String comment) {
        commit(index(sequence));
        this.comment = comment;
    }

    public static Rung parse(String text) {
        return parse(text, null);
    }

    public static Rung parse(String text, @Nullable String comment) {
        return new Rung(RungText.parse(text), comment);
    }

    public List<RungElement> elements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public RungElement element(int position) {
        if (position < 0 || position >= elements.size()) {
            throw new PositionOutOfRangeException("Position", position, elements.size() - 1);
        }
        return elements.get(position);
    }

    /** Structural branch arena of the committed sequence; index equals branch id. */
    public List<Branch> branches() {
        return branches;
    }

    public Branch branch(int branchId) {
        if (branchId < 0 || branchId >= branches.size()) {
            throw new BranchNotFoundException(branchId);
        }
        return branches.get(branchId);
    }

    public boolean hasBranches() {
        return !branches.isEmpty();
    }

    /** Deepest visual row used by a branch rail; 0 when everything sits on the main rail. */
    public int maxBranchDepth() {
        return maxBranchDepth;
    }

    @Nullable
    public String comment() {
        return comment;
    }

    public void setComment(@Nullable String comment) {
        this.comment = comment;
    }

    public int commentLineCount() {
        if (comment == null || comment.isBlank()) {
            return 0;
        }
        return (int) comment.lines().count();
    }

    public List<Instruction> instructions() {
        return elements.stream()
                .filter(RungElement::isInstruction)
                .map(RungElement::instruction)
                .toList();
    }

    /** Instructions sitting directly on one rail; {@code null} is the main rail. */
    public List<Instruction> instructionsOnRail(@Nullable Integer railId) {
        if (railId != null) {
            branch(railId);
        }
        return elements.stream()
                .filter(e -> e.isInstruction() && Objects.equals(e.branchId(), railId))
                .map(RungElement::instruction)
                .toList();
    }

    public List<Instruction> mainRailInstructions() {
        return instructionsOnRail(null);
    }

    /** Every instruction inside a branch or rail, nested content included. */
    public List<Instruction> branchInstructions(int branchId) {
        var target = branch(branchId);
        return elements.subList(target.startPosition(), target.endPosition() + 1).stream()
                .filter(RungElement::isInstruction)
                .map(RungElement::instruction)
                .toList();
    }

    /** Whether an instruction with this text, e.g. {@code XIC(Start)}, appears anywhere on the rung. */
    public boolean hasInstruction(String instructionText) {
        var wanted = Instruction.parse(instructionText);
        return instructions().contains(wanted);
    }

    public String text() {
        return RungText.format(elements);
    }

    /**
     * Rail an element inserted at {@code position} would belong to; {@code null} is the main rail.
     */
    @Nullable
    public Integer railAt(int position) {
        checkInsertionPoint(position);
        if (position == 0) {
            return null;
        }
        var previous = elements.get(position - 1);
        return switch (previous.kind()) {
            case INSTRUCTION, BRANCH_START, BRANCH_NEXT -> previous.branchId();
            case BRANCH_END -> branch(previous.branchId()).parentBranchId();
        };
    }

    /**
     * Splices an instruction in before {@code position} ({@code size()} appends). Trailing
     * positions move up by one.
     *
     * @return the committed element
     */
    public RungElement insertInstruction(int position, Instruction instruction) {
        checkInsertionPoint(position);
        var candidate = new ArrayList<>(elements);
        candidate.add(position, RungElement.instruction(instruction));
        commit(index(candidate));
        return elements.get(position);
    }

    /**
     * Wraps the elements in {@code [start, end)} in a new branch whose second rail is empty.
     * Both insertion points must lie on the same rail.
     *
     * @return id of the new branch
     */
    public int insertBranch(int start, int end) {
        checkInsertionPoint(start);
        checkInsertionPoint(end);
        if (start > end) {
            throw new InvalidInsertionPointException("Branch start %d is after its end %d".formatted(start, end));
        }
        if (!Objects.equals(railAt(start), railAt(end))) {
            throw new InvalidInsertionPointException(
                    "Branch endpoints %d and %d are on different rails".formatted(start, end));
        }
        var candidate = new ArrayList<>(elements);
        candidate.add(end, RungElement.marker(RungElementType.BRANCH_END));
        candidate.add(end, RungElement.marker(RungElementType.BRANCH_NEXT));
        candidate.add(start, RungElement.marker(RungElementType.BRANCH_START));
        commit(index(candidate));
        return elements.get(start).branchId();
    }

    /**
     * Adds an empty rail directly below the rail opened by the branch-start or branch-next marker
     * at {@code markerPosition}.
     *
     * @return id of the new rail
     */
    public int insertBranchLevel(int markerPosition) {
        var marker = element(markerPosition);
        int insertAt = switch (marker.kind()) {
            case BRANCH_START -> {
                var structure = branch(marker.branchId());
                yield structure.childBranchIds().isEmpty()
                      ? structure.endPosition()
                      : branch(structure.childBranchIds().get(0)).startPosition();
            }
            case BRANCH_NEXT -> branch(marker.branchId()).endPosition() + 1;
            default -> throw new InvalidInsertionPointException(
                    "Position %d holds %s, not a branch start or branch-next marker".formatted(markerPosition, marker.kind()));
        };
        var candidate = new ArrayList<>(elements);
        candidate.add(insertAt, RungElement.marker(RungElementType.BRANCH_NEXT));
        commit(index(candidate));
        return elements.get(insertAt).branchId();
    }

    /**
     * Removes a whole branch (structure id) or one rail (rail id) together with everything nested
     * inside it.
     */
    public void removeBranch(int branchId) {
        var target = branch(branchId);
        var candidate = new ArrayList<>(elements);
        candidate.subList(target.startPosition(), target.endPosition() + 1).clear();
        commit(index(candidate));
    }

    /**
     * Removes the instruction at {@code position}; trailing positions move down by one.
     *
     * @return the removed element as it was indexed before removal
     */
    public RungElement removeInstruction(int position) {
        var removed = requireInstruction(position);
        var candidate = new ArrayList<>(elements);
        candidate.remove(position);
        commit(index(candidate));
        return removed;
    }

    /**
     * Moves an instruction to the insertion point {@code to}, expressed against the sequence before
     * the move.
     *
     * @return the moved element at its new position
     */
    public RungElement moveInstruction(int from, int to) {
        var moving = requireInstruction(from);
        checkInsertionPoint(to);
        int target = to > from ? to - 1 : to;
        if (target == from) {
            return moving;
        }
        var candidate = new ArrayList<>(elements);
        candidate.remove(from);
        candidate.add(target, moving);
        commit(index(candidate));
        return elements.get(target);
    }

    /**
     * Moves a whole branch, nested content included, to the insertion point {@code to} expressed
     * against the sequence before the move. Rails move with their branch only.
     *
     * @return position of the branch's start marker after the move
     */
    public int moveBranch(int branchId, int to) {
        var target = branch(branchId);
        checkInsertionPoint(to);
        if (target.isRail()) {
            throw new InvalidInsertionPointException("Branch %d is a rail; move its branch instead".formatted(branchId));
        }
        int start = target.startPosition();
        int end = target.endPosition();
        if (to > start && to <= end) {
            throw new InvalidInsertionPointException(
                    "Cannot move branch %d into itself at %d".formatted(branchId, to));
        }
        int length = end - start + 1;
        int destination = to > end ? to - length : to;
        if (destination == start) {
            return start;
        }
        var candidate = new ArrayList<>(elements);
        var block = new ArrayList<>(candidate.subList(start, end + 1));
        candidate.subList(start, end + 1).clear();
        candidate.addAll(destination, block);
        commit(index(candidate));
        return destination;
    }

    public RungElement replaceInstruction(int position, Instruction instruction) {
        requireInstruction(position);
        var candidate = new ArrayList<>(elements);
        candidate.set(position, RungElement.instruction(instruction));
        commit(index(candidate));
        return elements.get(position);
    }

    private RungElement requireInstruction(int position) {
        var element = element(position);
        if (!element.isInstruction()) {
            throw new IllegalArgumentException(
                    "Position %d holds %s, not an instruction".formatted(position, element.kind()));
        }
        return element;
    }

    private void checkInsertionPoint(int position) {
        if (position < 0 || position > elements.size()) {
            throw new PositionOutOfRangeException("Insertion point", position, elements.size());
        }
    }

    private void commit(Indexed indexed) {
        this.elements = indexed.elements();
        this.branches = indexed.branches();
        this.maxBranchDepth = indexed.maxRow();
    }

    /**
     * Recomputes positions, levels, rail/root ids and the branch arena for a candidate sequence.
     */
    private static Indexed index(List<RungElement> sequence) {
        var registry = new BranchRegistry();
        var indexed = new ArrayList<RungElement>(sequence.size());
        for (int position = 0; position < sequence.size(); position++) {
            var element = sequence.get(position);
            indexed.add(switch (element.kind()) {
                case INSTRUCTION -> element.reindexed(position, registry.currentRailId(),
                                                      registry.currentRootId(), registry.depth());
                case BRANCH_START -> {
                    int level = registry.depth();
                    var branch = registry.openBranch(position, null);
                    yield element.reindexed(position, branch.id(), branch.rootBranchId(), level);
                }
                case BRANCH_NEXT -> {
                    var rail = registry.nextRail(position, null);
                    yield element.reindexed(position, rail.id(), rail.rootBranchId(), registry.depth());
                }
                case BRANCH_END -> {
                    var branch = registry.closeBranch(position, null);
                    yield element.reindexed(position, branch.id(), branch.rootBranchId(), registry.depth());
                }
            });
        }
        registry.finish(sequence.size());
        return new Indexed(List.copyOf(indexed), List.copyOf(registry.branches()), registry.maxRow());
    }

    @Override
    public String toString() {
        return "Rung{text='%s', comment=%s, branches=%d}".formatted(text(), comment == null ? "none" : "'" + comment + "'", branches.size());
    }
}
