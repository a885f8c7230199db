package io.github.pyrox.ladder.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Records exchanged with files and rendering collaborators: routine input on one side, laid-out
 * geometry snapshots on the other.
 */
public final class LayoutDtos {

    private LayoutDtos() {
    }

    /**
     * Routine as read from disk: a name and rungs in neutral rung text.
     */
    public record RoutineInputDto(String name, @Nullable List<RungInputDto> rungs) {
        public RoutineInputDto {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("name cannot be null or empty");
            }
            rungs = rungs == null ? List.of() : List.copyOf(rungs);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RungInputDto(String text, @Nullable String comment) {
        public RungInputDto {
            if (text == null) {
                throw new IllegalArgumentException("text cannot be null");
            }
        }
    }

    /**
     * Whole laid-out routine, including the shared power rails and the scroll extent.
     */
    public record RoutineLayoutDto(String name,
                                   int width,
                                   int height,
                                   int leftRailX,
                                   int rightRailX,
                                   List<RungLayoutDto> rungs) {
        public RoutineLayoutDto {
            rungs = List.copyOf(rungs);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RungLayoutDto(int number,
                                String text,
                                @Nullable String comment,
                                int y,
                                int height,
                                int commentHeight,
                                int maxBranchDepth,
                                List<ElementDto> elements,
                                List<BranchDto> branches,
                                List<WireDto> wires) {
        public RungLayoutDto {
            elements = List.copyOf(elements);
            branches = List.copyOf(branches);
            wires = List.copyOf(wires);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ElementDto(String kind,
                             @Nullable String instructionKind,
                             @Nullable String instruction,
                             int position,
                             int x,
                             int y,
                             int width,
                             int height,
                             int branchLevel,
                             @Nullable Integer branchId,
                             int row,
                             boolean selected) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record BranchDto(int id,
                            String kind,
                            @Nullable Integer parentBranchId,
                            int rootBranchId,
                            List<Integer> childBranchIds,
                            int startPosition,
                            int endPosition,
                            int branchLevel,
                            int startX,
                            int endX,
                            int branchY,
                            int startY,
                            int endY) {
    }

    public record WireDto(int x1, int y1, int x2, int y2) {
    }
}
