package io.github.pyrox.ladder.dto;

import io.github.pyrox.ladder.dto.LayoutDtos.*;
import io.github.pyrox.ladder.layout.BranchLayout;
import io.github.pyrox.ladder.layout.LayoutElement;
import io.github.pyrox.ladder.layout.LayoutResult;
import io.github.pyrox.ladder.layout.RoutineLayout;
import io.github.pyrox.ladder.layout.WireSegment;
import io.github.pyrox.ladder.model.Routine;
import io.github.pyrox.ladder.model.Rung;

/**
 * Converts between the routine model, its layout and their DTOs.
 */
public final class DtoMapper {

    private DtoMapper() {
        // Utility class - no instantiation
    }

    /**
     * Builds a routine from input records; every rung text is parsed and indexed.
     */
    public static Routine toRoutine(RoutineInputDto dto) {
        var rungs = dto.rungs().stream()
                .map(r -> Rung.parse(r.text(), r.comment()))
                .toList();
        return new Routine(dto.name(), rungs);
    }

    public static RoutineInputDto toInputDto(Routine routine) {
        var rungs = routine.rungs().stream()
                .map(r -> new RungInputDto(r.text(), r.comment()))
                .toList();
        return new RoutineInputDto(routine.name(), rungs);
    }

    /**
     * Snapshot of a routine's current layout.
     */
    public static RoutineLayoutDto toDto(RoutineLayout layout) {
        var routine = layout.routine();
        var rungs = layout.results().stream()
                .map(result -> toRungDto(routine.rung(result.rungNumber()), result))
                .toList();
        var extent = layout.extent();
        return new RoutineLayoutDto(routine.name(), extent.width(), extent.height(),
                                    layout.config().leftRailX(), layout.rightRailX(), rungs);
    }

    public static RungLayoutDto toRungDto(Rung rung, LayoutResult result) {
        return new RungLayoutDto(result.rungNumber(),
                                 rung.text(),
                                 rung.comment(),
                                 result.y(),
                                 result.height(),
                                 result.commentHeight(),
                                 result.maxBranchDepth(),
                                 result.elements().stream().map(DtoMapper::toElementDto).toList(),
                                 result.branches().stream().map(DtoMapper::toBranchDto).toList(),
                                 result.wires().stream().map(DtoMapper::toWireDto).toList());
    }

    private static ElementDto toElementDto(LayoutElement e) {
        var instruction = e.source().instruction();
        return new ElementDto(e.kind().name(),
                              e.instructionKind() == null ? null : e.instructionKind().name(),
                              instruction == null ? null : instruction.text(),
                              e.position(),
                              e.x(),
                              e.y(),
                              e.width(),
                              e.height(),
                              e.branchLevel(),
                              e.branchId(),
                              e.row(),
                              e.selected());
    }

    private static BranchDto toBranchDto(BranchLayout b) {
        var bounds = b.bounds();
        return new BranchDto(b.id(),
                             b.kind().name(),
                             b.parentBranchId(),
                             b.rootBranchId(),
                             b.childBranchIds(),
                             b.startPosition(),
                             b.endPosition(),
                             b.branchLevel(),
                             bounds.startX(),
                             bounds.endX(),
                             bounds.branchY(),
                             bounds.startY(),
                             bounds.endY());
    }

    private static WireDto toWireDto(WireSegment w) {
        return new WireDto(w.x1(), w.y1(), w.x2(), w.y2());
    }
}
