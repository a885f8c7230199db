package io.github.pyrox.ladder.util;

import io.github.pyrox.ladder.dto.DtoMapper;
import io.github.pyrox.ladder.dto.LayoutDtos.RoutineInputDto;
import io.github.pyrox.ladder.dto.LayoutDtos.RoutineLayoutDto;
import io.github.pyrox.ladder.layout.RoutineLayout;
import io.github.pyrox.ladder.model.Routine;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads routines from and writes routines and layout snapshots to JSON files.
 */
public final class LayoutIo {
    private static final Logger logger = LogManager.getLogger(LayoutIo.class);

    private LayoutIo() {}

    public static Routine readRoutine(Path file) throws IOException {
        RoutineInputDto dto;
        try {
            dto = Json.mapper.readValue(Files.readAllBytes(file), RoutineInputDto.class);
        } catch (Exception e) {
            logger.error("Failed to read routine file: {}", file, e);
            throw new IOException("Failed to read routine file: " + file, e);
        }
        // rung text errors are model errors, not I/O errors
        return DtoMapper.toRoutine(dto);
    }

    public static void writeRoutine(Routine routine, Path file) throws IOException {
        write(DtoMapper.toInputDto(routine), file, "routine");
    }

    public static void writeLayout(RoutineLayout layout, Path file) throws IOException {
        write(DtoMapper.toDto(layout), file, "layout");
    }

    public static RoutineLayoutDto readLayout(Path file) throws IOException {
        try {
            return Json.mapper.readValue(Files.readAllBytes(file), RoutineLayoutDto.class);
        } catch (Exception e) {
            logger.error("Failed to read layout file: {}", file, e);
            throw new IOException("Failed to read layout file: " + file, e);
        }
    }

    public static String toJson(RoutineLayout layout) throws IOException {
        return Json.mapper.writerWithDefaultPrettyPrinter().writeValueAsString(DtoMapper.toDto(layout));
    }

    private static void write(Object dto, Path file, String what) throws IOException {
        try {
            byte[] bytes = Json.mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(dto);
            Files.write(file, bytes);
        } catch (Exception e) {
            logger.error("Failed to write {} file: {}", what, file, e);
            throw new IOException("Failed to write %s file: %s".formatted(what, file), e);
        }
    }
}
