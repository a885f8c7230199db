package io.github.pyrox.ladder.layout;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.pyrox.ladder.model.RungElement;
import io.github.pyrox.ladder.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spacing constants of the layout engine, in integer virtual units. These are engine
 * configuration, never per-rung state.
 *
 * @param leftRailX         x of the left power rail
 * @param railOffset        gap between the left power rail and the first main-rail element
 * @param elementSpacing    gap between neighbouring elements on a rail
 * @param minimumWireLength wire stub added on top of {@code elementSpacing}
 * @param rungHeight        height of one row (the main row and every branch row)
 * @param branchSpacing     vertical distance between consecutive rows
 * @param rungSpacing       gap between the bottom of a rung and the top of the next one
 * @param topMargin         y of the first rung
 * @param commentLineHeight height reserved per comment line above the main row
 * @param minRightRailX     right power rail never sits left of this
 */
public record LayoutConfig(int leftRailX,
                           int railOffset,
                           int elementSpacing,
                           int minimumWireLength,
                           int rungHeight,
                           int branchSpacing,
                           int rungSpacing,
                           int topMargin,
                           int commentLineHeight,
                           int contactWidth,
                           int contactHeight,
                           int coilWidth,
                           int coilHeight,
                           int blockWidth,
                           int blockHeight,
                           int markerWidth,
                           int markerHeight,
                           int minRightRailX)
{
    private static final Logger logger = LogManager.getLogger(LayoutConfig.class);

    public static final String RESOURCE_NAME = "ladder-layout.json";

    private static final LayoutConfig DEFAULTS = new LayoutConfig(40, 10, 10, 10, 60, 60, 20, 50, 15,
                                                                  40, 30, 40, 30, 80, 40, 10, 10, 600);

    public LayoutConfig {
        requireNonNegative("leftRailX", leftRailX);
        requireNonNegative("railOffset", railOffset);
        requireNonNegative("elementSpacing", elementSpacing);
        requireNonNegative("minimumWireLength", minimumWireLength);
        requireNonNegative("rungSpacing", rungSpacing);
        requireNonNegative("topMargin", topMargin);
        requireNonNegative("commentLineHeight", commentLineHeight);
        requireNonNegative("minRightRailX", minRightRailX);
        requirePositive("rungHeight", rungHeight);
        requirePositive("branchSpacing", branchSpacing);
        requirePositive("contactWidth", contactWidth);
        requirePositive("coilWidth", coilWidth);
        requirePositive("blockWidth", blockWidth);
        requirePositive("markerWidth", markerWidth);
        requireFitsRow("contactHeight", contactHeight, rungHeight);
        requireFitsRow("coilHeight", coilHeight, rungHeight);
        requireFitsRow("blockHeight", blockHeight, rungHeight);
        requireFitsRow("markerHeight", markerHeight, rungHeight);
    }

    public static LayoutConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Loads {@value #RESOURCE_NAME} from the classpath, falling back to {@link #defaults()} when the
     * resource is absent or unreadable.
     */
    public static LayoutConfig load() {
        try (InputStream in = resource(RESOURCE_NAME)) {
            if (in == null) {
                logger.warn("{} not found on classpath, using built-in layout defaults", RESOURCE_NAME);
                return DEFAULTS;
            }
            return overlay(in.readAllBytes());
        } catch (IOException e) {
            logger.warn("Failed to read {} from classpath, using built-in layout defaults", RESOURCE_NAME, e);
            return DEFAULTS;
        }
    }

    /**
     * Loads a config file. Keys missing from the file keep their default value.
     */
    public static LayoutConfig load(Path file) throws IOException {
        return overlay(Files.readAllBytes(file));
    }

    private static LayoutConfig overlay(byte[] json) throws IOException {
        var tree = Json.mapper.readTree(json);
        if (tree == null || !tree.isObject()) {
            throw new IOException("Layout config must be a JSON object");
        }
        ObjectNode merged = Json.mapper.valueToTree(DEFAULTS);
        merged.setAll((ObjectNode) tree);
        return Json.mapper.treeToValue(merged, LayoutConfig.class);
    }

    public int widthOf(RungElement element) {
        return switch (element.kind()) {
            case INSTRUCTION -> switch (element.instruction().kind()) {
                case CONTACT -> contactWidth;
                case COIL -> coilWidth;
                case BLOCK -> blockWidth;
            };
            case BRANCH_START, BRANCH_NEXT, BRANCH_END -> markerWidth;
        };
    }

    public int heightOf(RungElement element) {
        return switch (element.kind()) {
            case INSTRUCTION -> switch (element.instruction().kind()) {
                case CONTACT -> contactHeight;
                case COIL -> coilHeight;
                case BLOCK -> blockHeight;
            };
            case BRANCH_START, BRANCH_NEXT, BRANCH_END -> markerHeight;
        };
    }

    /** Horizontal advance from one element's right edge to the next element's left edge. */
    public int horizontalGap() {
        return elementSpacing + minimumWireLength;
    }

    private static InputStream resource(String name) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        InputStream in = (cl != null) ? cl.getResourceAsStream(name) : null;
        return (in != null) ? in : LayoutConfig.class.getClassLoader().getResourceAsStream(name);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    private static void requireFitsRow(String name, int value, int rungHeight) {
        requirePositive(name, value);
        if (value > rungHeight) {
            throw new IllegalArgumentException("%s %d exceeds rungHeight %d".formatted(name, value, rungHeight));
        }
    }
}
