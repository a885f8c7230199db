package io.github.pyrox.ladder.layout;

import io.github.pyrox.ladder.model.InstructionKind;
import io.github.pyrox.ladder.model.RungElement;
import io.github.pyrox.ladder.model.RungElementType;
import org.jetbrains.annotations.Nullable;

/**
 * Positioned drawable for one rung element. {@code x} and {@code y} are the top-left corner.
 *
 * @param row visual row the element is drawn on, 0 being the main rail
 */
public record LayoutElement(RungElementType kind,
                            @Nullable InstructionKind instructionKind,
                            int x,
                            int y,
                            int width,
                            int height,
                            int rungNumber,
                            int branchLevel,
                            @Nullable Integer branchId,
                            int row,
                            RungElement source,
                            boolean selected)
{
    public int position() {
        return source.position();
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }

    public boolean contains(int px, int py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }

    public LayoutElement withSelected(boolean value) {
        if (value == selected) {
            return this;
        }
        return new LayoutElement(kind, instructionKind, x, y, width, height, rungNumber, branchLevel,
                                 branchId, row, source, value);
    }
}
