package ir.ipaam.docrender.domain.model.page;

import ir.ipaam.docrender.domain.model.valueobject.RgbColor;

/** Filled rectangle whose top-left corner is at ({@code x}, {@code y}). */
public record RectInstruction(
        double x,
        double y,
        double width,
        double height,
        RgbColor fill
) implements DrawInstruction {

    @Override
    public double bottomMm() {
        return y + height;
    }
}
