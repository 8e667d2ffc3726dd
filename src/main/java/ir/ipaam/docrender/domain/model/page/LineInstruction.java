package ir.ipaam.docrender.domain.model.page;

import ir.ipaam.docrender.domain.model.valueobject.RgbColor;

public record LineInstruction(
        double x1,
        double y1,
        double x2,
        double y2,
        double strokeWidthMm,
        RgbColor color
) implements DrawInstruction {

    @Override
    public double bottomMm() {
        return Math.max(y1, y2);
    }
}
