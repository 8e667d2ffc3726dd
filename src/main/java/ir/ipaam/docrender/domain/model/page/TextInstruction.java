package ir.ipaam.docrender.domain.model.page;

import ir.ipaam.docrender.domain.model.valueobject.FontFamily;
import ir.ipaam.docrender.domain.model.valueobject.RgbColor;

/** Text drawn with its baseline at {@code y}. */
public record TextInstruction(
        double x,
        double y,
        String text,
        FontFamily font,
        boolean bold,
        boolean italic,
        float sizePt,
        RgbColor color
) implements DrawInstruction {

    @Override
    public double bottomMm() {
        return y;
    }
}
