package ir.ipaam.docrender.application.service.render.metrics;

import ir.ipaam.docrender.domain.model.valueobject.Style;

/**
 * Text measurement for a resolved style. Implementations must be safe to share
 * between concurrent renders.
 */
public interface FontMetricProvider {

    double PT_TO_MM = 25.4 / 72.0;

    /** Line height per point of font size, before the line spacing multiplier. */
    double LINE_HEIGHT_MM_PER_PT = 0.38;

    /** Ascent used to place a baseline inside its line box, as a fraction of the font size. */
    double ASCENT_RATIO = 0.8;

    /** Advance width of {@code text} drawn in {@code style}, in millimetres. */
    double textWidthMm(String text, Style style);

    default double lineHeightMm(float fontSizePt, double lineSpacing) {
        return fontSizePt * LINE_HEIGHT_MM_PER_PT * lineSpacing;
    }

    default double ascentMm(float fontSizePt) {
        return fontSizePt * PT_TO_MM * ASCENT_RATIO;
    }
}
