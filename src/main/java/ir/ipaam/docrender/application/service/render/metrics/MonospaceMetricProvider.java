package ir.ipaam.docrender.application.service.render.metrics;

import ir.ipaam.docrender.domain.model.valueobject.Style;

/**
 * Fixed-width approximation: every code point advances 0.6 em regardless of face.
 */
public class MonospaceMetricProvider implements FontMetricProvider {

    public static final double ADVANCE_EM = 0.6;

    @Override
    public double textWidthMm(String text, Style style) {
        if (text == null || text.isEmpty()) return 0.0;
        int glyphs = text.codePointCount(0, text.length());
        return glyphs * ADVANCE_EM * style.drawSizePt() * PT_TO_MM;
    }
}
