package ir.ipaam.docrender.domain.model.valueobject;

import lombok.Builder;

/**
 * Fully resolved text style. Every field is concrete except {@code highlight},
 * where {@code null} means the run has no background.
 */
@Builder(toBuilder = true)
public record Style(
        FontFamily fontFamily,
        float fontSizePt,
        boolean bold,
        boolean italic,
        boolean underline,
        boolean strike,
        boolean superscript,
        boolean subscript,
        RgbColor color,
        RgbColor highlight
) {

    static final float SCRIPT_SCALE = 0.65f;
    static final float SUPERSCRIPT_RISE = 0.35f;
    static final float SUBSCRIPT_DROP = 0.15f;

    public Style {
        if (fontFamily == null) fontFamily = FontFamily.HELVETICA;
        if (color == null) color = RgbColor.BLACK;
        // superscript wins
        if (superscript) subscript = false;
    }

    /** Size the glyphs are actually drawn (and measured) at. */
    public float drawSizePt() {
        return superscript || subscript ? fontSizePt * SCRIPT_SCALE : fontSizePt;
    }

    /** Baseline shift in points; negative moves the glyphs up the page. */
    public float baselineShiftPt() {
        if (superscript) return -fontSizePt * SUPERSCRIPT_RISE;
        if (subscript) return fontSizePt * SUBSCRIPT_DROP;
        return 0f;
    }

    public boolean hasHighlight() {
        return highlight != null;
    }

    /** The same face without decorations, for list markers. */
    public Style plain() {
        return toBuilder()
                .underline(false)
                .strike(false)
                .superscript(false)
                .subscript(false)
                .highlight(null)
                .build();
    }
}
