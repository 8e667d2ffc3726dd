package ir.ipaam.docrender.application.service.render.resolve;

import ir.ipaam.docrender.domain.model.valueobject.FontFamily;

/**
 * Style a block imposes on its runs. Forced flags are OR-ed with the run's marks;
 * {@code lockFamily} makes the block family win over an explicit font family mark.
 */
public record BlockDefaults(
        FontFamily fontFamily,
        float baseSizePt,
        boolean forceBold,
        boolean forceItalic,
        boolean lockFamily
) {

    public static final float BODY_SIZE_PT = 12f;
    public static final float CODE_SIZE_PT = 10f;

    private static final float[] HEADING_SIZES_PT = {24f, 18f, 14f};

    public static BlockDefaults body(boolean italic) {
        return new BlockDefaults(FontFamily.HELVETICA, BODY_SIZE_PT, false, italic, false);
    }

    public static BlockDefaults heading(int level, boolean italic) {
        return new BlockDefaults(FontFamily.HELVETICA, headingSizePt(level), true, italic, false);
    }

    public static BlockDefaults code(boolean italic) {
        return new BlockDefaults(FontFamily.COURIER, CODE_SIZE_PT, false, italic, true);
    }

    /** Levels outside 1..3 are clamped into that range. */
    public static float headingSizePt(int level) {
        int index = Math.max(1, Math.min(HEADING_SIZES_PT.length, level)) - 1;
        return HEADING_SIZES_PT[index];
    }
}
