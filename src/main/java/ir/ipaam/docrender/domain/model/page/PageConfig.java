package ir.ipaam.docrender.domain.model.page;

import ir.ipaam.docrender.domain.exception.ConfigurationException;

/**
 * Fixed page geometry for one render. All lengths in millimetres.
 * Construction never fails; {@link #validate()} is called by the engine so that
 * a bad geometry surfaces as a typed render failure.
 */
public record PageConfig(
        double pageWidthMm,
        double pageHeightMm,
        double marginMm,
        double lineSpacingMultiplier
) {

    public static final double DEFAULT_MARGIN_MM = 25.4;
    public static final double DEFAULT_LINE_SPACING = 1.15;

    public static PageConfig of(PageProfile profile) {
        return new PageConfig(profile.widthMm(), profile.heightMm(), DEFAULT_MARGIN_MM, DEFAULT_LINE_SPACING);
    }

    public static PageConfig a4() {
        return of(PageProfile.A4);
    }

    public PageConfig withMargin(double marginMm) {
        return new PageConfig(pageWidthMm, pageHeightMm, marginMm, lineSpacingMultiplier);
    }

    public PageConfig withLineSpacing(double lineSpacingMultiplier) {
        return new PageConfig(pageWidthMm, pageHeightMm, marginMm, lineSpacingMultiplier);
    }

    public double contentWidthMm() {
        return pageWidthMm - 2 * marginMm;
    }

    public double contentTopMm() {
        return marginMm;
    }

    public double contentBottomMm() {
        return pageHeightMm - marginMm;
    }

    public double contentHeightMm() {
        return contentBottomMm() - contentTopMm();
    }

    public void validate() {
        requireFinitePositive(pageWidthMm, "pageWidthMm");
        requireFinitePositive(pageHeightMm, "pageHeightMm");
        requireFinitePositive(lineSpacingMultiplier, "lineSpacingMultiplier");
        if (!Double.isFinite(marginMm) || marginMm < 0) {
            throw new ConfigurationException("marginMm must be zero or positive, got " + marginMm);
        }
        if (contentWidthMm() <= 0 || contentHeightMm() <= 0) {
            throw new ConfigurationException("Margin of " + marginMm + "mm leaves no content area on a "
                    + pageWidthMm + "x" + pageHeightMm + "mm page");
        }
    }

    private static void requireFinitePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ConfigurationException(name + " must be positive, got " + value);
        }
    }
}
