package ir.ipaam.docrender.domain.model.page;

import java.util.Locale;
import java.util.Optional;

/** Named page sizes the editor offers, portrait, in millimetres. */
public enum PageProfile {
    A4(210.0, 297.0),
    A5(148.0, 210.0),
    LETTER(215.9, 279.4),
    LEGAL(215.9, 355.6);

    private final double widthMm;
    private final double heightMm;

    PageProfile(double widthMm, double heightMm) {
        this.widthMm = widthMm;
        this.heightMm = heightMm;
    }

    public double widthMm() {
        return widthMm;
    }

    public double heightMm() {
        return heightMm;
    }

    public static Optional<PageProfile> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try {
            return Optional.of(PageProfile.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
