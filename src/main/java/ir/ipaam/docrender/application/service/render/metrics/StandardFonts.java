package ir.ipaam.docrender.application.service.render.metrics;

import ir.ipaam.docrender.domain.model.valueobject.FontFamily;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lazily created PDFBox standard 14 fonts for one owner. Not thread-safe:
 * the PDF emitter creates one per document and the metric provider one per thread.
 */
public class StandardFonts {

    private final Map<Standard14Fonts.FontName, PDType1Font> fonts = new EnumMap<>(Standard14Fonts.FontName.class);

    public PDType1Font font(Style style) {
        return font(style.fontFamily(), style.bold(), style.italic());
    }

    public PDType1Font font(FontFamily family, boolean bold, boolean italic) {
        return fonts.computeIfAbsent(fontName(family, bold, italic), PDType1Font::new);
    }

    public static Standard14Fonts.FontName fontName(FontFamily family, boolean bold, boolean italic) {
        return switch (family) {
            case HELVETICA -> bold
                    ? (italic ? Standard14Fonts.FontName.HELVETICA_BOLD_OBLIQUE : Standard14Fonts.FontName.HELVETICA_BOLD)
                    : (italic ? Standard14Fonts.FontName.HELVETICA_OBLIQUE : Standard14Fonts.FontName.HELVETICA);
            case TIMES -> bold
                    ? (italic ? Standard14Fonts.FontName.TIMES_BOLD_ITALIC : Standard14Fonts.FontName.TIMES_BOLD)
                    : (italic ? Standard14Fonts.FontName.TIMES_ITALIC : Standard14Fonts.FontName.TIMES_ROMAN);
            case COURIER -> bold
                    ? (italic ? Standard14Fonts.FontName.COURIER_BOLD_OBLIQUE : Standard14Fonts.FontName.COURIER_BOLD)
                    : (italic ? Standard14Fonts.FontName.COURIER_OBLIQUE : Standard14Fonts.FontName.COURIER);
        };
    }
}
