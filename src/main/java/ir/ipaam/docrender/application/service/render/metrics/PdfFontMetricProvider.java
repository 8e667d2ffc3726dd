package ir.ipaam.docrender.application.service.render.metrics;

import ir.ipaam.docrender.application.util.PdfTextUtils;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Widths from the AFM metrics of the PDF standard 14 fonts, i.e. the faces the
 * PDF emitter draws with. Text is folded to encodable glyphs the same way the
 * emitter folds it, so measured and drawn widths agree.
 * <p>
 * PDFBox fonts are not thread-safe, so every thread measures with its own set.
 */
public class PdfFontMetricProvider implements FontMetricProvider {

    private final ThreadLocal<StandardFonts> fonts = ThreadLocal.withInitial(StandardFonts::new);

    @Override
    public double textWidthMm(String text, Style style) {
        if (text == null || text.isEmpty()) return 0.0;
        PDType1Font font = fonts.get().font(style);
        String encodable = PdfTextUtils.toEncodable(text, font);
        try {
            return font.getStringWidth(encodable) / 1000.0 * style.drawSizePt() * PT_TO_MM;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed measuring text in " + font.getName(), e);
        }
    }
}
