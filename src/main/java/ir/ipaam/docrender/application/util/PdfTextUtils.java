package ir.ipaam.docrender.application.util;

import com.ibm.icu.text.Transliterator;
import org.apache.pdfbox.pdmodel.font.PDFont;

import java.io.IOException;

/**
 * Makes arbitrary text drawable with a PDF standard 14 font, whose WinAnsi
 * encoding covers Latin-1 and a few typographic marks only.
 */
public final class PdfTextUtils {

    private static final Transliterator TO_LATIN = Transliterator.getInstance("Any-Latin; Latin-ASCII");
    private static final String TAB_EXPANSION = "    ";

    private PdfTextUtils() {
    }

    /**
     * Keeps every glyph the font can encode, folds the rest through ICU
     * ({@code Any-Latin; Latin-ASCII}) and replaces what still fails with {@code ?}.
     * Line breaks and other control characters are dropped; tabs become four spaces.
     */
    public static String toEncodable(String text, PDFont font) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == '\t') {
                out.append(TAB_EXPANSION);
            } else if (Character.isISOControl(cp)) {
                continue;
            } else if (canEncode(font, cp)) {
                out.appendCodePoint(cp);
            } else {
                appendFolded(out, new String(Character.toChars(cp)), font);
            }
        }
        return out.toString();
    }

    /** Removes line terminators and other control characters, keeping everything else. */
    public static String stripControl(String text) {
        if (text == null || text.isEmpty()) return "";
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints()
                .filter(cp -> cp == '\t' || !Character.isISOControl(cp))
                .forEach(out::appendCodePoint);
        return out.toString();
    }

    private static void appendFolded(StringBuilder out, String glyph, PDFont font) {
        String folded;
        synchronized (TO_LATIN) {
            folded = TO_LATIN.transliterate(glyph);
        }
        if (folded.equals(glyph)) {
            out.append('?');
            return;
        }
        folded.codePoints().forEach(cp -> {
            if (!Character.isISOControl(cp) && canEncode(font, cp)) out.appendCodePoint(cp);
            else out.append('?');
        });
    }

    private static boolean canEncode(PDFont font, int cp) {
        if (cp >= 0x20 && cp < 0x7F) return true;
        try {
            font.encode(new String(Character.toChars(cp)));
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }
}
