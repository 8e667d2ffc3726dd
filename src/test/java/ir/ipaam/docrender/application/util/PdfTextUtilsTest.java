package ir.ipaam.docrender.application.util;

import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PdfTextUtilsTest {

    private final PDType1Font helvetica = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

    @Test
    void keepsEncodableText() {
        assertThat(PdfTextUtils.toEncodable("Hello, world!", helvetica)).isEqualTo("Hello, world!");
        assertThat(PdfTextUtils.toEncodable("café", helvetica)).isEqualTo("café");
    }

    @Test
    void expandsTabsAndDropsLineBreaks() {
        assertThat(PdfTextUtils.toEncodable("a\tb\nc", helvetica)).isEqualTo("a    bc");
    }

    @Test
    void transliteratesOtherScripts() {
        assertThat(PdfTextUtils.toEncodable("Привет", helvetica)).isEqualTo("Privet");
        assertThat(PdfTextUtils.toEncodable("中", helvetica)).doesNotContain("中").isNotEmpty();
    }

    @Test
    void stripControlKeepsTabs() {
        assertThat(PdfTextUtils.stripControl("a\nb\tc\r")).isEqualTo("ab\tc");
        assertThat(PdfTextUtils.stripControl(null)).isEmpty();
    }

    @Test
    void pdfFileNameReplacesEverythingButLettersAndDigits() {
        assertThat(FileNameUtils.pdfFileName("Q3 report: final!")).isEqualTo("Q3_report__final_.pdf");
        assertThat(FileNameUtils.pdfFileName("  ")).isEqualTo("Untitled_Document.pdf");
        assertThat(FileNameUtils.pdfFileName(null)).isEqualTo("Untitled_Document.pdf");
    }
}
