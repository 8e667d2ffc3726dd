package ir.ipaam.docrender.application.service.render.resolve;

import ir.ipaam.docrender.domain.model.valueobject.FontFamily;
import ir.ipaam.docrender.domain.model.valueobject.RgbColor;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StyleValueParserTest {

    @Test
    void shouldParseSizeUnits() {
        assertThat(StyleValueParser.parseSizePt("14", 12f)).isEqualTo(14f);
        assertThat(StyleValueParser.parseSizePt("14pt", 12f)).isEqualTo(14f);
        assertThat(StyleValueParser.parseSizePt("20px", 12f)).isEqualTo(15f);
        assertThat(StyleValueParser.parseSizePt("1.5em", 12f)).isEqualTo(18f);
        assertThat(StyleValueParser.parseSizePt("2rem", 10f)).isEqualTo(20f);
        assertThat(StyleValueParser.parseSizePt("150%", 12f)).isEqualTo(18f);
        assertThat(StyleValueParser.parseSizePt(" 16PX ", 12f)).isEqualTo(12f);
    }

    @Test
    void shouldRejectMalformedSizes() {
        assertThat(StyleValueParser.parseSizePt("0", 12f)).isNull();
        assertThat(StyleValueParser.parseSizePt("-3px", 12f)).isNull();
        assertThat(StyleValueParser.parseSizePt("large", 12f)).isNull();
        assertThat(StyleValueParser.parseSizePt("12vw", 12f)).isNull();
        assertThat(StyleValueParser.parseSizePt(null, 12f)).isNull();
    }

    @Test
    void shouldParseColours() {
        assertThat(StyleValueParser.parseColor("#f00")).isEqualTo(new RgbColor(255, 0, 0));
        assertThat(StyleValueParser.parseColor("#1A2b3C")).isEqualTo(new RgbColor(0x1A, 0x2B, 0x3C));
        assertThat(StyleValueParser.parseColor("rgb(1, 2, 3)")).isEqualTo(new RgbColor(1, 2, 3));
        assertThat(StyleValueParser.parseColor("rgba(10,20,30,0.5)")).isEqualTo(new RgbColor(10, 20, 30));
    }

    @Test
    void shouldRejectMalformedColours() {
        assertThat(StyleValueParser.parseColor("red")).isNull();
        assertThat(StyleValueParser.parseColor("#12345")).isNull();
        assertThat(StyleValueParser.parseColor("rgb(300, 0, 0)")).isNull();
        assertThat(StyleValueParser.parseColor("")).isNull();
    }

    @Test
    void shouldMapFontStacks() {
        assertThat(FontFamilyTable.lookup("'Open Sans', serif")).isEqualTo(FontFamily.HELVETICA);
        assertThat(FontFamilyTable.lookup("Georgia")).isEqualTo(FontFamily.TIMES);
        assertThat(FontFamilyTable.lookup("Fancy Script, \"Courier New\", monospace")).isEqualTo(FontFamily.COURIER);
        assertThat(FontFamilyTable.lookup("Comic Sans MS")).isNull();
        assertThat(FontFamilyTable.lookup(" ")).isNull();
    }
}
