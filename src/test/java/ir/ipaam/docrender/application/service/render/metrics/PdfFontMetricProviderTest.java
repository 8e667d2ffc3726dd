package ir.ipaam.docrender.application.service.render.metrics;

import ir.ipaam.docrender.domain.model.valueobject.FontFamily;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PdfFontMetricProviderTest {

    private final PdfFontMetricProvider metrics = new PdfFontMetricProvider();

    @Test
    void courierAdvancesSixHundredUnitsPerGlyph() {
        Style courier = Style.builder().fontFamily(FontFamily.COURIER).fontSizePt(12f).build();

        assertThat(metrics.textWidthMm("MMMM", courier)).isCloseTo(10.16, within(1e-6));
        assertThat(metrics.textWidthMm("iiii", courier)).isCloseTo(10.16, within(1e-6));
    }

    @Test
    void boldHelveticaIsWiderThanRegular() {
        Style regular = Style.builder().fontSizePt(12f).build();
        Style bold = regular.toBuilder().bold(true).build();

        assertThat(metrics.textWidthMm("Hello", bold)).isGreaterThan(metrics.textWidthMm("Hello", regular));
    }

    @Test
    void scriptsAreMeasuredAtReducedSize() {
        Style regular = Style.builder().fontFamily(FontFamily.TIMES).fontSizePt(12f).build();
        Style superscript = regular.toBuilder().superscript(true).build();

        assertThat(metrics.textWidthMm("2", superscript))
                .isCloseTo(metrics.textWidthMm("2", regular) * 0.65, within(1e-4));
    }

    @Test
    void unencodableTextIsMeasuredAfterFolding() {
        Style style = Style.builder().fontSizePt(12f).build();

        assertThat(metrics.textWidthMm("", style)).isZero();
        assertThat(metrics.textWidthMm("Привет", style)).isPositive();
    }

    @Test
    void parallelMeasurementsMatchSequentialOnes() {
        Style bold = Style.builder().fontSizePt(12f).bold(true).build();
        double expected = metrics.textWidthMm("Parallel width", bold);

        List<Double> widths = IntStream.range(0, 64).parallel()
                .mapToObj(i -> metrics.textWidthMm("Parallel width", bold))
                .toList();

        assertThat(widths).allSatisfy(width -> assertThat(width).isEqualTo(expected));
    }

    @Test
    void lineHeightAndAscentFollowFixedRatios() {
        assertThat(metrics.lineHeightMm(12f, 1.15)).isCloseTo(5.244, within(1e-9));
        assertThat(metrics.ascentMm(12f)).isCloseTo(12 * 25.4 / 72 * 0.8, within(1e-9));
    }
}
