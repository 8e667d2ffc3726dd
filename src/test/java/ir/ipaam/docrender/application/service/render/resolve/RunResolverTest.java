package ir.ipaam.docrender.application.service.render.resolve;

import ir.ipaam.docrender.domain.model.document.InlineRun;
import ir.ipaam.docrender.domain.model.valueobject.FontFamily;
import ir.ipaam.docrender.domain.model.valueobject.ResolvedRun;
import ir.ipaam.docrender.domain.model.valueobject.RgbColor;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

class RunResolverTest {

    private final RunResolver resolver = new RunResolver();

    @Test
    void bodyDefaultsApplyWhenRunHasNoMarks() {
        Style style = resolver.resolveStyle(InlineRun.plain("x"), BlockDefaults.body(false));

        assertThat(style.fontFamily()).isEqualTo(FontFamily.HELVETICA);
        assertThat(style.fontSizePt()).isEqualTo(12f);
        assertThat(style.bold()).isFalse();
        assertThat(style.color()).isEqualTo(RgbColor.BLACK);
        assertThat(style.hasHighlight()).isFalse();
    }

    @Test
    void headingForcesBoldAndLevelSize() {
        Style style = resolver.resolveStyle(InlineRun.plain("Title"), BlockDefaults.heading(1, false));

        assertThat(style.bold()).isTrue();
        assertThat(style.fontSizePt()).isEqualTo(24f);
        assertThat(BlockDefaults.headingSizePt(2)).isEqualTo(18f);
        assertThat(BlockDefaults.headingSizePt(3)).isEqualTo(14f);
        assertThat(BlockDefaults.headingSizePt(6)).isEqualTo(14f);
    }

    @Test
    void blockquoteForcesItalic() {
        Style style = resolver.resolveStyle(InlineRun.plain("quoted"), BlockDefaults.body(true));

        assertThat(style.italic()).isTrue();
    }

    @Test
    void explicitAttributesOverrideDefaults() {
        InlineRun run = InlineRun.builder()
                .text("styled")
                .fontFamily("Georgia, serif")
                .fontSize("16px")
                .color("#ff0000")
                .highlight("rgb(0, 255, 0)")
                .underline(true)
                .build();

        Style style = resolver.resolveStyle(run, BlockDefaults.body(false));

        assertThat(style.fontFamily()).isEqualTo(FontFamily.TIMES);
        assertThat(style.fontSizePt()).isEqualTo(12f);
        assertThat(style.color()).isEqualTo(new RgbColor(255, 0, 0));
        assertThat(style.highlight()).isEqualTo(new RgbColor(0, 255, 0));
        assertThat(style.underline()).isTrue();
    }

    @Test
    void malformedValuesFallBackToDefaults() {
        InlineRun run = InlineRun.builder()
                .text("x")
                .fontFamily("Comic Sans MS")
                .fontSize("huge")
                .color("not-a-colour")
                .highlight("???")
                .build();

        Style style = resolver.resolveStyle(run, BlockDefaults.body(false));

        assertThat(style.fontFamily()).isEqualTo(FontFamily.HELVETICA);
        assertThat(style.fontSizePt()).isEqualTo(12f);
        assertThat(style.color()).isEqualTo(RgbColor.BLACK);
        assertThat(style.highlight()).isEqualTo(RgbColor.EDITOR_HIGHLIGHT);
    }

    @Test
    void codeBlockKeepsMonospaceFamily() {
        InlineRun run = InlineRun.builder().text("int x;").fontFamily("Arial").build();

        Style style = resolver.resolveStyle(run, BlockDefaults.code(false));

        assertThat(style.fontFamily()).isEqualTo(FontFamily.COURIER);
        assertThat(style.fontSizePt()).isEqualTo(10f);
    }

    @Test
    void superscriptWinsOverSubscript() {
        InlineRun run = InlineRun.builder().text("2").superscript(true).subscript(true).build();

        Style style = resolver.resolveStyle(run, BlockDefaults.body(false));

        assertThat(style.superscript()).isTrue();
        assertThat(style.subscript()).isFalse();
        assertThat(style.drawSizePt()).isCloseTo(7.8f, offset(1e-4f));
        assertThat(style.baselineShiftPt()).isNegative();
    }

    @Test
    void emptyRunsAreDroppedAndEqualNeighboursMerged() {
        List<InlineRun> inline = List.of(
                InlineRun.plain("Hello"),
                InlineRun.plain(""),
                InlineRun.plain(" world"),
                InlineRun.builder().text("!").bold(true).build());

        List<ResolvedRun> runs = resolver.resolve(inline, BlockDefaults.body(false));

        assertThat(runs).extracting(ResolvedRun::text).containsExactly("Hello world", "!");
        assertThat(runs.get(1).style().bold()).isTrue();
    }
}
