package ir.ipaam.docrender.application.service.render.block;

import ir.ipaam.docrender.application.service.render.metrics.FontMetricProvider;
import ir.ipaam.docrender.application.service.render.output.ArtifactBuilder;
import ir.ipaam.docrender.application.util.PdfTextUtils;
import ir.ipaam.docrender.domain.model.page.LineInstruction;
import ir.ipaam.docrender.domain.model.page.RectInstruction;
import ir.ipaam.docrender.domain.model.page.TextInstruction;
import ir.ipaam.docrender.domain.model.valueobject.ResolvedRun;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import ir.ipaam.docrender.domain.model.valueobject.VisualLine;

import static ir.ipaam.docrender.application.service.render.metrics.FontMetricProvider.PT_TO_MM;

/**
 * Turns a visual line into draw instructions.
 * <p>
 * Left (and justify, which is drawn as left) lines are painted run by run with a
 * running x cursor, so every run keeps its own face, colour and decorations.
 * Centered and right-aligned lines are painted as a single text in the line's
 * dominant style, positioned by its total width.
 */
public class LinePainter {

    static final double UNDERLINE_DROP = 0.12;
    static final double STRIKE_RISE = 0.3;
    static final double DECORATION_WIDTH = 0.05;

    private final FontMetricProvider metrics;
    private final ArtifactBuilder sink;

    public LinePainter(FontMetricProvider metrics, ArtifactBuilder sink) {
        this.metrics = metrics;
        this.sink = sink;
    }

    /**
     * @param x              left content edge
     * @param top            top of the line box
     * @param availableWidth width between {@code x} and the right content edge
     */
    public void paint(VisualLine line, int page, double x, double top, double availableWidth) {
        double bottom = top + line.heightMm();
        double baseline = Math.min(top + metrics.ascentMm(line.maxFontSizePt()), bottom);
        switch (line.align()) {
            case CENTER, RIGHT -> paintAsUnit(line, page, x, top, bottom, baseline, availableWidth);
            case LEFT, JUSTIFY -> paintRuns(line, page, x, top, bottom, baseline);
        }
    }

    /** A line holding nothing but a list marker. */
    public void paintMarker(String marker, Style style, int page, double x, double top, double heightMm) {
        double bottom = top + heightMm;
        double baseline = Math.min(top + metrics.ascentMm(style.fontSizePt()), bottom);
        text(marker, style.plain(), page, x, baseline, bottom);
    }

    private void paintRuns(VisualLine line, int page, double x, double top, double bottom, double baseline) {
        double cursor = x;
        if (line.hasPrefix()) {
            Style markerStyle = line.dominantStyle().plain();
            text(line.prefix(), markerStyle, page, cursor, baseline, bottom);
            cursor += metrics.textWidthMm(line.prefix(), markerStyle);
        }
        for (ResolvedRun run : line.runs()) {
            String visible = PdfTextUtils.stripControl(run.text());
            if (visible.isEmpty()) continue;
            double width = metrics.textWidthMm(visible, run.style());
            segment(visible, run.style(), page, cursor, width, top, bottom, baseline);
            cursor += width;
        }
    }

    private void paintAsUnit(VisualLine line, int page, double x, double top, double bottom,
                             double baseline, double availableWidth) {
        Style style = line.dominantStyle();
        String body = PdfTextUtils.stripControl(line.text()).stripTrailing();
        String whole = line.hasPrefix() ? line.prefix() + body : body;
        if (whole.isEmpty()) return;
        double width = metrics.textWidthMm(whole, style);
        double start = switch (line.align()) {
            case RIGHT -> x + availableWidth - width;
            default -> x + (availableWidth - width) / 2.0;
        };
        segment(whole, style, page, Math.max(x, start), width, top, bottom, baseline);
    }

    private void segment(String text, Style style, int page, double x, double width,
                         double top, double bottom, double baseline) {
        if (style.hasHighlight()) {
            sink.draw(page, new RectInstruction(x, top, width, bottom - top, style.highlight()));
        }
        if (!text.isBlank()) {
            text(text, style, page, x, baseline, bottom);
        }
        double stroke = style.drawSizePt() * PT_TO_MM * DECORATION_WIDTH;
        if (style.underline()) {
            double y = Math.min(baseline + style.drawSizePt() * PT_TO_MM * UNDERLINE_DROP, bottom);
            sink.draw(page, new LineInstruction(x, y, x + width, y, stroke, style.color()));
        }
        if (style.strike()) {
            double y = baseline - style.drawSizePt() * PT_TO_MM * STRIKE_RISE;
            sink.draw(page, new LineInstruction(x, y, x + width, y, stroke, style.color()));
        }
    }

    private void text(String text, Style style, int page, double x, double baseline, double bottom) {
        double y = Math.min(baseline + style.baselineShiftPt() * PT_TO_MM, bottom);
        sink.draw(page, new TextInstruction(x, y, text, style.fontFamily(), style.bold(), style.italic(),
                style.drawSizePt(), style.color()));
    }
}
