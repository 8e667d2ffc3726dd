package ir.ipaam.docrender.application.service.render.layout;

import ir.ipaam.docrender.application.service.render.metrics.FontMetricProvider;
import ir.ipaam.docrender.domain.exception.ConfigurationException;
import ir.ipaam.docrender.domain.model.document.TextAlign;
import ir.ipaam.docrender.domain.model.valueobject.ResolvedRun;
import ir.ipaam.docrender.domain.model.valueobject.SpanRun;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import ir.ipaam.docrender.domain.model.valueobject.VisualLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Greedy word wrap over a block's runs.
 * <p>
 * The runs are concatenated into one logical string and broken at whitespace,
 * measured with the block's dominant style (largest size, first on a tie). The
 * resulting ranges are then cut back along the original run boundaries, so a
 * run crossing a break is split into two runs with the same style. Whitespace
 * at a break stays at the end of the line it follows and {@code '\n'} forces a
 * break after itself: every character of the input lands on exactly one line.
 * A word wider than the line is emitted on its own line unsplit.
 */
public class LineBreaker {

    private final FontMetricProvider metrics;
    private final double lineSpacing;

    public LineBreaker(FontMetricProvider metrics, double lineSpacing) {
        this.metrics = metrics;
        this.lineSpacing = lineSpacing;
    }

    /**
     * @param prefix literal text drawn before the first line only (list markers); it does not
     *               take part in width measurement, may be {@code null}
     */
    public List<VisualLine> breakLines(List<ResolvedRun> runs, double widthMm, String prefix, TextAlign align) {
        if (!(widthMm > 0) || Double.isInfinite(widthMm)) {
            throw new ConfigurationException("Content width must be positive, got " + widthMm + "mm");
        }
        if (runs.isEmpty()) return Collections.emptyList();

        StringBuilder sb = new StringBuilder();
        List<SpanRun> spans = new ArrayList<>(runs.size());
        for (ResolvedRun run : runs) {
            int start = sb.length();
            sb.append(run.text());
            spans.add(new SpanRun(start, sb.length(), run));
        }
        String text = sb.toString();
        Style wrapStyle = VisualLine.dominant(runs);

        List<int[]> ranges = lineRanges(text, widthMm, wrapStyle);

        List<VisualLine> out = new ArrayList<>(ranges.size());
        int spanIndex = 0;
        for (int i = 0; i < ranges.size(); i++) {
            int from = ranges.get(i)[0];
            int to = ranges.get(i)[1];
            while (spanIndex < spans.size() && spans.get(spanIndex).end <= from) spanIndex++;
            List<ResolvedRun> pieces = new ArrayList<>();
            for (int s = spanIndex; s < spans.size() && spans.get(s).start < to; s++) {
                SpanRun span = spans.get(s);
                if (span.overlaps(from, to)) pieces.add(span.slice(from, to));
            }
            out.add(new VisualLine(pieces, from, to, i == 0 ? prefix : null, heightOf(pieces), align));
        }
        return out;
    }

    /** Height of a line: largest participating font size in mm, times the line spacing. */
    public double heightOf(List<ResolvedRun> pieces) {
        float max = 0f;
        for (ResolvedRun piece : pieces) max = Math.max(max, piece.style().fontSizePt());
        return metrics.lineHeightMm(max, lineSpacing);
    }

    public double lineHeightMm(float fontSizePt) {
        return metrics.lineHeightMm(fontSizePt, lineSpacing);
    }

    private List<int[]> lineRanges(String text, double widthMm, Style wrapStyle) {
        List<int[]> ranges = new ArrayList<>();
        int n = text.length();
        int lineStart = 0;
        while (lineStart < n) {
            int cursor = lineStart;
            int breakAt = n;
            boolean hasWord = false;
            double lineWidth = 0.0;
            while (cursor < n) {
                if (text.charAt(cursor) == '\n') {
                    breakAt = cursor + 1;
                    break;
                }
                int wordStart = cursor;
                while (wordStart < n && isBreakingSpace(text.charAt(wordStart))) wordStart++;
                int wordEnd = wordStart;
                while (wordEnd < n && !Character.isWhitespace(text.charAt(wordEnd))) wordEnd++;
                if (wordEnd == wordStart) {
                    // only whitespace left before a newline or the end
                    cursor = wordStart;
                    continue;
                }
                double candidate = lineWidth + metrics.textWidthMm(text.substring(cursor, wordEnd), wrapStyle);
                if (hasWord && candidate > widthMm) {
                    breakAt = wordStart;
                    break;
                }
                lineWidth = candidate;
                hasWord = true;
                cursor = wordEnd;
            }
            ranges.add(new int[]{lineStart, breakAt});
            lineStart = breakAt;
        }
        return ranges;
    }

    private static boolean isBreakingSpace(char c) {
        return c != '\n' && Character.isWhitespace(c);
    }
}
