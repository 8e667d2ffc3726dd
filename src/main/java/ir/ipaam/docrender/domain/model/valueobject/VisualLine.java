package ir.ipaam.docrender.domain.model.valueobject;

import ir.ipaam.docrender.domain.model.document.TextAlign;

import java.util.List;

/**
 * One laid-out line. {@code start}/{@code end} index the block's concatenated text;
 * {@code prefix} is the list marker drawn before the first line of an item, or {@code null}.
 */
public record VisualLine(
        List<ResolvedRun> runs,
        int start,
        int end,
        String prefix,
        double heightMm,
        TextAlign align
) {

    public VisualLine {
        runs = List.copyOf(runs);
        if (align == null) align = TextAlign.LEFT;
    }

    public String text() {
        StringBuilder sb = new StringBuilder(end - start);
        for (ResolvedRun run : runs) sb.append(run.text());
        return sb.toString();
    }

    public boolean hasPrefix() {
        return prefix != null && !prefix.isEmpty();
    }

    /** Largest font on the line; the first one wins a tie. */
    public Style dominantStyle() {
        return dominant(runs);
    }

    public float maxFontSizePt() {
        float max = 0f;
        for (ResolvedRun run : runs) max = Math.max(max, run.style().fontSizePt());
        return max;
    }

    public static Style dominant(List<ResolvedRun> runs) {
        Style best = null;
        for (ResolvedRun run : runs) {
            if (best == null || run.style().fontSizePt() > best.fontSizePt()) best = run.style();
        }
        return best;
    }
}
