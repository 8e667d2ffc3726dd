package ir.ipaam.docrender.domain.model.valueobject;

/**
 * Position of a resolved run inside the concatenated text of its block.
 */
public class SpanRun {
    public final int start;
    public final int end;
    public final ResolvedRun run;

    public SpanRun(int start, int end, ResolvedRun run) {
        this.start = start;
        this.end = end;
        this.run = run;
    }

    public boolean overlaps(int from, int to) {
        return start < to && end > from;
    }

    /** The part of this run that falls inside [from, to). */
    public ResolvedRun slice(int from, int to) {
        int s = Math.max(from, start) - start;
        int e = Math.min(to, end) - start;
        if (s == 0 && e == run.text().length()) return run;
        return run.withText(run.text().substring(s, e));
    }
}
