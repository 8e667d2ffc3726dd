package ir.ipaam.docrender.application.service.render.block;

/**
 * Per-level rendering state handed down the block tree.
 *
 * @param indentMm x of the left content edge at this nesting depth
 * @param italic   forced italic (inside a blockquote)
 * @param marker   list marker for the first line of the next paragraph, or {@code null}
 */
public record BlockContext(double indentMm, boolean italic, String marker) {

    public static BlockContext root(double leftMarginMm) {
        return new BlockContext(leftMarginMm, false, null);
    }

    /** Deeper level; the marker never carries over. */
    public BlockContext indented(double stepMm) {
        return new BlockContext(indentMm + stepMm, italic, null);
    }

    public BlockContext italicized() {
        return new BlockContext(indentMm, true, marker);
    }

    public BlockContext withMarker(String marker) {
        return new BlockContext(indentMm, italic, marker);
    }
}
