package ir.ipaam.docrender.domain.model.document;

import java.util.List;

/**
 * One structural node of a document.
 * <ul>
 *   <li>{@code heading}, {@code paragraph} and {@code codeBlock} carry {@link #inline()} content;</li>
 *   <li>lists, list items, blockquotes and unknown nodes carry {@link #children()};</li>
 *   <li>{@code horizontalRule} carries neither.</li>
 * </ul>
 * {@link #level()} is only meaningful for headings, {@link #start()} only for ordered lists.
 */
public record Block(
        BlockType type,
        String nodeType,
        TextAlign align,
        int level,
        int start,
        List<Block> children,
        List<InlineRun> inline
) {

    public Block {
        if (type == null) type = BlockType.UNKNOWN;
        if (nodeType == null) nodeType = type.nodeType();
        if (align == null) align = TextAlign.LEFT;
        children = children == null ? List.of() : List.copyOf(children);
        inline = inline == null ? List.of() : List.copyOf(inline);
    }

    public static Block heading(int level, List<InlineRun> inline) {
        return heading(level, TextAlign.LEFT, inline);
    }

    public static Block heading(int level, TextAlign align, List<InlineRun> inline) {
        return new Block(BlockType.HEADING, null, align, level, 1, null, inline);
    }

    public static Block paragraph(List<InlineRun> inline) {
        return paragraph(TextAlign.LEFT, inline);
    }

    public static Block paragraph(TextAlign align, List<InlineRun> inline) {
        return new Block(BlockType.PARAGRAPH, null, align, 0, 1, null, inline);
    }

    public static Block paragraph(String text) {
        return paragraph(List.of(InlineRun.plain(text)));
    }

    public static Block bulletList(List<Block> items) {
        return new Block(BlockType.BULLET_LIST, null, TextAlign.LEFT, 0, 1, items, null);
    }

    public static Block orderedList(int start, List<Block> items) {
        return new Block(BlockType.ORDERED_LIST, null, TextAlign.LEFT, 0, start, items, null);
    }

    public static Block listItem(List<Block> children) {
        return new Block(BlockType.LIST_ITEM, null, TextAlign.LEFT, 0, 1, children, null);
    }

    public static Block blockquote(List<Block> children) {
        return new Block(BlockType.BLOCKQUOTE, null, TextAlign.LEFT, 0, 1, children, null);
    }

    public static Block codeBlock(String source) {
        return new Block(BlockType.CODE_BLOCK, null, TextAlign.LEFT, 0, 1, null,
                source == null || source.isEmpty() ? List.of() : List.of(InlineRun.plain(source)));
    }

    public static Block horizontalRule() {
        return new Block(BlockType.HORIZONTAL_RULE, null, TextAlign.LEFT, 0, 1, null, null);
    }

    public static Block unknown(String nodeType, List<Block> children) {
        return new Block(BlockType.UNKNOWN, nodeType, TextAlign.LEFT, 0, 1, children, null);
    }
}
