package ir.ipaam.docrender.domain.model.document;

import java.util.Map;

/**
 * Closed set of block kinds the renderer knows how to lay out.
 * Editor node types outside this set map to {@link #UNKNOWN}.
 */
public enum BlockType {
    HEADING("heading"),
    PARAGRAPH("paragraph"),
    BULLET_LIST("bulletList"),
    ORDERED_LIST("orderedList"),
    LIST_ITEM("listItem"),
    BLOCKQUOTE("blockquote"),
    CODE_BLOCK("codeBlock"),
    HORIZONTAL_RULE("horizontalRule"),
    UNKNOWN("");

    private static final Map<String, BlockType> BY_NODE_TYPE = Map.of(
            "heading", HEADING,
            "paragraph", PARAGRAPH,
            "bulletList", BULLET_LIST,
            "orderedList", ORDERED_LIST,
            "listItem", LIST_ITEM,
            "blockquote", BLOCKQUOTE,
            "codeBlock", CODE_BLOCK,
            "horizontalRule", HORIZONTAL_RULE
    );

    private final String nodeType;

    BlockType(String nodeType) {
        this.nodeType = nodeType;
    }

    public String nodeType() {
        return nodeType;
    }

    public static BlockType fromNodeType(String nodeType) {
        if (nodeType == null) return UNKNOWN;
        return BY_NODE_TYPE.getOrDefault(nodeType, UNKNOWN);
    }
}
