package ir.ipaam.docrender.application.service.render;

import com.fasterxml.jackson.databind.JsonNode;
import ir.ipaam.docrender.domain.exception.InvalidDocumentException;
import ir.ipaam.docrender.domain.model.document.Block;
import ir.ipaam.docrender.domain.model.document.BlockType;
import ir.ipaam.docrender.domain.model.document.DocumentTree;
import ir.ipaam.docrender.domain.model.document.InlineRun;
import ir.ipaam.docrender.domain.model.document.TextAlign;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the editor's JSON document ({@code {"type":"doc","content":[...]}}) into a
 * {@link DocumentTree}. Structural problems raise {@link InvalidDocumentException}
 * with the path of the offending node; unknown node and mark types are tolerated.
 */
@Component
public class DocumentTreeReader {

    private static final Logger log = LoggerFactory.getLogger(DocumentTreeReader.class);

    static final String DEFAULT_HIGHLIGHT = "#FFEB3B";
    private static final int MAX_HEADING_LEVEL = 3;

    public DocumentTree read(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            throw new InvalidDocumentException("Document is missing");
        }
        if (!root.isObject()) {
            throw new InvalidDocumentException("Document root must be an object, got " + root.getNodeType());
        }
        String type = root.path("type").asText("");
        if (!"doc".equals(type)) {
            throw new InvalidDocumentException("Document root must be of type 'doc', got '" + type + "'");
        }
        return new DocumentTree(readBlocks(root, "doc"));
    }

    private List<Block> readBlocks(JsonNode parent, String path) {
        List<JsonNode> nodes = content(parent, path);
        List<Block> blocks = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            blocks.add(readBlock(nodes.get(i), path + ".content[" + i + "]"));
        }
        return blocks;
    }

    private Block readBlock(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new InvalidDocumentException("Node at " + path + " must be an object");
        }
        String nodeType = node.path("type").asText("");
        BlockType type = BlockType.fromNodeType(nodeType);
        JsonNode attrs = node.path("attrs");
        TextAlign align = TextAlign.parse(textAttr(attrs, "textAlign"));

        return switch (type) {
            case HEADING -> {
                int level = Math.max(1, Math.min(MAX_HEADING_LEVEL, attrs.path("level").asInt(1)));
                yield new Block(type, nodeType, align, level, 1, null, readInline(node, path));
            }
            case PARAGRAPH, CODE_BLOCK -> new Block(type, nodeType, align, 0, 1, null, readInline(node, path));
            case ORDERED_LIST -> new Block(type, nodeType, align, 0, attrs.path("start").asInt(1),
                    readBlocks(node, path), null);
            case BULLET_LIST, LIST_ITEM, BLOCKQUOTE, UNKNOWN ->
                    new Block(type, nodeType, align, 0, 1, readBlocks(node, path), null);
            case HORIZONTAL_RULE -> new Block(type, nodeType, align, 0, 1, null, null);
        };
    }

    private List<InlineRun> readInline(JsonNode parent, String path) {
        List<JsonNode> nodes = content(parent, path);
        List<InlineRun> runs = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            JsonNode node = nodes.get(i);
            String nodePath = path + ".content[" + i + "]";
            if (!node.isObject()) {
                throw new InvalidDocumentException("Inline node at " + nodePath + " must be an object");
            }
            String type = node.path("type").asText("");
            switch (type) {
                case "text" -> runs.add(readText(node, nodePath));
                case "hardBreak" -> runs.add(InlineRun.lineBreak());
                default -> log.debug("Skipping inline node '{}' at {}", type, nodePath);
            }
        }
        return runs;
    }

    private InlineRun readText(JsonNode node, String path) {
        JsonNode text = node.get("text");
        if (text == null || !text.isTextual()) {
            throw new InvalidDocumentException("Text node at " + path + " has no string 'text'");
        }
        InlineRun.InlineRunBuilder run = InlineRun.builder().text(text.asText().replace("\r\n", "\n"));

        JsonNode marks = node.get("marks");
        if (marks == null || marks.isNull()) return run.build();
        if (!marks.isArray()) {
            throw new InvalidDocumentException("'marks' at " + path + " must be a list");
        }
        for (JsonNode mark : marks) {
            JsonNode attrs = mark.path("attrs");
            switch (mark.path("type").asText("")) {
                case "bold" -> run.bold(true);
                case "italic" -> run.italic(true);
                case "underline" -> run.underline(true);
                case "strike" -> run.strike(true);
                case "superscript" -> run.superscript(true);
                case "subscript" -> run.subscript(true);
                case "code" -> run.fontFamily("monospace");
                case "textStyle" -> {
                    String family = textAttr(attrs, "fontFamily");
                    String size = textAttr(attrs, "fontSize");
                    String color = textAttr(attrs, "color");
                    if (family != null) run.fontFamily(family);
                    if (size != null) run.fontSize(size);
                    if (color != null) run.color(color);
                }
                case "highlight" -> {
                    String color = textAttr(attrs, "color");
                    run.highlight(color != null ? color : DEFAULT_HIGHLIGHT);
                }
                default -> log.debug("Ignoring mark '{}' at {}", mark.path("type").asText(""), path);
            }
        }
        return run.build();
    }

    private static List<JsonNode> content(JsonNode parent, String path) {
        JsonNode content = parent.get("content");
        if (content == null || content.isNull()) return List.of();
        if (!content.isArray()) {
            throw new InvalidDocumentException("'content' of " + path + " must be a list");
        }
        List<JsonNode> out = new ArrayList<>(content.size());
        content.forEach(out::add);
        return out;
    }

    /** Textual or numeric attribute value, {@code null} when absent or blank. */
    private static String textAttr(JsonNode attrs, String name) {
        JsonNode value = attrs.get(name);
        if (value == null || value.isNull() || !value.isValueNode()) return null;
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
