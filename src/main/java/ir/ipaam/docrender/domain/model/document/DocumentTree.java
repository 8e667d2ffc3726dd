package ir.ipaam.docrender.domain.model.document;

import java.util.ArrayList;
import java.util.List;

/**
 * Root {@code doc} node. Read-only for the duration of a render.
 */
public record DocumentTree(List<Block> blocks) {

    public DocumentTree {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static DocumentTree of(Block... blocks) {
        return new DocumentTree(List.of(blocks));
    }

    public DocumentTree withLeadingBlock(Block block) {
        List<Block> all = new ArrayList<>(blocks.size() + 1);
        all.add(block);
        all.addAll(blocks);
        return new DocumentTree(all);
    }
}
