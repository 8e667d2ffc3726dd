package ir.ipaam.docrender.domain.model.page;

import java.util.List;

/** One output page; {@code number} is 1-based. Instructions are in paint order. */
public record Page(int number, List<DrawInstruction> instructions) {

    public Page {
        instructions = List.copyOf(instructions);
    }

    public List<TextInstruction> texts() {
        return instructions.stream()
                .filter(TextInstruction.class::isInstance)
                .map(TextInstruction.class::cast)
                .toList();
    }
}
