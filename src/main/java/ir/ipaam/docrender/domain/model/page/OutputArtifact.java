package ir.ipaam.docrender.domain.model.page;

import java.util.List;

/** Paginated result of a render: the page size plus the draw instructions of every page. */
public record OutputArtifact(double pageWidthMm, double pageHeightMm, List<Page> pages) {

    public OutputArtifact {
        pages = List.copyOf(pages);
    }

    public int pageCount() {
        return pages.size();
    }

    public List<TextInstruction> texts() {
        return pages.stream().flatMap(p -> p.texts().stream()).toList();
    }
}
