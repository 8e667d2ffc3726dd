package ir.ipaam.docrender.application.service.render.output;

import ir.ipaam.docrender.domain.model.page.DrawInstruction;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;
import ir.ipaam.docrender.domain.model.page.Page;
import ir.ipaam.docrender.domain.model.page.PageConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects draw instructions per page during a render. Pages are addressable by
 * their 1-based number so decorations can be added to a page after the cursor
 * has moved on.
 */
public class ArtifactBuilder {

    private final double pageWidthMm;
    private final double pageHeightMm;
    private final List<List<DrawInstruction>> pages = new ArrayList<>();

    public ArtifactBuilder(PageConfig config) {
        this.pageWidthMm = config.pageWidthMm();
        this.pageHeightMm = config.pageHeightMm();
        pages.add(new ArrayList<>());
    }

    public void draw(int pageNumber, DrawInstruction instruction) {
        if (pageNumber < 1) throw new IllegalArgumentException("Page numbers start at 1, got " + pageNumber);
        while (pages.size() < pageNumber) pages.add(new ArrayList<>());
        pages.get(pageNumber - 1).add(instruction);
    }

    /** Makes sure pages up to {@code pageNumber} exist, even if nothing is drawn on them. */
    public void touch(int pageNumber) {
        while (pages.size() < pageNumber) pages.add(new ArrayList<>());
    }

    public int instructionCount() {
        return pages.stream().mapToInt(List::size).sum();
    }

    /** Instructions drawn so far on one page; 0 for a page that does not exist yet. */
    public int instructionCount(int pageNumber) {
        return pageNumber >= 1 && pageNumber <= pages.size() ? pages.get(pageNumber - 1).size() : 0;
    }

    public OutputArtifact build() {
        List<Page> out = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) out.add(new Page(i + 1, pages.get(i)));
        return new OutputArtifact(pageWidthMm, pageHeightMm, out);
    }
}
