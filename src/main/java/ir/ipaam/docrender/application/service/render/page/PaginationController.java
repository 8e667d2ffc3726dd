package ir.ipaam.docrender.application.service.render.page;

import ir.ipaam.docrender.domain.model.page.PageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the vertical cursor of one render. The offset is measured from the top
 * edge of the page and always stays within [top margin, page height - margin].
 */
public class PaginationController {

    private static final Logger log = LoggerFactory.getLogger(PaginationController.class);

    private final double contentTop;
    private final double contentBottom;

    private int pageIndex = 1;
    private double offset;

    public PaginationController(PageConfig config) {
        this.contentTop = config.contentTopMm();
        this.contentBottom = config.contentBottomMm();
        this.offset = contentTop;
    }

    /**
     * Makes sure {@code heightMm} fits below the cursor, breaking the page first when
     * it does not. On a fresh page nothing is broken, even for content taller than
     * the page.
     *
     * @return {@code true} if the space was available on the current page,
     *         {@code false} if a page break was inserted to make room
     */
    public boolean requestSpace(double heightMm) {
        if (fits(heightMm) || isAtPageTop()) return true;
        breakPage();
        return false;
    }

    public boolean fits(double heightMm) {
        return offset + heightMm <= contentBottom + 1e-9;
    }

    /** Moves the cursor down past content that has just been drawn. */
    public void advance(double heightMm) {
        offset = Math.min(offset + heightMm, Math.max(contentBottom, offset));
    }

    /**
     * Adds vertical spacing. Spacing that would run past the bottom margin is
     * collapsed to the bottom, so the next request breaks the page.
     */
    public void skip(double heightMm) {
        if (isAtPageTop()) return;
        offset = Math.min(offset + heightMm, contentBottom);
    }

    public void breakPage() {
        pageIndex++;
        offset = contentTop;
        log.trace("Page break, now on page {}", pageIndex);
    }

    public int pageIndex() {
        return pageIndex;
    }

    public double offsetMm() {
        return offset;
    }

    public double remainingHeightMm() {
        return Math.max(0.0, contentBottom - offset);
    }

    public double contentTopMm() {
        return contentTop;
    }

    public double contentBottomMm() {
        return contentBottom;
    }

    public double contentHeightMm() {
        return contentBottom - contentTop;
    }

    public boolean isAtPageTop() {
        return offset <= contentTop;
    }
}
