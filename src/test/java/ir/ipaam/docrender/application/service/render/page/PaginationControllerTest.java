package ir.ipaam.docrender.application.service.render.page;

import ir.ipaam.docrender.domain.model.page.PageConfig;
import ir.ipaam.docrender.domain.model.page.PageProfile;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PaginationControllerTest {

    // A5 with a 20mm margin: content from 20 to 190, 170mm high
    private final PaginationController pagination =
            new PaginationController(PageConfig.of(PageProfile.A5).withMargin(20));

    @Test
    void startsAtTopOfFirstPage() {
        assertThat(pagination.pageIndex()).isEqualTo(1);
        assertThat(pagination.offsetMm()).isEqualTo(20.0);
        assertThat(pagination.isAtPageTop()).isTrue();
        assertThat(pagination.remainingHeightMm()).isCloseTo(170.0, within(1e-9));
    }

    @Test
    void requestSpaceKeepsPageWhenContentFits() {
        pagination.advance(100);

        assertThat(pagination.requestSpace(70)).isTrue();
        assertThat(pagination.pageIndex()).isEqualTo(1);
        assertThat(pagination.offsetMm()).isCloseTo(120.0, within(1e-9));
    }

    @Test
    void requestSpaceBreaksPageWhenContentOverflows() {
        pagination.advance(100);

        assertThat(pagination.requestSpace(71)).isFalse();
        assertThat(pagination.pageIndex()).isEqualTo(2);
        assertThat(pagination.offsetMm()).isEqualTo(20.0);
    }

    @Test
    void freshPageNeverBreaks() {
        assertThat(pagination.requestSpace(500)).isTrue();
        assertThat(pagination.pageIndex()).isEqualTo(1);
    }

    @Test
    void advanceIsClampedToBottomMargin() {
        pagination.advance(500);

        assertThat(pagination.offsetMm()).isEqualTo(190.0);
        assertThat(pagination.remainingHeightMm()).isZero();
    }

    @Test
    void skipIsIgnoredAtPageTopAndCollapsesAtBottom() {
        pagination.skip(10);
        assertThat(pagination.offsetMm()).isEqualTo(20.0);

        pagination.advance(165);
        pagination.skip(10);
        assertThat(pagination.offsetMm()).isEqualTo(190.0);
        assertThat(pagination.requestSpace(1)).isFalse();
        assertThat(pagination.pageIndex()).isEqualTo(2);
    }
}
