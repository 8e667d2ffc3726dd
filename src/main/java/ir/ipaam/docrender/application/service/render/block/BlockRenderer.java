package ir.ipaam.docrender.application.service.render.block;

import ir.ipaam.docrender.application.service.render.layout.LineBreaker;
import ir.ipaam.docrender.application.service.render.output.ArtifactBuilder;
import ir.ipaam.docrender.application.service.render.page.PaginationController;
import ir.ipaam.docrender.application.service.render.resolve.BlockDefaults;
import ir.ipaam.docrender.application.service.render.resolve.RunResolver;
import ir.ipaam.docrender.domain.model.document.Block;
import ir.ipaam.docrender.domain.model.document.BlockType;
import ir.ipaam.docrender.domain.model.document.TextAlign;
import ir.ipaam.docrender.domain.model.page.LineInstruction;
import ir.ipaam.docrender.domain.model.page.PageConfig;
import ir.ipaam.docrender.domain.model.page.RectInstruction;
import ir.ipaam.docrender.domain.model.valueobject.FontFamily;
import ir.ipaam.docrender.domain.model.valueobject.ResolvedRun;
import ir.ipaam.docrender.domain.model.valueobject.RgbColor;
import ir.ipaam.docrender.domain.model.valueobject.Style;
import ir.ipaam.docrender.domain.model.valueobject.VisualLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Draws blocks top to bottom, one render at a time. Holds the pagination cursor
 * and the artifact sink of the render it belongs to, so a new instance is made
 * for every document.
 */
public class BlockRenderer {

    private static final Logger log = LoggerFactory.getLogger(BlockRenderer.class);

    static final double HEADING_SPACE_ABOVE_MM = 4.0;
    static final double HEADING_SPACE_BELOW_MM = 2.0;
    static final double PARAGRAPH_SPACE_BELOW_MM = 2.0;
    static final double LIST_INDENT_MM = 6.0;
    static final double QUOTE_INDENT_MM = 6.0;
    static final double QUOTE_RULE_INSET_MM = 2.0;
    static final double QUOTE_RULE_WIDTH_MM = 0.6;
    static final double CODE_PADDING_MM = 2.0;
    static final double RULE_GAP_MM = 6.0;
    static final double RULE_WIDTH_MM = 0.3;

    static final String BULLET = "• ";

    static final RgbColor CODE_BACKGROUND = new RgbColor(0xF4, 0xF4, 0xF4);
    static final RgbColor QUOTE_RULE_COLOR = new RgbColor(0x99, 0x99, 0x99);
    static final RgbColor RULE_COLOR = new RgbColor(0xBB, 0xBB, 0xBB);

    private final RunResolver resolver;
    private final LineBreaker breaker;
    private final PaginationController pagination;
    private final ArtifactBuilder sink;
    private final LinePainter painter;
    private final double rightEdgeMm;

    public BlockRenderer(RunResolver resolver, LineBreaker breaker, PaginationController pagination,
                         ArtifactBuilder sink, LinePainter painter, PageConfig config) {
        this.resolver = resolver;
        this.breaker = breaker;
        this.pagination = pagination;
        this.sink = sink;
        this.painter = painter;
        this.rightEdgeMm = config.marginMm() + config.contentWidthMm();
    }

    /**
     * Renders one block and everything below it.
     *
     * @return number of text lines laid out
     */
    public int render(Block block, BlockContext ctx) {
        return switch (block.type()) {
            case HEADING -> renderHeading(block, ctx);
            case PARAGRAPH -> renderParagraph(block, ctx);
            case BULLET_LIST, ORDERED_LIST -> renderList(block, ctx);
            case LIST_ITEM -> renderListItem(block, ctx, null);
            case BLOCKQUOTE -> renderBlockquote(block, ctx);
            case CODE_BLOCK -> renderCodeBlock(block, ctx);
            case HORIZONTAL_RULE -> renderHorizontalRule(ctx);
            case UNKNOWN -> renderUnknown(block, ctx);
        };
    }

    private int renderHeading(Block block, BlockContext ctx) {
        BlockDefaults defaults = BlockDefaults.heading(block.level(), ctx.italic());
        List<ResolvedRun> runs = resolver.resolve(block.inline(), defaults);
        List<VisualLine> lines = breaker.breakLines(runs, widthAt(ctx), ctx.marker(), block.align());

        pagination.skip(HEADING_SPACE_ABOVE_MM);
        if (lines.isEmpty()) {
            blankLine(ctx, defaults.baseSizePt(), true);
            pagination.skip(HEADING_SPACE_BELOW_MM);
            return 1;
        }

        double height = 0.0;
        for (VisualLine line : lines) height += line.heightMm();
        boolean fitsOnOnePage = height <= pagination.contentHeightMm();
        if (fitsOnOnePage) {
            // keep the heading on the same page as the first line that follows it
            double withNext = height + HEADING_SPACE_BELOW_MM + breaker.lineHeightMm(BlockDefaults.BODY_SIZE_PT);
            pagination.requestSpace(Math.min(withNext, pagination.contentHeightMm()));
        }
        for (VisualLine line : lines) {
            if (!fitsOnOnePage) pagination.requestSpace(line.heightMm());
            drawLine(line, ctx);
        }
        pagination.skip(HEADING_SPACE_BELOW_MM);
        return lines.size();
    }

    private int renderParagraph(Block block, BlockContext ctx) {
        List<ResolvedRun> runs = resolver.resolve(block.inline(), BlockDefaults.body(ctx.italic()));
        List<VisualLine> lines = breaker.breakLines(runs, widthAt(ctx), ctx.marker(), block.align());
        if (lines.isEmpty()) {
            blankLine(ctx, BlockDefaults.BODY_SIZE_PT, false);
        } else {
            for (VisualLine line : lines) {
                pagination.requestSpace(line.heightMm());
                drawLine(line, ctx);
            }
        }
        pagination.skip(PARAGRAPH_SPACE_BELOW_MM);
        return Math.max(1, lines.size());
    }

    private int renderList(Block list, BlockContext ctx) {
        boolean ordered = list.type() == BlockType.ORDERED_LIST;
        int number = list.start();
        int lines = 0;
        for (Block child : list.children()) {
            if (child.type() == BlockType.LIST_ITEM) {
                String marker = ordered ? (number++) + ". " : BULLET;
                lines += renderListItem(child, ctx, marker);
            } else {
                lines += render(child, ctx.indented(LIST_INDENT_MM));
            }
        }
        return lines;
    }

    private int renderListItem(Block item, BlockContext ctx, String marker) {
        BlockContext inner = ctx.indented(LIST_INDENT_MM);
        List<Block> children = item.children();
        int lines = 0;
        if (marker != null && (children.isEmpty() || !takesMarker(children.get(0)))) {
            blankLine(inner.withMarker(marker), BlockDefaults.BODY_SIZE_PT, false);
            lines++;
            marker = null;
        }
        for (int i = 0; i < children.size(); i++) {
            BlockContext childCtx = i == 0 && marker != null ? inner.withMarker(marker) : inner;
            lines += render(children.get(i), childCtx);
        }
        return lines;
    }

    private static boolean takesMarker(Block block) {
        return block.type() == BlockType.PARAGRAPH || block.type() == BlockType.HEADING;
    }

    private int renderBlockquote(Block quote, BlockContext ctx) {
        int startPage = pagination.pageIndex();
        double startY = pagination.offsetMm();
        int drawnBefore = sink.instructionCount(startPage);

        BlockContext inner = ctx.indented(QUOTE_INDENT_MM).italicized();
        int lines = 0;
        for (Block child : quote.children()) lines += render(child, inner);

        int endPage = pagination.pageIndex();
        double endY = pagination.offsetMm();
        // the rule starts on the first page the quote actually drew on
        while (startPage < endPage && sink.instructionCount(startPage) == drawnBefore) {
            startPage++;
            startY = pagination.contentTopMm();
            drawnBefore = 0;
        }
        double x = ctx.indentMm() + QUOTE_RULE_INSET_MM;
        for (int page = startPage; page <= endPage; page++) {
            double top = page == startPage ? startY : pagination.contentTopMm();
            double bottom = page == endPage ? endY : pagination.contentBottomMm();
            if (bottom > top) {
                sink.draw(page, new LineInstruction(x, top, x, bottom, QUOTE_RULE_WIDTH_MM, QUOTE_RULE_COLOR));
            }
        }
        return lines;
    }

    private int renderCodeBlock(Block block, BlockContext ctx) {
        List<ResolvedRun> runs = resolver.resolve(block.inline(), BlockDefaults.code(ctx.italic()));
        double x = ctx.indentMm();
        double boxWidth = rightEdgeMm - x;
        double textWidth = boxWidth - 2 * CODE_PADDING_MM;
        List<VisualLine> lines = breaker.breakLines(runs, textWidth, null, TextAlign.LEFT);

        if (lines.isEmpty()) {
            double boxHeight = breaker.lineHeightMm(BlockDefaults.CODE_SIZE_PT) + 2 * CODE_PADDING_MM;
            pagination.requestSpace(boxHeight);
            sink.draw(pagination.pageIndex(),
                    new RectInstruction(x, pagination.offsetMm(), boxWidth, boxHeight, CODE_BACKGROUND));
            pagination.advance(boxHeight);
            pagination.skip(PARAGRAPH_SPACE_BELOW_MM);
            return 0;
        }

        // one background box per page the block lands on
        int next = 0;
        while (next < lines.size()) {
            double available = pagination.remainingHeightMm() - 2 * CODE_PADDING_MM;
            int end = next;
            double chunkHeight = 0.0;
            while (end < lines.size() && chunkHeight + lines.get(end).heightMm() <= available + 1e-9) {
                chunkHeight += lines.get(end).heightMm();
                end++;
            }
            if (end == next) {
                if (!pagination.isAtPageTop()) {
                    pagination.breakPage();
                    continue;
                }
                chunkHeight = lines.get(next).heightMm();
                end = next + 1;
            }
            double boxHeight = chunkHeight + 2 * CODE_PADDING_MM;
            pagination.requestSpace(boxHeight);
            int page = pagination.pageIndex();
            double top = pagination.offsetMm();
            sink.draw(page, new RectInstruction(x, top, boxWidth, boxHeight, CODE_BACKGROUND));
            double y = top + CODE_PADDING_MM;
            for (int i = next; i < end; i++) {
                painter.paint(lines.get(i), page, x + CODE_PADDING_MM, y, textWidth);
                y += lines.get(i).heightMm();
            }
            pagination.advance(boxHeight);
            next = end;
        }
        pagination.skip(PARAGRAPH_SPACE_BELOW_MM);
        return lines.size();
    }

    private int renderHorizontalRule(BlockContext ctx) {
        pagination.requestSpace(RULE_GAP_MM);
        double y = pagination.offsetMm() + RULE_GAP_MM / 2.0;
        sink.draw(pagination.pageIndex(),
                new LineInstruction(ctx.indentMm(), y, rightEdgeMm, y, RULE_WIDTH_MM, RULE_COLOR));
        pagination.advance(RULE_GAP_MM);
        return 0;
    }

    private int renderUnknown(Block block, BlockContext ctx) {
        if (block.children().isEmpty()) {
            log.debug("Skipping unsupported node '{}'", block.nodeType());
            return 0;
        }
        int lines = 0;
        for (Block child : block.children()) lines += render(child, ctx);
        return lines;
    }

    /** A line with no text: takes one line of height and still shows a pending list marker. */
    private void blankLine(BlockContext ctx, float sizePt, boolean bold) {
        double height = breaker.lineHeightMm(sizePt);
        pagination.requestSpace(height);
        if (ctx.marker() != null) {
            Style markerStyle = Style.builder()
                    .fontFamily(FontFamily.HELVETICA)
                    .fontSizePt(sizePt)
                    .bold(bold)
                    .italic(ctx.italic())
                    .build();
            painter.paintMarker(ctx.marker(), markerStyle, pagination.pageIndex(), ctx.indentMm(),
                    pagination.offsetMm(), height);
        }
        pagination.advance(height);
    }

    private void drawLine(VisualLine line, BlockContext ctx) {
        painter.paint(line, pagination.pageIndex(), ctx.indentMm(), pagination.offsetMm(), widthAt(ctx));
        pagination.advance(line.heightMm());
    }

    private double widthAt(BlockContext ctx) {
        return rightEdgeMm - ctx.indentMm();
    }
}
