package ir.ipaam.docrender.application.service.render;

import com.fasterxml.jackson.databind.JsonNode;
import ir.ipaam.docrender.application.service.render.block.BlockContext;
import ir.ipaam.docrender.application.service.render.block.BlockRenderer;
import ir.ipaam.docrender.application.service.render.block.LinePainter;
import ir.ipaam.docrender.application.service.render.layout.LineBreaker;
import ir.ipaam.docrender.application.service.render.metrics.FontMetricProvider;
import ir.ipaam.docrender.application.service.render.output.ArtifactBuilder;
import ir.ipaam.docrender.application.service.render.page.PaginationController;
import ir.ipaam.docrender.application.service.render.resolve.RunResolver;
import ir.ipaam.docrender.domain.exception.ConfigurationException;
import ir.ipaam.docrender.domain.exception.InvalidDocumentException;
import ir.ipaam.docrender.domain.exception.RenderError;
import ir.ipaam.docrender.domain.exception.RenderException;
import ir.ipaam.docrender.domain.model.document.Block;
import ir.ipaam.docrender.domain.model.document.DocumentTree;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;
import ir.ipaam.docrender.domain.model.page.PageConfig;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Lays a document out onto fixed-size pages.
 * <p>
 * Every call builds its own cursor and artifact, so the engine is safe to share
 * between threads and the same input always yields the same artifact. Typed
 * render errors are returned as {@link RenderResult.Failure}; nothing partial
 * escapes.
 */
@Service
@RequiredArgsConstructor
public class DocumentRenderEngine {

    private static final Logger log = LoggerFactory.getLogger(DocumentRenderEngine.class);

    private final FontMetricProvider metrics;
    private final DocumentTreeReader treeReader;
    private final RunResolver resolver = new RunResolver();

    public RenderResult render(DocumentTree tree, PageConfig config) {
        return render(() -> tree, config);
    }

    public RenderResult render(JsonNode document, PageConfig config) {
        return render(() -> treeReader.read(document), config);
    }

    /** Renders {@code header} as the first block, ahead of the document's own content. */
    public RenderResult render(JsonNode document, PageConfig config, Block header) {
        if (header == null) return render(document, config);
        return render(() -> treeReader.read(document).withLeadingBlock(header), config);
    }

    private RenderResult render(Supplier<DocumentTree> source, PageConfig config) {
        try {
            if (config == null) throw new ConfigurationException("Page configuration is required");
            config.validate();
            DocumentTree tree = source.get();
            if (tree == null) throw new InvalidDocumentException("Document is missing");
            return new RenderResult.Success(layout(tree, config));
        } catch (RenderException e) {
            log.debug("Render rejected ({}): {}", e.kind(), e.getMessage());
            return new RenderResult.Failure(RenderError.of(e));
        }
    }

    private OutputArtifact layout(DocumentTree tree, PageConfig config) {
        ArtifactBuilder sink = new ArtifactBuilder(config);
        PaginationController pagination = new PaginationController(config);
        LineBreaker breaker = new LineBreaker(metrics, config.lineSpacingMultiplier());
        BlockRenderer renderer = new BlockRenderer(resolver, breaker, pagination, sink,
                new LinePainter(metrics, sink), config);

        BlockContext root = BlockContext.root(config.marginMm());
        int lines = 0;
        for (Block block : tree.blocks()) {
            lines += renderer.render(block, root);
        }
        sink.touch(pagination.pageIndex());

        OutputArtifact artifact = sink.build();
        log.debug("Rendered {} blocks as {} lines on {} pages ({} instructions)",
                tree.blocks().size(), lines, artifact.pageCount(), sink.instructionCount());
        return artifact;
    }
}
