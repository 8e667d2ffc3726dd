package ir.ipaam.docrender.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import ir.ipaam.docrender.application.service.render.DocumentRenderEngine;
import ir.ipaam.docrender.application.service.render.RenderResult;
import ir.ipaam.docrender.application.service.render.output.OutputEmitter;
import ir.ipaam.docrender.application.util.FileNameUtils;
import ir.ipaam.docrender.domain.dto.PdfGenerationResult;
import ir.ipaam.docrender.domain.exception.DocumentExportException;
import ir.ipaam.docrender.domain.exception.RenderError;
import ir.ipaam.docrender.domain.model.document.Block;
import ir.ipaam.docrender.domain.model.document.InlineRun;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;
import ir.ipaam.docrender.domain.model.page.PageConfig;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Export flow of the editor: optional title line, layout, PDF serialization.
 */
@Service
@RequiredArgsConstructor
public class DocumentExportService {

    private static final Logger log = LoggerFactory.getLogger(DocumentExportService.class);

    static final int TITLE_HEADING_LEVEL = 2;

    private final DocumentRenderEngine renderEngine;
    private final OutputEmitter outputEmitter;

    public PdfGenerationResult exportPdf(String title, JsonNode content, PageConfig pageConfig) {
        OutputArtifact artifact = layout(title, content, pageConfig);
        byte[] pdf = outputEmitter.emit(artifact);
        String fileName = FileNameUtils.pdfFileName(title);
        log.info("Exported {} ({} pages, {} bytes)", fileName, artifact.pageCount(), pdf.length);
        return new PdfGenerationResult(fileName, pdf, artifact.pageCount());
    }

    public OutputArtifact layout(String title, JsonNode content, PageConfig pageConfig) {
        RenderResult result = renderEngine.render(content, pageConfig, titleBlock(title));
        if (result instanceof RenderResult.Failure failure) {
            RenderError error = failure.error();
            log.warn("Export rejected with {}: {}", error.kind(), error.message());
            throw new DocumentExportException(error);
        }
        return result.orElseThrow();
    }

    static Block titleBlock(String title) {
        if (title == null || title.isBlank()) return null;
        return Block.heading(TITLE_HEADING_LEVEL, List.of(InlineRun.plain(title.trim())));
    }
}
