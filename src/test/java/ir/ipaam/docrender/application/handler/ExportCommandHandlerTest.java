package ir.ipaam.docrender.application.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import ir.ipaam.docrender.application.service.DocumentExportService;
import ir.ipaam.docrender.domain.command.ExportDocumentCommand;
import ir.ipaam.docrender.domain.command.LayoutDocumentCommand;
import ir.ipaam.docrender.domain.dto.PdfGenerationResult;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;
import ir.ipaam.docrender.domain.model.page.PageConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExportCommandHandlerTest {

    private final DocumentExportService exportService = mock(DocumentExportService.class);
    private final ExportCommandHandler handler = new ExportCommandHandler(exportService);

    @Test
    void exportCommandIsDelegatedToService() {
        JsonNode content = JsonNodeFactory.instance.objectNode().put("type", "doc");
        PdfGenerationResult expected = new PdfGenerationResult("Notes.pdf", new byte[]{1, 2}, 1);
        when(exportService.exportPdf("Notes", content, PageConfig.a4())).thenReturn(expected);

        PdfGenerationResult result = handler.handle(new ExportDocumentCommand("Notes", content, PageConfig.a4()));

        assertThat(result).isSameAs(expected);
        verify(exportService).exportPdf("Notes", content, PageConfig.a4());
    }

    @Test
    void layoutCommandIsDelegatedToService() {
        JsonNode content = JsonNodeFactory.instance.objectNode().put("type", "doc");
        OutputArtifact expected = new OutputArtifact(210, 297, List.of());
        when(exportService.layout(null, content, PageConfig.a4())).thenReturn(expected);

        OutputArtifact result = handler.handle(new LayoutDocumentCommand(null, content, PageConfig.a4()));

        assertThat(result).isSameAs(expected);
    }
}
