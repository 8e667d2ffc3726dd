package ir.ipaam.docrender.application.handler;

import ir.ipaam.docrender.application.service.DocumentExportService;
import ir.ipaam.docrender.domain.command.ExportDocumentCommand;
import ir.ipaam.docrender.domain.command.LayoutDocumentCommand;
import ir.ipaam.docrender.domain.dto.PdfGenerationResult;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;
import lombok.RequiredArgsConstructor;
import org.axonframework.commandhandling.CommandHandler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ExportCommandHandler {

    private final DocumentExportService exportService;

    @CommandHandler
    public PdfGenerationResult handle(ExportDocumentCommand command) {
        return exportService.exportPdf(command.title(), command.content(), command.pageConfig());
    }

    @CommandHandler
    public OutputArtifact handle(LayoutDocumentCommand command) {
        return exportService.layout(command.title(), command.content(), command.pageConfig());
    }
}
