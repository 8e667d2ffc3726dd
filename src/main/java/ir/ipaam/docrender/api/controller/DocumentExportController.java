package ir.ipaam.docrender.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import ir.ipaam.docrender.api.dto.ApiResponse;
import ir.ipaam.docrender.api.dto.ExportRequest;
import ir.ipaam.docrender.api.dto.PageProfileView;
import ir.ipaam.docrender.api.mapper.ExportSettingsMapper;
import ir.ipaam.docrender.config.RenderProperties;
import ir.ipaam.docrender.domain.command.ExportDocumentCommand;
import ir.ipaam.docrender.domain.command.LayoutDocumentCommand;
import ir.ipaam.docrender.domain.dto.PdfGenerationResult;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;
import ir.ipaam.docrender.domain.model.page.PageConfig;
import ir.ipaam.docrender.domain.model.page.PageProfile;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.axonframework.commandhandling.gateway.CommandGateway;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/export")
@RequiredArgsConstructor
public class DocumentExportController {

    private final CommandGateway commandGateway;
    private final RenderProperties renderProperties;

    @PostMapping(value = "/pdf", produces = MediaType.APPLICATION_PDF_VALUE)
    @Operation(summary = "Render an editor document to a paginated PDF")
    public ResponseEntity<byte[]> exportPdf(@Valid @RequestBody ExportRequest request) {
        PdfGenerationResult result = commandGateway.sendAndWait(
                new ExportDocumentCommand(request.getTitle(), request.getContent(), pageConfig(request))
        );
        return buildPdfResponse(result);
    }

    @PostMapping(value = "/layout", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Lay an editor document out and return the draw instructions of every page")
    public ResponseEntity<ApiResponse<OutputArtifact>> layout(@Valid @RequestBody ExportRequest request) {
        OutputArtifact artifact = commandGateway.sendAndWait(
                new LayoutDocumentCommand(request.getTitle(), request.getContent(), pageConfig(request))
        );
        return ResponseEntity.ok(ApiResponse.ok(artifact));
    }

    @GetMapping(value = "/page-profiles", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List the named page sizes")
    public ResponseEntity<ApiResponse<List<PageProfileView>>> pageProfiles() {
        List<PageProfileView> profiles = Arrays.stream(PageProfile.values()).map(PageProfileView::of).toList();
        return ResponseEntity.ok(ApiResponse.ok(profiles));
    }

    private PageConfig pageConfig(ExportRequest request) {
        return ExportSettingsMapper.toPageConfig(request.getSettings(), renderProperties);
    }

    private ResponseEntity<byte[]> buildPdfResponse(PdfGenerationResult result) {
        ContentDisposition contentDisposition = ContentDisposition.attachment()
                .filename(result.fileName(), StandardCharsets.UTF_8)
                .build();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(contentDisposition);
        headers.setContentType(MediaType.APPLICATION_PDF);
        return new ResponseEntity<>(result.pdfBytes(), headers, HttpStatus.OK);
    }
}
