package ir.ipaam.docrender.domain.command;

import com.fasterxml.jackson.databind.JsonNode;
import ir.ipaam.docrender.domain.model.page.PageConfig;

/** Render the editor document to a PDF; {@code title} may be blank. */
public record ExportDocumentCommand(String title, JsonNode content, PageConfig pageConfig) {
}
