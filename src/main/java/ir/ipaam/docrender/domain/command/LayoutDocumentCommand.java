package ir.ipaam.docrender.domain.command;

import com.fasterxml.jackson.databind.JsonNode;
import ir.ipaam.docrender.domain.model.page.PageConfig;

/** Lay the editor document out without serializing it to PDF. */
public record LayoutDocumentCommand(String title, JsonNode content, PageConfig pageConfig) {
}
