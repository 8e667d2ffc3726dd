package ir.ipaam.docrender.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ExportRequest {

    private String title;

    /** Editor document, {@code {"type":"doc","content":[...]}}. */
    @NotNull
    private JsonNode content;

    @Valid
    private Settings settings;

    /** Document settings as the editor stores them; every field is optional. */
    @Data
    public static class Settings {
        private String pageSize;
        private Double lineSpacing;
        private Double marginMm;
        private Double pageWidthMm;
        private Double pageHeightMm;
    }
}
