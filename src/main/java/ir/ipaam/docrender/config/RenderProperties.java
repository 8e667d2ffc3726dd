package ir.ipaam.docrender.config;

import ir.ipaam.docrender.domain.model.page.PageConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Defaults applied when an export request leaves a setting out. */
@Data
@ConfigurationProperties(prefix = "docrender")
public class RenderProperties {

    /** a4, a5, letter or legal. */
    private String pageSize = "a4";

    private double marginMm = PageConfig.DEFAULT_MARGIN_MM;

    private double lineSpacing = PageConfig.DEFAULT_LINE_SPACING;

    /** Width measurement: {@code pdf} (standard font metrics) or {@code monospace}. */
    private String metrics = "pdf";
}
