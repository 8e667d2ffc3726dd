package ir.ipaam.docrender.config;

import ir.ipaam.docrender.application.service.render.metrics.FontMetricProvider;
import ir.ipaam.docrender.application.service.render.metrics.MonospaceMetricProvider;
import ir.ipaam.docrender.application.service.render.metrics.PdfFontMetricProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

@Configuration
@EnableConfigurationProperties(RenderProperties.class)
public class RenderConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RenderConfiguration.class);

    @Bean
    public FontMetricProvider fontMetricProvider(RenderProperties properties) {
        String kind = properties.getMetrics() == null ? "pdf" : properties.getMetrics().trim().toLowerCase(Locale.ROOT);
        log.info("Using {} font metrics", kind);
        return switch (kind) {
            case "pdf" -> new PdfFontMetricProvider();
            case "monospace" -> new MonospaceMetricProvider();
            default -> throw new IllegalStateException(
                    "Unknown docrender.metrics '" + properties.getMetrics() + "', expected pdf or monospace");
        };
    }
}
