package ir.ipaam.docrender.domain.model.document;

import lombok.Builder;

/**
 * A span of text with the marks the editor attached to it.
 * Attribute marks are kept as the raw strings the editor stored ("16px", "#ff0000");
 * a {@code null} attribute means "inherit the block default".
 */
@Builder(toBuilder = true)
public record InlineRun(
        String text,
        boolean bold,
        boolean italic,
        boolean underline,
        boolean strike,
        boolean superscript,
        boolean subscript,
        String fontFamily,
        String fontSize,
        String color,
        String highlight
) {

    public InlineRun {
        text = text == null ? "" : text;
    }

    public static InlineRun plain(String text) {
        return InlineRun.builder().text(text).build();
    }

    public static InlineRun lineBreak() {
        return plain("\n");
    }
}
