package ir.ipaam.docrender.domain.model.valueobject;

import java.util.Objects;

public record ResolvedRun(String text, Style style) {

    public ResolvedRun {
        Objects.requireNonNull(style, "style");
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Resolved run text must not be empty");
        }
    }

    public ResolvedRun withText(String text) {
        return new ResolvedRun(text, style);
    }
}
