package ir.ipaam.docrender.domain.exception;

import java.util.Objects;

public record RenderError(RenderErrorKind kind, String message) {

    public RenderError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? kind.name() : message;
    }

    public static RenderError of(RenderException e) {
        return new RenderError(e.kind(), e.getMessage());
    }
}
