package ir.ipaam.docrender.domain.exception;

public enum RenderErrorKind {
    CONFIGURATION_ERROR,
    INVALID_DOCUMENT
}
