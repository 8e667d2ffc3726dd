package ir.ipaam.docrender.domain.exception;

import lombok.Getter;

/** Raised by the export service when the engine returns a failure. */
@Getter
public class DocumentExportException extends RuntimeException {

    private final RenderError error;

    public DocumentExportException(RenderError error) {
        super(error.kind() + ": " + error.message());
        this.error = error;
    }
}
