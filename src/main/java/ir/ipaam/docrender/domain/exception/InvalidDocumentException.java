package ir.ipaam.docrender.domain.exception;

/** The document tree does not have the shape the renderer expects. */
public class InvalidDocumentException extends RenderException {

    public InvalidDocumentException(String message) {
        super(message);
    }

    @Override
    public RenderErrorKind kind() {
        return RenderErrorKind.INVALID_DOCUMENT;
    }
}
