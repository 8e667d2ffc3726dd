package ir.ipaam.docrender.domain.exception;

/**
 * Fatal render failure. Thrown inside the engine and turned into a
 * {@code RenderResult.Failure} before it reaches a caller.
 */
public abstract class RenderException extends RuntimeException {

    protected RenderException(String message) {
        super(message);
    }

    public abstract RenderErrorKind kind();
}
