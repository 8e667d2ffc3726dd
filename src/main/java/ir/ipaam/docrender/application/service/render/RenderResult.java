package ir.ipaam.docrender.application.service.render;

import ir.ipaam.docrender.domain.exception.DocumentExportException;
import ir.ipaam.docrender.domain.exception.RenderError;
import ir.ipaam.docrender.domain.model.page.OutputArtifact;

/**
 * Outcome of one render: a complete artifact or a typed error, never both.
 */
public sealed interface RenderResult permits RenderResult.Success, RenderResult.Failure {

    record Success(OutputArtifact artifact) implements RenderResult {
    }

    record Failure(RenderError error) implements RenderResult {
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default OutputArtifact orElseThrow() {
        if (this instanceof Success success) return success.artifact();
        throw new DocumentExportException(((Failure) this).error());
    }
}
