package ir.ipaam.docrender.application.service.render.output;

import ir.ipaam.docrender.domain.model.page.OutputArtifact;

/**
 * Serializes a finished artifact to an output medium.
 */
public interface OutputEmitter {

    String contentType();

    byte[] emit(OutputArtifact artifact);
}
