package ir.ipaam.docrender.domain.exception;

/** Invalid page geometry or layout parameters. */
public class ConfigurationException extends RenderException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public RenderErrorKind kind() {
        return RenderErrorKind.CONFIGURATION_ERROR;
    }
}
