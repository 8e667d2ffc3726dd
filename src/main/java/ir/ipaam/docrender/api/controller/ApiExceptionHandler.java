package ir.ipaam.docrender.api.controller;

import ir.ipaam.docrender.api.dto.ApiResponse;
import ir.ipaam.docrender.domain.exception.DocumentExportException;
import ir.ipaam.docrender.domain.exception.RenderError;
import org.axonframework.commandhandling.CommandExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Error envelope {@code {"success":false,"error":{"code","message"}}} for every endpoint.
 * Render errors are the caller's fault (400); anything else is reported as EXPORT_ERROR (500).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String EXPORT_ERROR = "EXPORT_ERROR";

    @ExceptionHandler(DocumentExportException.class)
    public ResponseEntity<ApiResponse<Void>> handleExport(DocumentExportException e) {
        return renderError(e.getError());
    }

    @ExceptionHandler(CommandExecutionException.class)
    public ResponseEntity<ApiResponse<Void>> handleCommand(CommandExecutionException e) {
        if (e.getCause() instanceof DocumentExportException export) {
            return renderError(export.getError());
        }
        return handleUnexpected(e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, VALIDATION_ERROR, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        log.error("Export failed", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, EXPORT_ERROR, "Failed to export document");
    }

    private ResponseEntity<ApiResponse<Void>> renderError(RenderError error) {
        return respond(HttpStatus.BAD_REQUEST, error.kind().name(), error.message());
    }

    private ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiResponse.failure(code, message));
    }
}
