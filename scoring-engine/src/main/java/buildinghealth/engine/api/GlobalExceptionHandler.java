package buildinghealth.engine.api;

import buildinghealth.domain.exception.InsufficientDataException;
import buildinghealth.domain.exception.InvalidSampleException;
import buildinghealth.domain.exception.NoModelLoadedException;
import buildinghealth.domain.exception.ResourceNotFoundException;
import buildinghealth.domain.exception.SchemaMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * La muestra no encaja con el esquema de características (métrica ausente, valor no finito,
     * modelo entrenado con otro esquema).
     * Log: WARN, es un error del productor, no del sistema.
     */
    @ExceptionHandler(SchemaMismatchException.class)
    public ResponseEntity<Object> handleSchemaMismatch(SchemaMismatchException ex) {
        log.warn("Schema mismatch: {}", ex.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "Feature Schema Mismatch", ex.getMessage());
    }

    @ExceptionHandler(InvalidSampleException.class)
    public ResponseEntity<Object> handleInvalidSample(InvalidSampleException ex) {
        log.warn("Invalid sample: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid Sample", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidation(MethodArgumentNotValidException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation failed: {}", detail);
        return body(HttpStatus.BAD_REQUEST, "Validation Failed", detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Object> handleUnreadable(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Object> handleInsufficientData(InsufficientDataException ex) {
        log.warn("Training rejected: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "Insufficient Training Data", ex.getMessage());
    }

    @ExceptionHandler(NoModelLoadedException.class)
    public ResponseEntity<Object> handleNoModel(NoModelLoadedException ex) {
        log.warn("Degraded mode: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "No Model Loaded", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    /**
     * Log: WARN (intento de acceso no autorizado).
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Object> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Security Alert: Access Denied to requested resource. Reason: {}", ex.getMessage());
        return body(HttpStatus.FORBIDDEN, "Forbidden", "You do not have permission to access this resource.");
    }

    /**
     * Todo lo demás. Log: ERROR con la traza completa.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
