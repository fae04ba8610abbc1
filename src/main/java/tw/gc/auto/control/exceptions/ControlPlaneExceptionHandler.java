package tw.gc.auto.control.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class ControlPlaneExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(EntityNotFoundException ex) {
        log.warn("Entity not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({InsufficientCapitalException.class, CapitalLimitExceededException.class})
    public ResponseEntity<ErrorResponse> handleCapitalRejection(ControlPlaneException ex) {
        log.warn("Capital request rejected: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<ErrorResponse> handleValidationFailed(ValidationFailedException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({CircuitBreakerTrippedException.class, DeploymentFailureException.class,
            NudgeEngineDegradedException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(ControlPlaneException ex) {
        log.warn("Service unavailable: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ControlPlaneException.class)
    public ResponseEntity<ErrorResponse> handleControlPlaneException(ControlPlaneException ex) {
        log.warn("Application exception: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex) {
        log.warn("Invalid state: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "ERR-STATE-001", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "ERR-VAL-001", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "ERR-SYS-001", "An unexpected error occurred: " + ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, message));
    }

    public record ErrorResponse(String errorCode, String message) {
    }
}
