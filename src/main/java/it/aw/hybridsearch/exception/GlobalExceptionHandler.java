package it.aw.hybridsearch.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.HashMap;
import java.util.Map;

/**
 * Traduce la gerarchia {@link HybridSearchException} nel formato di errore dell'API:
 * {@code {"error": {"code", "message", "details"}}}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(HybridSearchException.class)
    public ResponseEntity<Map<String, Object>> handleApiError(HybridSearchException exception) {
        if (exception.getStatus() >= 500) {
            log.error("Errore {}: {}", exception.getCode(), exception.getMessage(), exception);
        }
        return ResponseEntity.status(exception.getStatus())
                .body(body(exception.getCode(), exception.getMessage(), exception.getDetails()));
    }

    /** Richieste malformate rilevate da Spring MVC prima di arrivare ai controller. */
    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception exception) {
        log.debug("Richiesta non valida: {}", exception.getMessage());
        return ResponseEntity.badRequest()
                .body(body("VALIDATION_ERROR", "Richiesta non valida", Map.of("reason", String.valueOf(exception.getMessage()))));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException exception) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(body("FILE_TOO_LARGE", "File oltre la dimensione massima consentita", Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception exception) {
        log.error("Errore inatteso", exception);
        String reason = exception.getMessage() == null ? exception.getClass().getSimpleName() : exception.getMessage();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "Errore inatteso", Map.of("reason", reason)));
    }

    private static Map<String, Object> body(String code, String message, Map<String, Object> details) {
        Map<String, Object> error = new HashMap<>();
        error.put("code", code);
        error.put("message", message);
        error.put("details", details == null ? Map.of() : details);
        return Map.of("error", error);
    }
}
