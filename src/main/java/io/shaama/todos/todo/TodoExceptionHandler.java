package io.shaama.todos.todo;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class TodoExceptionHandler {

    static final String BAD_REQUEST = "BAD_REQUEST";

    @ExceptionHandler(TodoStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreException(TodoStoreException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Store operation failed: {}", e.getMessage(), e);
        } else {
            log.debug("Store lookup failed: {}", e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new ErrorResponse(e.getKind().name(), e.getMessage()));
    }

    // Failures surfacing at transaction commit, outside TodoService's own handling.
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleUnwrappedStoreFailure(RuntimeException e) {
        return handleStoreException(TodoStoreException.storeFailure("commit", e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return badRequest("Malformed request body");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(TodoExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        return badRequest(message.isEmpty() ? "Invalid request body" : message);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return badRequest("Invalid value for '" + e.getName() + "': " + e.getValue());
    }

    static HttpStatus statusOf(TodoStoreException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case STORE_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        log.debug("Rejected request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(BAD_REQUEST, message));
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }

    public record ErrorResponse(String code, String message) {
    }
}
