package org.docshare.sharing.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthenticatedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnauthenticated(UnauthenticatedException ex) {
        log.warn("Unauthenticated: {}", ex.getMessage());
        return response(HttpStatus.UNAUTHORIZED, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(AccessForbiddenException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAccessForbidden(AccessForbiddenException ex) {
        log.warn("Access forbidden: {}", ex.getMessage());
        return response(HttpStatus.FORBIDDEN, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(PermissionValidationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handlePermissionValidation(PermissionValidationException ex) {
        log.warn("Invalid permission update: {}", ex.getMessage());
        return response(HttpStatus.BAD_REQUEST, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDocumentNotFound(DocumentNotFoundException ex) {
        log.warn("Document not found: {}", ex.getMessage());
        return response(HttpStatus.NOT_FOUND, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(MutationInProgressException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMutationInProgress(MutationInProgressException ex) {
        log.warn("Mutation in progress: {}", ex.getMessage());
        return response(HttpStatus.CONFLICT, ex.getError(), ex.getMessage());
    }

    @ExceptionHandler(TransientIOException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleTransientIO(TransientIOException ex) {
        log.error("Transient IO failure: {}", ex.getMessage(), ex.getCause());
        return response(HttpStatus.SERVICE_UNAVAILABLE, ex.getError(), "Permission service temporarily unavailable, please retry");
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationExceptions(WebExchangeBindException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return response(HttpStatus.BAD_REQUEST, DocShareException.VALIDATION, "Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleServerWebInput(ServerWebInputException ex) {
        log.warn("Unreadable request : {}", ex.getMessage());
        return response(HttpStatus.BAD_REQUEST, DocShareException.VALIDATION, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Illegal argument : {}", ex.getMessage());
        return response(HttpStatus.BAD_REQUEST, DocShareException.VALIDATION, ex.getMessage());
    }

    @ExceptionHandler(Throwable.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Throwable ex) {
        log.error("An unexpected error occurred", ex);
        return response(HttpStatus.INTERNAL_SERVER_ERROR, "Internal", "An unexpected error occurred. Please try again later.");
    }

    private static Mono<ResponseEntity<ErrorResponse>> response(HttpStatus status, String error, String message) {
        return Mono.just(ResponseEntity.status(status).body(new ErrorResponse(status.value(), error, message)));
    }

    public record ErrorResponse(int status, String error, String message) {
    }
}
