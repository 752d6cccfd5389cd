package org.mides.delivery.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownLocationException.class)
    public ResponseEntity<ErrorResponse> handleUnknownLocationException(UnknownLocationException ex) {
        logger.debug("Rejected request referencing {}", ex.getLocation());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler({InvalidRouteRequestException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(RuntimeException ex) {
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException ex) {
        var message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> String.format("%s %s", fieldError.getField(), fieldError.getDefaultMessage()))
            .collect(Collectors.joining(", "));
        return badRequest(message);
    }

    @ExceptionHandler(InvalidReferenceDataException.class)
    public ResponseEntity<ErrorResponse> handleInvalidReferenceDataException(InvalidReferenceDataException ex) {
        logger.error("Reference data is unusable", ex);
        var status = HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(ErrorResponse.of(status, ex.getMessage()));
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        var status = HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ErrorResponse.of(status, message));
    }
}
