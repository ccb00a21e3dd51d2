package com.animerec.api;

import com.animerec.error.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({UnknownUserException.class, UnknownItemException.class})
    public ResponseEntity<ErrorResponse> notFound(RecommendationException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.code(), ex.getMessage(), List.of());
    }

    @ExceptionHandler({EmptySeedException.class, EmptyCatalogException.class})
    public ResponseEntity<ErrorResponse> cannotPersonalize(RecommendationException ex) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.code(), ex.getMessage(), List.of());
    }

    @ExceptionHandler(InconsistentDataException.class)
    public ResponseEntity<ErrorResponse> inconsistentData(InconsistentDataException ex) {
        log.error("Dataset rejected: {}", ex.getMessage());
        List<String> details = ex.issues().stream().limit(20).map(i -> i.code() + " " + i.ref() + ": " + i.message()).toList();
        return respond(HttpStatus.CONFLICT, ex.code(), ex.getMessage(), details);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), List.of());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, List<String> details) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, details));
    }

    public record ErrorResponse(String code, String message, List<String> details) {}
}
