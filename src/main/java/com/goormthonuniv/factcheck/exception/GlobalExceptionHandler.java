package com.goormthonuniv.factcheck.exception;

import com.goormthonuniv.factcheck.fact.MalformedExtractionException;
import com.goormthonuniv.factcheck.llm.LlmUnavailableException;
import com.goormthonuniv.factcheck.service.ArticleFetchException;
import com.goormthonuniv.factcheck.service.ReportNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "VALIDATION_ERROR",
                "message", e.getBindingResult().getAllErrors().stream()
                        .map(err -> err instanceof FieldError fe
                                ? fe.getField() + " " + fe.getDefaultMessage()
                                : String.valueOf(err.getDefaultMessage()))
                        .toList()
        ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "request body is not readable JSON");
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<?> handleNotFound(ReportNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(MalformedExtractionException.class)
    public ResponseEntity<?> handleMalformed(MalformedExtractionException e) {
        log.warn("extraction failed source={}: {}", e.getSourceId(), e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "MALFORMED_EXTRACTION", e.getMessage());
    }

    @ExceptionHandler(ArticleFetchException.class)
    public ResponseEntity<?> handleFetch(ArticleFetchException e) {
        log.warn("article fetch failed url={}: {}", e.getUrl(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "ARTICLE_FETCH_FAILED", e.getMessage());
    }

    @ExceptionHandler(LlmUnavailableException.class)
    public ResponseEntity<?> handleLlm(LlmUnavailableException e) {
        log.warn("llm unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "LLM_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleGeneric(Exception e) {
        log.error("unhandled error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", String.valueOf(e.getMessage()));
    }

    private static ResponseEntity<?> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "error", code,
                "message", message
        ));
    }
}
