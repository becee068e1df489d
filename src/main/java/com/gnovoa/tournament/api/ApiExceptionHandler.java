package com.gnovoa.tournament.api;

import com.gnovoa.tournament.api.dto.ErrorResponse;
import com.gnovoa.tournament.errors.TournamentEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TournamentEngineException.class)
    public ResponseEntity<ErrorResponse> handle(TournamentEngineException ex) {
        HttpStatus status = statusOf(ex.code());
        log.warn("{} ({}): {}", ex.code(), status.value(), ex.getMessage());
        return ResponseEntity.status(status).body(ErrorResponse.of(ex.code(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fe ->
                fieldErrors.putIfAbsent(fe.getField(), fe.getDefaultMessage())
        );

        String detail = fieldErrors.isEmpty()
                ? "Validation failed"
                : "Validation failed: " + String.join("; ", fieldErrors.values());

        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid_input", detail, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handle(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid_input", "Malformed request body"));
    }

    static HttpStatus statusOf(String code) {
        switch (code) {
            case "invalid_input": return HttpStatus.BAD_REQUEST;
            case "not_found": return HttpStatus.NOT_FOUND;
            case "not_ready":
            case "unresolved_draw":
            case "stale_structure":
                return HttpStatus.CONFLICT;
            default: return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
