package com.example.formlayout.api;

import com.example.formlayout.model.LayoutWarning;
import com.example.formlayout.parser.LayoutValidationException;
import com.example.formlayout.store.FormLayoutNotFoundException;
import com.example.formlayout.store.StaleRevisionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(FormLayoutNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(FormLayoutNotFoundException e) {
        return Map.of(
                "error", "NOT_FOUND",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler(StaleRevisionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(StaleRevisionException e) {
        log.warn("Rejected stale write: {}", e.getMessage());
        return Map.of(
                "error", "CONFLICT",
                "message", e.getMessage(),
                "currentRevision", e.getCurrentRevision()
        );
    }

    @ExceptionHandler(LayoutValidationException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleInvalidLayout(LayoutValidationException e) {
        List<String> warnings = e.getViolations().stream().map(LayoutWarning::toString).toList();
        return Map.of(
                "error", "INVALID_LAYOUT",
                "message", e.getMessage(),
                "warnings", warnings
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }
}
