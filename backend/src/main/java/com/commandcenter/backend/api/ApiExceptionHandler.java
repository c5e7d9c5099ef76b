package com.commandcenter.backend.api;

import com.commandcenter.backend.service.external.MemoryStoreException;
import com.commandcenter.backend.service.external.ScriptExecutionException;
import com.commandcenter.backend.service.feed.InvalidFeedTypeException;
import com.commandcenter.backend.service.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidFeedTypeException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidFeedType(InvalidFeedTypeException e) {
        return Map.of("error", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadable(Exception e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", "malformed request"
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalid(MethodArgumentNotValidException e) {
        String field = e.getBindingResult().getFieldError() == null
                ? "body"
                : e.getBindingResult().getFieldError().getField();
        return Map.of(
                "error", "BAD_REQUEST",
                "message", "invalid_" + field
        );
    }

    @ExceptionHandler(StorageException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleStorage(StorageException e) {
        log.error("Persistence failure: {}", e.getMessage(), e);
        return Map.of(
                "error", "STORAGE_FAILURE",
                "message", String.valueOf(e.getMessage())
        );
    }

    // The memory views report an unreachable store in the body, not the status line.
    @ExceptionHandler(MemoryStoreException.class)
    @ResponseStatus(HttpStatus.OK)
    public Map<String, Object> handleMemoryStore(MemoryStoreException e) {
        return Map.of("error", String.valueOf(e.getMessage()));
    }

    @ExceptionHandler(ScriptExecutionException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleScript(ScriptExecutionException e) {
        return Map.of("error", String.valueOf(e.getMessage()));
    }
}
