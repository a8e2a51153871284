package com.aigreentick.services.dealership.common.exception;

import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.aigreentick.services.dealership.common.dto.ResponseMessage;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps exceptions to the response envelope so stack traces never reach API callers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ResponseMessage<Void>> handleNotFound(ResourceNotFoundException e, HttpServletRequest request) {
        log.debug("[NotFound] Path: {} Message: {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ResponseMessage.error(e.getMessage()));
    }

    @ExceptionHandler(IllegalStateTransitionException.class)
    public ResponseEntity<ResponseMessage<Void>> handleTransition(IllegalStateTransitionException e, HttpServletRequest request) {
        log.warn("[StateConflict] Path: {} Message: {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ResponseMessage.error(e.getMessage()));
    }

    @ExceptionHandler(InvalidJobPayloadException.class)
    public ResponseEntity<ResponseMessage<Void>> handleInvalidRequest(InvalidJobPayloadException e, HttpServletRequest request) {
        log.debug("[BadRequest] Path: {} Message: {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity.badRequest().body(ResponseMessage.error(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ResponseMessage<Void>> handleValidation(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(ResponseMessage.error("Validation failed: " + details));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ResponseMessage<Void>> handleException(Exception e, HttpServletRequest request) {
        log.error("[GlobalException] Path: {}, Error: {}", request.getRequestURI(), e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ResponseMessage.error("An unexpected error occurred. Please contact administrator."));
    }
}
