package com.uitgo.proximity.controller;

import com.uitgo.proximity.exception.IndexUnavailableException;
import com.uitgo.proximity.exception.InvalidCoordinateException;
import com.uitgo.proximity.exception.InvalidCountException;
import com.uitgo.proximity.exception.InvalidRadiusException;
import com.uitgo.proximity.exception.ProximityException;
import com.uitgo.proximity.exception.StoreUnavailableException;
import com.uitgo.proximity.model.result.ApiResponse;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps proximity errors to HTTP status codes inside the standard {@link ApiResponse} envelope
 */
@RestControllerAdvice
@Slf4j
public class ProximityExceptionHandler {
    
    static final String BAD_REQUEST_CODE = "BAD_REQUEST";
    
    @ExceptionHandler({InvalidCoordinateException.class, InvalidRadiusException.class, InvalidCountException.class})
    public ResponseEntity<ApiResponse<Void>> handleInvalidInput(ProximityException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }
    
    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleIndexUnavailable(IndexUnavailableException e) {
        log.warn("Hierarchical search without cell index: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }
    
    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiResponse<Void>> handleStoreUnavailable(StoreUnavailableException e) {
        log.error("Point store unavailable", e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage());
    }
    
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST_CODE, e.getMessage());
    }
    
    @ExceptionHandler({MethodArgumentNotValidException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiResponse<Void>> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, BAD_REQUEST_CODE, e.getMessage());
    }
    
    private static ResponseEntity<ApiResponse<Void>> respond(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(ApiResponse.error(code, message));
    }
}
