package com.uitgo.proximity.exception;

/**
 * Base class for every error raised by the proximity index.
 * Each subclass carries a stable error code that the REST layer reports verbatim.
 */
public abstract class ProximityException extends RuntimeException {
    
    private final String errorCode;
    
    protected ProximityException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected ProximityException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
