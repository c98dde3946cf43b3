package com.uitgo.proximity.exception;

/**
 * Requested result count that is zero or negative at the transport boundary
 */
public class InvalidCountException extends ProximityException {
    
    public static final String CODE = "INVALID_COUNT";
    
    public InvalidCountException(int count) {
        super(CODE, "Result count must be positive, got: " + count);
    }
}
