package com.uitgo.proximity.exception;

/**
 * Backing point store could not be reached or timed out.
 * Never retried inside the index; the cause is kept for the caller.
 */
public class StoreUnavailableException extends ProximityException {
    
    public static final String CODE = "STORE_UNAVAILABLE";
    
    public StoreUnavailableException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
