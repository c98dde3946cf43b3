package com.uitgo.proximity.exception;

/**
 * Search radius that is zero, negative or not a number
 */
public class InvalidRadiusException extends ProximityException {
    
    public static final String CODE = "INVALID_RADIUS";
    
    public InvalidRadiusException(double radiusKm) {
        super(CODE, "Search radius must be a positive number of kilometers, got: " + radiusKm);
    }
}
