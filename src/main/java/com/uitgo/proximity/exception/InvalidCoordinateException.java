package com.uitgo.proximity.exception;

/**
 * Longitude or latitude outside the WGS84 range, or not a number
 */
public class InvalidCoordinateException extends ProximityException {
    
    public static final String CODE = "INVALID_COORDINATE";
    
    private final double longitude;
    private final double latitude;
    
    public InvalidCoordinateException(double longitude, double latitude) {
        super(CODE, String.format("Invalid coordinate (lon=%s, lat=%s): longitude must be in [-180,180] and latitude in [-90,90]",
                longitude, latitude));
        this.longitude = longitude;
        this.latitude = latitude;
    }
    
    private InvalidCoordinateException(String message) {
        super(CODE, message);
        this.longitude = Double.NaN;
        this.latitude = Double.NaN;
    }
    
    /**
     * The request carried no center at all
     */
    public static InvalidCoordinateException missingCenter() {
        return new InvalidCoordinateException("Search center is required: provide longitude and latitude");
    }
    
    public double getLongitude() {
        return longitude;
    }
    
    public double getLatitude() {
        return latitude;
    }
}
