package com.uitgo.proximity.geo;

import com.uitgo.proximity.exception.InvalidCoordinateException;
import org.locationtech.jts.geom.Envelope;

/**
 * Great-circle helpers shared by every point store and the cell index.
 * All distances use the haversine formula against the mean Earth radius of 6371 km.
 */
public final class GeoDistance {
    
    public static final double EARTH_RADIUS_KM = 6371.0;
    
    /** Length of one degree of latitude (and of longitude at the equator) */
    public static final double KM_PER_DEGREE = Math.PI * EARTH_RADIUS_KM / 180.0;
    
    // Widens pre-filter envelopes so float error never rejects a point on the boundary
    private static final double ENVELOPE_PADDING = 1.0001;
    
    private GeoDistance() {
    }
    
    /**
     * Haversine distance in kilometers between two (longitude, latitude) pairs
     */
    public static double haversineKm(double lon1, double lat1, double lon2, double lat2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dPhi = Math.toRadians(lat2 - lat1);
        double dLambda = Math.toRadians(lon2 - lon1);
        
        double a = Math.sin(dPhi / 2) * Math.sin(dPhi / 2)
                + Math.cos(phi1) * Math.cos(phi2) * Math.sin(dLambda / 2) * Math.sin(dLambda / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }
    
    public static boolean isValidLongitude(double longitude) {
        return !Double.isNaN(longitude) && longitude >= -180.0 && longitude <= 180.0;
    }
    
    public static boolean isValidLatitude(double latitude) {
        return !Double.isNaN(latitude) && latitude >= -90.0 && latitude <= 90.0;
    }
    
    public static boolean isValid(double longitude, double latitude) {
        return isValidLongitude(longitude) && isValidLatitude(latitude);
    }
    
    /**
     * @throws InvalidCoordinateException if either component is out of range or NaN
     */
    public static void requireValid(double longitude, double latitude) {
        if (!isValid(longitude, latitude)) {
            throw new InvalidCoordinateException(longitude, latitude);
        }
    }
    
    /**
     * Longitude/latitude box that contains every point within {@code radiusKm} of the center.
     * Returns {@code null} when the circle reaches a pole or wraps the antimeridian,
     * in which case callers must not pre-filter at all.
     */
    public static Envelope searchEnvelope(double longitude, double latitude, double radiusKm) {
        double angular = radiusKm / EARTH_RADIUS_KM;
        if (angular >= Math.PI / 2) {
            return null;
        }
        
        double latDelta = Math.toDegrees(angular) * ENVELOPE_PADDING;
        double minLat = latitude - latDelta;
        double maxLat = latitude + latDelta;
        if (minLat <= -90.0 || maxLat >= 90.0) {
            return null;
        }
        
        double cosLat = Math.cos(Math.toRadians(latitude));
        double sinAngular = Math.sin(angular);
        if (sinAngular >= cosLat) {
            return null;
        }
        double lonDelta = Math.toDegrees(Math.asin(sinAngular / cosLat)) * ENVELOPE_PADDING;
        double minLon = longitude - lonDelta;
        double maxLon = longitude + lonDelta;
        if (minLon < -180.0 || maxLon > 180.0) {
            return null;
        }
        
        return new Envelope(minLon, maxLon, minLat, maxLat);
    }
}
