package com.uitgo.proximity.model;

import com.uitgo.proximity.geo.GeoDistance;
import lombok.Builder;
import lombok.Value;

/**
 * A tracked point keyed by an opaque entity id.
 * Immutable: a location change replaces the whole value.
 */
@Value
@Builder(toBuilder = true)
public class DriverPoint {
    
    String id;
    double longitude;
    double latitude;
    
    /**
     * Epoch millis of the report that produced this position, 0 when unknown
     */
    long updatedAt;
    
    public static DriverPoint of(String id, double longitude, double latitude) {
        return new DriverPoint(id, longitude, latitude, 0L);
    }
    
    /**
     * Distance from this point to the given center in kilometers
     */
    public double distanceKmTo(double centerLongitude, double centerLatitude) {
        return GeoDistance.haversineKm(centerLongitude, centerLatitude, longitude, latitude);
    }
}
