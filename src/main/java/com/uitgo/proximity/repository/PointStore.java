package com.uitgo.proximity.repository;

import com.uitgo.proximity.geo.GeoDistance;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.SearchHit;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed store of point locations with a brute-force radius scan.
 * Implementations throw {@code StoreUnavailableException} when their backing store cannot be reached.
 */
public interface PointStore {
    
    /**
     * Insert or replace the point stored under {@code point.getId()}
     *
     * @throws com.uitgo.proximity.exception.InvalidCoordinateException if the coordinates are out of range
     */
    void upsert(DriverPoint point);
    
    /**
     * Insert or replace a batch of points; the whole batch is checked before anything is written
     */
    default void upsertAll(Collection<DriverPoint> batch) {
        for (DriverPoint point : batch) {
            GeoDistance.requireValid(point.getLongitude(), point.getLatitude());
        }
        for (DriverPoint point : batch) {
            upsert(point);
        }
    }
    
    /**
     * Remove a point; absent ids are ignored
     *
     * @return true if a point was removed
     */
    boolean remove(String id);
    
    /**
     * Get the current position of an id
     */
    Optional<DriverPoint> get(String id);
    
    /**
     * Positions of the given ids; ids without a point are left out of the map
     */
    Map<String, DriverPoint> getAll(Collection<String> ids);
    
    /**
     * Every point within {@code radiusKm} of the center, nearest first, at most {@code limit} entries.
     * Cost grows with the total number of stored points.
     */
    List<SearchHit> scanRadius(double longitude, double latitude, double radiusKm, int limit);
    
    /**
     * All stored ids
     */
    Set<String> ids();
    
    /**
     * All stored points, used to build the cell index
     */
    List<DriverPoint> snapshot();
    
    long size();
    
    void clear();
    
    /**
     * Short backend name for stats output
     */
    String type();
}
