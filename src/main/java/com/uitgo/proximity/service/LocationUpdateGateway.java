package com.uitgo.proximity.service;

import com.uitgo.proximity.model.Cell;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.DriverStatus;

import java.util.Collection;
import java.util.Optional;

/**
 * Write side of the proximity index.
 * Every change goes through here so the point store and the cell index never disagree.
 */
public interface LocationUpdateGateway {
    
    /**
     * Record the latest position of an entity, creating it on first report
     *
     * @return the cell the point now belongs to, empty while the cell index is not built
     * @throws com.uitgo.proximity.exception.InvalidCoordinateException if the coordinates are out of range
     */
    Optional<Cell> reportLocation(String id, double longitude, double latitude);
    
    /**
     * Apply a batch of reports; later entries win for repeated ids
     *
     * @return number of distinct ids written
     */
    int bulkReport(Collection<DriverPoint> points);
    
    /**
     * Remove an entity from the store and the cell index
     *
     * @return true if the entity had a position
     */
    boolean deregister(String id);
    
    /**
     * Busy and offline entities leave the index, online ones reappear on their next report
     *
     * @return true if a point was removed
     */
    boolean updateStatus(String id, DriverStatus status);
    
    Optional<DriverPoint> locate(String id);
    
    /**
     * Build the cell index from the current store content
     *
     * @return number of points indexed
     */
    int buildIndex();
    
    /**
     * Unbuild the cell index, hierarchical searches fail until the next build
     */
    void dropIndex();
    
    /**
     * Remove every point from the store and the cell index
     */
    void flush();
}
