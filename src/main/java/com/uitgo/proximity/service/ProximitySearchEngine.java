package com.uitgo.proximity.service;

import com.uitgo.proximity.model.IndexStats;
import com.uitgo.proximity.model.SearchResult;
import com.uitgo.proximity.model.SearchStrategy;
import com.uitgo.proximity.model.param.NearbySearchParam;
import com.uitgo.proximity.model.result.NearbyDriverResponse;

/**
 * Read side of the proximity index: ranked nearby searches over either strategy
 */
public interface ProximitySearchEngine {
    
    /**
     * Search for points within {@code radiusKm} of the center.
     * A non-positive {@code desiredCount} gives an empty result.
     *
     * @throws com.uitgo.proximity.exception.InvalidRadiusException     if the radius is not positive
     * @throws com.uitgo.proximity.exception.InvalidCoordinateException if the center is out of range
     * @throws com.uitgo.proximity.exception.IndexUnavailableException  for {@code HIERARCHICAL} before the index is built
     */
    SearchResult search(double longitude, double latitude, double radiusKm, int desiredCount,
                        SearchStrategy strategy, boolean preferPrimary);
    
    /**
     * Transport-facing search: fills in configured defaults and formats distances as strings
     *
     * @throws com.uitgo.proximity.exception.InvalidCountException if the count is missing or not positive
     */
    NearbyDriverResponse searchNearby(NearbySearchParam param);
    
    /**
     * Get statistics
     */
    IndexStats stats();
}
