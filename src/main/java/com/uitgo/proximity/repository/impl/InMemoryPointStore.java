package com.uitgo.proximity.repository.impl;

import com.uitgo.proximity.exception.StoreUnavailableException;
import com.uitgo.proximity.geo.GeoDistance;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.SearchHit;
import com.uitgo.proximity.repository.PointStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process PointStore backed by a concurrent map.
 * The radius scan visits every entry; a JTS envelope only short-cuts the haversine math.
 */
@Repository
@ConditionalOnProperty(prefix = "proximity.store", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPointStore implements PointStore {
    
    private static final Logger logger = LoggerFactory.getLogger(InMemoryPointStore.class);
    
    // Entries between two interruption checks during a scan
    private static final int INTERRUPT_CHECK_INTERVAL = 4096;
    
    // Single source of truth for point storage
    private final Map<String, DriverPoint> points = new ConcurrentHashMap<>();
    
    @Override
    public void upsert(DriverPoint point) {
        GeoDistance.requireValid(point.getLongitude(), point.getLatitude());
        points.put(point.getId(), point);
    }
    
    @Override
    public boolean remove(String id) {
        return points.remove(id) != null;
    }
    
    @Override
    public Optional<DriverPoint> get(String id) {
        return Optional.ofNullable(points.get(id));
    }
    
    @Override
    public Map<String, DriverPoint> getAll(Collection<String> ids) {
        Map<String, DriverPoint> result = new HashMap<>(ids.size() * 2);
        for (String id : ids) {
            DriverPoint point = points.get(id);
            if (point != null) {
                result.put(id, point);
            }
        }
        return result;
    }
    
    @Override
    public List<SearchHit> scanRadius(double longitude, double latitude, double radiusKm, int limit) {
        if (limit <= 0 || points.isEmpty()) {
            return Collections.emptyList();
        }
        
        Envelope envelope = GeoDistance.searchEnvelope(longitude, latitude, radiusKm);
        List<SearchHit> results = new ArrayList<>();
        int visited = 0;
        
        for (DriverPoint point : points.values()) {
            if (++visited % INTERRUPT_CHECK_INTERVAL == 0 && Thread.currentThread().isInterrupted()) {
                throw new StoreUnavailableException("Flat scan interrupted after " + visited + " points",
                        new InterruptedException());
            }
            if (envelope != null && !envelope.contains(point.getLongitude(), point.getLatitude())) {
                continue;
            }
            double distance = point.distanceKmTo(longitude, latitude);
            if (distance <= radiusKm) {
                results.add(new SearchHit(point.getId(), distance));
            }
        }
        
        // Sort by distance
        results.sort(SearchHit.BY_DISTANCE);
        
        logger.debug("Flat scan at ({},{}) r={}km visited {} points, {} in radius", 
                    longitude, latitude, radiusKm, visited, results.size());
        
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }
    
    @Override
    public Set<String> ids() {
        return new HashSet<>(points.keySet());
    }
    
    @Override
    public List<DriverPoint> snapshot() {
        return new ArrayList<>(points.values());
    }
    
    @Override
    public long size() {
        return points.size();
    }
    
    @Override
    public void clear() {
        points.clear();
        logger.info("Cleared in-memory point store");
    }
    
    @Override
    public String type() {
        return "memory";
    }
}
