package com.uitgo.proximity.repository.impl;

import com.uitgo.proximity.config.ProximityProperties;
import com.uitgo.proximity.exception.InvalidCoordinateException;
import com.uitgo.proximity.exception.StoreUnavailableException;
import com.uitgo.proximity.geo.GeoDistance;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.SearchHit;
import com.uitgo.proximity.repository.PointStore;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands.GeoLocation;
import org.springframework.data.redis.connection.RedisGeoCommands.GeoSearchCommandArgs;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.domain.geo.GeoReference;
import org.springframework.stereotype.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * PointStore adapter over a Redis GEO sorted set.
 * GEOSEARCH is the flat scan: Redis sorts the whole radius match server-side before the COUNT cut.
 */
@Repository
@ConditionalOnProperty(prefix = "proximity.store", name = "type", havingValue = "redis")
public class RedisPointStore implements PointStore {
    
    private static final Logger logger = LoggerFactory.getLogger(RedisPointStore.class);
    
    /** Redis GEO cannot encode latitudes beyond the Web Mercator limit */
    public static final double MAX_GEO_LATITUDE = 85.05112878;
    
    /** Earth radius Redis uses for GEO distances */
    static final double REDIS_EARTH_RADIUS_KM = 6372.797560856;
    
    // Slack on top of the radius conversion for rounding in Redis' own haversine
    private static final double RADIUS_SLACK = 1e-9;
    
    private final StringRedisTemplate redisTemplate;
    private final String key;
    
    public RedisPointStore(StringRedisTemplate proximityRedisTemplate, ProximityProperties properties) {
        this.redisTemplate = proximityRedisTemplate;
        this.key = properties.getStore().getKey();
    }
    
    @Override
    public void upsert(DriverPoint point) {
        requireStorable(point);
        execute("GEOADD " + point.getId(), () -> redisTemplate.opsForGeo()
                .add(key, new Point(point.getLongitude(), point.getLatitude()), point.getId()));
    }
    
    @Override
    public void upsertAll(Collection<DriverPoint> batch) {
        if (batch.isEmpty()) {
            return;
        }
        Map<String, Point> members = new LinkedHashMap<>(batch.size() * 2);
        for (DriverPoint point : batch) {
            requireStorable(point);
            members.put(point.getId(), new Point(point.getLongitude(), point.getLatitude()));
        }
        execute("GEOADD batch of " + members.size(), () -> redisTemplate.opsForGeo().add(key, members));
    }
    
    @Override
    public boolean remove(String id) {
        Long removed = execute("ZREM " + id, () -> redisTemplate.opsForGeo().remove(key, id));
        return removed != null && removed > 0;
    }
    
    @Override
    public Optional<DriverPoint> get(String id) {
        List<Point> positions = execute("GEOPOS " + id, () -> redisTemplate.opsForGeo().position(key, id));
        if (positions == null || positions.isEmpty() || positions.get(0) == null) {
            return Optional.empty();
        }
        Point position = positions.get(0);
        return Optional.of(DriverPoint.of(id, position.getX(), position.getY()));
    }
    
    @Override
    public Map<String, DriverPoint> getAll(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }
        String[] members = ids.toArray(new String[0]);
        List<Point> positions = execute("GEOPOS batch of " + members.length,
                () -> redisTemplate.opsForGeo().position(key, members));
        
        Map<String, DriverPoint> result = new HashMap<>(members.length * 2);
        if (positions == null) {
            return result;
        }
        for (int i = 0; i < members.length && i < positions.size(); i++) {
            Point position = positions.get(i);
            if (position != null) {
                result.put(members[i], DriverPoint.of(members[i], position.getX(), position.getY()));
            }
        }
        return result;
    }
    
    @Override
    public List<SearchHit> scanRadius(double longitude, double latitude, double radiusKm, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        
        GeoSearchCommandArgs args = GeoSearchCommandArgs.newGeoSearchArgs()
                .includeCoordinates()
                .includeDistance()
                .sortAscending()
                .limit(limit);
        
        Distance searchRadius = new Distance(redisRadiusKm(radiusKm), Metrics.KILOMETERS);
        long startTime = System.currentTimeMillis();
        GeoResults<GeoLocation<String>> results = execute("GEOSEARCH", () -> redisTemplate.opsForGeo()
                .search(key, GeoReference.fromCoordinate(longitude, latitude), searchRadius, args));
        long duration = System.currentTimeMillis() - startTime;
        
        if (results == null) {
            return Collections.emptyList();
        }
        
        List<SearchHit> hits = new ArrayList<>(results.getContent().size());
        for (GeoResult<GeoLocation<String>> result : results.getContent()) {
            GeoLocation<String> location = result.getContent();
            Point position = location.getPoint();
            // Same haversine as the in-memory store so both backends report identical distances
            double distance = position != null
                    ? GeoDistance.haversineKm(longitude, latitude, position.getX(), position.getY())
                    : result.getDistance().getValue() * GeoDistance.EARTH_RADIUS_KM / REDIS_EARTH_RADIUS_KM;
            if (distance <= radiusKm) {
                hits.add(new SearchHit(location.getName(), distance));
            }
        }
        hits.sort(SearchHit.BY_DISTANCE);
        
        logger.debug("Redis GEOSEARCH completed: {} drivers in {}ms", hits.size(), duration);
        return Collections.unmodifiableList(hits);
    }
    
    /**
     * Radius to send to GEOSEARCH so its larger sphere still matches every point within
     * {@code radiusKm} on the 6371 km sphere. The surplus is filtered out afterwards.
     */
    static double redisRadiusKm(double radiusKm) {
        return radiusKm * REDIS_EARTH_RADIUS_KM / GeoDistance.EARTH_RADIUS_KM * (1.0 + RADIUS_SLACK);
    }
    
    @Override
    public Set<String> ids() {
        Set<String> members = execute("ZRANGE", () -> redisTemplate.opsForZSet().range(key, 0, -1));
        return members != null ? new HashSet<>(members) : new HashSet<>();
    }
    
    @Override
    public List<DriverPoint> snapshot() {
        return new ArrayList<>(getAll(ids()).values());
    }
    
    @Override
    public long size() {
        Long count = execute("ZCARD", () -> redisTemplate.opsForZSet().zCard(key));
        return count != null ? count : 0L;
    }
    
    @Override
    public void clear() {
        execute("DEL", () -> redisTemplate.delete(key));
        logger.info("Deleted Redis geo key '{}'", key);
    }
    
    @Override
    public String type() {
        return "redis";
    }
    
    private void requireStorable(DriverPoint point) {
        GeoDistance.requireValid(point.getLongitude(), point.getLatitude());
        if (Math.abs(point.getLatitude()) > MAX_GEO_LATITUDE) {
            throw new InvalidCoordinateException(point.getLongitude(), point.getLatitude());
        }
    }
    
    private <T> T execute(String operation, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Redis " + operation + " on key '" + key + "' failed: " + e.getMessage(), e);
        }
    }
}
