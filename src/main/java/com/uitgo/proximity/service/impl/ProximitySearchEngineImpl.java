package com.uitgo.proximity.service.impl;

import com.uitgo.proximity.aspect.Timed;
import com.uitgo.proximity.classifier.OverlayClassifier;
import com.uitgo.proximity.config.ProximityProperties;
import com.uitgo.proximity.exception.IndexUnavailableException;
import com.uitgo.proximity.exception.InvalidCoordinateException;
import com.uitgo.proximity.exception.InvalidCountException;
import com.uitgo.proximity.exception.InvalidRadiusException;
import com.uitgo.proximity.geo.GeoDistance;
import com.uitgo.proximity.index.CellIndex;
import com.uitgo.proximity.model.EntityClass;
import com.uitgo.proximity.model.IndexStats;
import com.uitgo.proximity.model.SearchHit;
import com.uitgo.proximity.model.SearchResult;
import com.uitgo.proximity.model.SearchStrategy;
import com.uitgo.proximity.model.param.NearbySearchParam;
import com.uitgo.proximity.model.result.NearbyDriver;
import com.uitgo.proximity.model.result.NearbyDriverResponse;
import com.uitgo.proximity.repository.PointStore;
import com.uitgo.proximity.service.ProximitySearchEngine;

import org.springframework.stereotype.Service;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Implementation of ProximitySearchEngine.
 * Read-only: neither the store nor the cell index is ever mutated from here.
 */
@Service
public class ProximitySearchEngineImpl implements ProximitySearchEngine {
    
    private static final Logger logger = LoggerFactory.getLogger(ProximitySearchEngineImpl.class);
    
    // Decimal places of the wire distance, as Redis WITHDIST reports it
    private static final int DISTANCE_SCALE = 4;
    
    private final PointStore pointStore;
    private final CellIndex cellIndex;
    private final OverlayClassifier overlayClassifier;
    private final ProximityProperties properties;
    
    public ProximitySearchEngineImpl(PointStore pointStore, CellIndex cellIndex,
                                     OverlayClassifier overlayClassifier, ProximityProperties properties) {
        this.pointStore = pointStore;
        this.cellIndex = cellIndex;
        this.overlayClassifier = overlayClassifier;
        this.properties = properties;
    }
    
    @Override
    @Timed("search")
    public SearchResult search(double longitude, double latitude, double radiusKm, int desiredCount,
                               SearchStrategy strategy, boolean preferPrimary) {
        if (!GeoDistance.isValid(longitude, latitude)) {
            throw new InvalidCoordinateException(longitude, latitude);
        }
        if (!(radiusKm > 0) || Double.isInfinite(radiusKm)) {
            throw new InvalidRadiusException(radiusKm);
        }
        SearchStrategy effective = strategy != null ? strategy : properties.getSearch().getStrategy();
        if (effective == SearchStrategy.HIERARCHICAL && !cellIndex.isBuilt()) {
            throw new IndexUnavailableException(cellIndex.getResolution());
        }
        if (desiredCount <= 0) {
            return SearchResult.empty(effective);
        }
        
        // Oversized fetch so enough primary candidates survive the overlay cut
        int limit = Math.max(properties.getSearch().getCandidateCeiling(), desiredCount);
        
        logger.debug("Starting {} search at ({},{}) with radius {}km, count {}, limit {}", 
                    effective, longitude, latitude, radiusKm, desiredCount, limit);
        
        List<SearchHit> candidates = effective == SearchStrategy.HIERARCHICAL
                ? cellIndex.query(longitude, latitude, radiusKm, limit)
                : pointStore.scanRadius(longitude, latitude, radiusKm, limit);
        
        List<SearchHit> ranked = overlayClassifier.partitionAndFill(candidates, desiredCount, preferPrimary);
        
        logger.debug("Completed {} search: {} candidates, {} returned", effective, candidates.size(), ranked.size());
        
        return SearchResult.builder()
                .strategy(effective)
                .hits(ranked)
                .candidateCount(candidates.size())
                .build();
    }
    
    @Override
    @Timed("searchNearby")
    public NearbyDriverResponse searchNearby(NearbySearchParam param) {
        if (!param.hasValidCenter()) {
            throw InvalidCoordinateException.missingCenter();
        }
        if (param.getRadiusKm() == null) {
            throw new InvalidRadiusException(Double.NaN);
        }
        if (param.getCount() == null || param.getCount() <= 0) {
            throw new InvalidCountException(param.getCount() != null ? param.getCount() : 0);
        }
        
        boolean preferPrimary = param.getPreferPrimary() != null
                ? param.getPreferPrimary()
                : properties.getSearch().isPreferPrimary();
        
        SearchResult result = search(param.getLongitude(), param.getLatitude(), param.getRadiusKm(),
                param.getCount(), param.getStrategy(), preferPrimary);
        
        List<NearbyDriver> list = result.getHits().stream()
                .map(hit -> NearbyDriver.builder()
                        .driverId(hit.getId())
                        .distance(formatDistance(hit.getDistanceKm()))
                        .build())
                .collect(Collectors.toList());
        
        return NearbyDriverResponse.builder()
                .list(list)
                .strategy(result.getStrategy())
                .candidates(result.getCandidateCount())
                .build();
    }
    
    /**
     * Kilometers as a plain decimal string, e.g. {@code "0.3412"} or {@code "0"}
     */
    static String formatDistance(double distanceKm) {
        return BigDecimal.valueOf(distanceKm)
                .setScale(DISTANCE_SCALE, RoundingMode.HALF_UP)
                .stripTrailingZeros()
                .toPlainString();
    }
    
    @Override
    public IndexStats stats() {
        long primary = 0;
        long secondary = 0;
        for (String id : pointStore.ids()) {
            if (overlayClassifier.classify(id) == EntityClass.PRIMARY) {
                primary++;
            } else {
                secondary++;
            }
        }
        
        return IndexStats.builder()
                .storeType(pointStore.type())
                .totalPoints(primary + secondary)
                .primaryPoints(primary)
                .secondaryPoints(secondary)
                .indexBuilt(cellIndex.isBuilt())
                .resolution(cellIndex.getResolution())
                .cellCount(cellIndex.cellCount())
                .defaultStrategy(properties.getSearch().getStrategy())
                .build();
    }
}
