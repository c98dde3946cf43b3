package com.uitgo.proximity.service.impl;

import com.uitgo.proximity.classifier.OverlayClassifier;
import com.uitgo.proximity.config.ProximityProperties;
import com.uitgo.proximity.exception.IndexUnavailableException;
import com.uitgo.proximity.exception.InvalidCoordinateException;
import com.uitgo.proximity.exception.InvalidCountException;
import com.uitgo.proximity.exception.InvalidRadiusException;
import com.uitgo.proximity.index.impl.H3CellIndex;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.IndexStats;
import com.uitgo.proximity.model.SearchHit;
import com.uitgo.proximity.model.SearchResult;
import com.uitgo.proximity.model.SearchStrategy;
import com.uitgo.proximity.model.param.NearbySearchParam;
import com.uitgo.proximity.model.result.NearbyDriver;
import com.uitgo.proximity.model.result.NearbyDriverResponse;
import com.uitgo.proximity.repository.impl.InMemoryPointStore;
import com.uber.h3core.H3Core;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProximitySearchEngineImplTest {
    
    private static final double CENTER_LON = 106.700;
    private static final double CENTER_LAT = 10.770;
    
    private static H3Core h3;
    
    private final GeometryFactory geometryFactory = new GeometryFactory();
    
    private ProximityProperties properties;
    private InMemoryPointStore store;
    private H3CellIndex cellIndex;
    private LocationUpdateGatewayImpl gateway;
    private ProximitySearchEngineImpl engine;
    
    @BeforeAll
    static void loadH3() throws Exception {
        h3 = H3Core.newInstance();
    }
    
    @BeforeEach
    void setUp() {
        properties = new ProximityProperties();
        store = new InMemoryPointStore();
        cellIndex = new H3CellIndex(h3, store, properties);
        gateway = new LocationUpdateGatewayImpl(store, cellIndex);
        engine = new ProximitySearchEngineImpl(store, cellIndex, new OverlayClassifier(properties), properties);
    }
    
    /**
     * real:1 on the center and five ghosts clustered within 0.01 degrees of it
     */
    private void loadMixedCluster() {
        gateway.reportLocation("real:1", CENTER_LON, CENTER_LAT);
        gateway.reportLocation("ghost:1", CENTER_LON + 0.002, CENTER_LAT);
        gateway.reportLocation("ghost:2", CENTER_LON, CENTER_LAT + 0.004);
        gateway.reportLocation("ghost:3", CENTER_LON - 0.006, CENTER_LAT);
        gateway.reportLocation("ghost:4", CENTER_LON + 0.008, CENTER_LAT + 0.001);
        gateway.reportLocation("ghost:5", CENTER_LON - 0.009, CENTER_LAT - 0.003);
    }
    
    @ParameterizedTest
    @EnumSource(SearchStrategy.class)
    void testRealDriverFirstThenNearestGhosts(SearchStrategy strategy) {
        // Given
        loadMixedCluster();
        gateway.buildIndex();
        
        // When
        SearchResult result = engine.search(CENTER_LON, CENTER_LAT, 5.0, 3, strategy, true);
        
        // Then
        assertEquals(List.of("real:1", "ghost:1", "ghost:2"), result.ids());
        assertEquals(0.0, result.getHits().get(0).getDistanceKm(), 1e-9);
        assertEquals(6, result.getCandidateCount());
        assertEquals(strategy, result.getStrategy());
    }
    
    @Test
    void testEnoughPrimaryMeansNoSecondary() {
        // Given - ghosts are closer than every real driver
        gateway.reportLocation("ghost:1", CENTER_LON, CENTER_LAT);
        gateway.reportLocation("ghost:2", CENTER_LON + 0.001, CENTER_LAT);
        gateway.reportLocation("real:1", CENTER_LON + 0.01, CENTER_LAT);
        gateway.reportLocation("real:2", CENTER_LON + 0.02, CENTER_LAT);
        
        // When
        SearchResult result = engine.search(CENTER_LON, CENTER_LAT, 5.0, 2, SearchStrategy.FLAT_SCAN, true);
        
        // Then
        assertEquals(List.of("real:1", "real:2"), result.ids());
    }
    
    @Test
    void testWithoutPreferenceResultIsPureDistanceOrder() {
        loadMixedCluster();
        
        SearchResult result = engine.search(CENTER_LON, CENTER_LAT, 5.0, 4, SearchStrategy.FLAT_SCAN, false);
        
        assertEquals(List.of("real:1", "ghost:1", "ghost:2", "ghost:3"), result.ids());
    }
    
    @Test
    void testResultsAreOrderedCappedAndUnique() {
        // Given
        Random random = new Random(11);
        for (int i = 0; i < 2000; i++) {
            String id = (i % 3 == 0 ? "ghost:" : "real:") + i;
            gateway.reportLocation(id, 106.6 + random.nextDouble() * 0.2, 10.7 + random.nextDouble() * 0.2);
        }
        gateway.buildIndex();
        
        for (SearchStrategy strategy : SearchStrategy.values()) {
            // When
            SearchResult result = engine.search(CENTER_LON, CENTER_LAT, 3.0, 25, strategy, false);
            
            // Then
            assertTrue(result.size() <= 25);
            assertEquals(result.size(), new HashSet<>(result.ids()).size());
            List<SearchHit> hits = result.getHits();
            for (int i = 1; i < hits.size(); i++) {
                assertTrue(hits.get(i - 1).getDistanceKm() <= hits.get(i).getDistanceKm());
            }
            hits.forEach(hit -> assertTrue(hit.getDistanceKm() <= 3.0));
        }
    }
    
    @Test
    void testStrategiesReturnSameSet() {
        // Given
        Random random = new Random(5);
        for (int i = 0; i < 1500; i++) {
            gateway.reportLocation("d" + i, 106.6 + random.nextDouble() * 0.2, 10.7 + random.nextDouble() * 0.2);
        }
        gateway.buildIndex();
        
        // When
        SearchResult flat = engine.search(CENTER_LON, CENTER_LAT, 4.0, 1000, SearchStrategy.FLAT_SCAN, false);
        SearchResult hierarchical = engine.search(CENTER_LON, CENTER_LAT, 4.0, 1000, SearchStrategy.HIERARCHICAL, false);
        
        // Then
        assertFalse(flat.isEmpty());
        assertEquals(new HashSet<>(flat.ids()), new HashSet<>(hierarchical.ids()));
        assertEquals(flat.getCandidateCount(), hierarchical.getCandidateCount());
    }
    
    @Test
    void testHierarchicalBeforeBuildFails() {
        gateway.reportLocation("real:1", CENTER_LON, CENTER_LAT);
        
        assertThrows(IndexUnavailableException.class,
                () -> engine.search(CENTER_LON, CENTER_LAT, 5.0, 3, SearchStrategy.HIERARCHICAL, true));
    }
    
    @Test
    void testHierarchicalAfterDropFails() {
        gateway.buildIndex();
        gateway.dropIndex();
        
        assertThrows(IndexUnavailableException.class,
                () -> engine.search(CENTER_LON, CENTER_LAT, 5.0, 3, SearchStrategy.HIERARCHICAL, true));
    }
    
    @Test
    void testNullStrategyUsesConfiguredDefault() {
        // Given
        properties.getSearch().setStrategy(SearchStrategy.HIERARCHICAL);
        
        // When / Then - the configured strategy needs the index
        assertThrows(IndexUnavailableException.class,
                () -> engine.search(CENTER_LON, CENTER_LAT, 5.0, 3, null, true));
        gateway.buildIndex();
        assertEquals(SearchStrategy.HIERARCHICAL,
                engine.search(CENTER_LON, CENTER_LAT, 5.0, 3, null, true).getStrategy());
    }
    
    @Test
    void testInvalidInputsAreRejected() {
        assertThrows(InvalidCoordinateException.class,
                () -> engine.search(200.0, 10.0, 5.0, 3, SearchStrategy.FLAT_SCAN, true));
        assertThrows(InvalidCoordinateException.class,
                () -> engine.search(106.7, Double.NaN, 5.0, 3, SearchStrategy.FLAT_SCAN, true));
        assertThrows(InvalidRadiusException.class,
                () -> engine.search(CENTER_LON, CENTER_LAT, 0.0, 3, SearchStrategy.FLAT_SCAN, true));
        assertThrows(InvalidRadiusException.class,
                () -> engine.search(CENTER_LON, CENTER_LAT, -1.0, 3, SearchStrategy.FLAT_SCAN, true));
        assertThrows(InvalidRadiusException.class,
                () -> engine.search(CENTER_LON, CENTER_LAT, Double.NaN, 3, SearchStrategy.FLAT_SCAN, true));
    }
    
    @Test
    void testNonPositiveCountGivesEmptyResult() {
        loadMixedCluster();
        
        SearchResult result = engine.search(CENTER_LON, CENTER_LAT, 5.0, 0, SearchStrategy.FLAT_SCAN, true);
        
        assertTrue(result.isEmpty());
        assertEquals(0, result.getCandidateCount());
    }
    
    @Test
    void testCandidateCeilingBoundsFetch() {
        // Given
        properties.getSearch().setCandidateCeiling(10);
        for (int i = 0; i < 50; i++) {
            gateway.reportLocation("d" + i, CENTER_LON + i * 0.0001, CENTER_LAT);
        }
        
        // When
        SearchResult small = engine.search(CENTER_LON, CENTER_LAT, 5.0, 3, SearchStrategy.FLAT_SCAN, true);
        SearchResult large = engine.search(CENTER_LON, CENTER_LAT, 5.0, 30, SearchStrategy.FLAT_SCAN, true);
        
        // Then - the ceiling is raised to the requested count
        assertEquals(10, small.getCandidateCount());
        assertEquals(30, large.getCandidateCount());
        assertEquals(30, large.size());
    }
    
    @Test
    void testSearchNearbyFormatsDistances() {
        // Given
        loadMixedCluster();
        NearbySearchParam param = NearbySearchParam.builder()
                .center(geometryFactory.createPoint(new Coordinate(CENTER_LON, CENTER_LAT)))
                .radiusKm(5.0)
                .count(3)
                .build();
        
        // When
        NearbyDriverResponse response = engine.searchNearby(param);
        
        // Then
        List<String> ids = response.getList().stream().map(NearbyDriver::getDriverId).collect(Collectors.toList());
        assertEquals(List.of("real:1", "ghost:1", "ghost:2"), ids);
        assertEquals("0", response.getList().get(0).getDistance());
        assertEquals(ProximitySearchEngineImpl.formatDistance(
                store.get("ghost:1").orElseThrow().distanceKmTo(CENTER_LON, CENTER_LAT)),
                response.getList().get(1).getDistance());
        assertEquals(SearchStrategy.FLAT_SCAN, response.getStrategy());
        assertEquals(6, response.getCandidates());
    }
    
    @Test
    void testFormatDistance() {
        assertEquals("0", ProximitySearchEngineImpl.formatDistance(0.0));
        assertEquals("0.2186", ProximitySearchEngineImpl.formatDistance(0.218571));
        assertEquals("1.5", ProximitySearchEngineImpl.formatDistance(1.50001));
        assertEquals("12", ProximitySearchEngineImpl.formatDistance(12.0));
    }
    
    @Test
    void testSearchNearbyRejectsBoundaryInput() {
        NearbySearchParam noCenter = NearbySearchParam.builder().radiusKm(5.0).count(3).build();
        NearbySearchParam noRadius = NearbySearchParam.builder()
                .center(geometryFactory.createPoint(new Coordinate(CENTER_LON, CENTER_LAT))).count(3).build();
        NearbySearchParam zeroCount = NearbySearchParam.builder()
                .center(geometryFactory.createPoint(new Coordinate(CENTER_LON, CENTER_LAT))).radiusKm(5.0).count(0).build();
        NearbySearchParam badCenter = NearbySearchParam.builder()
                .center(geometryFactory.createPoint(new Coordinate(200.0, CENTER_LAT))).radiusKm(5.0).count(3).build();
        
        InvalidCoordinateException missing = assertThrows(InvalidCoordinateException.class, () -> engine.searchNearby(noCenter));
        assertTrue(missing.getMessage().contains("center is required"), missing.getMessage());
        assertFalse(missing.getMessage().contains("NaN"));
        assertThrows(InvalidRadiusException.class, () -> engine.searchNearby(noRadius));
        assertThrows(InvalidCountException.class, () -> engine.searchNearby(zeroCount));
        assertThrows(InvalidCoordinateException.class, () -> engine.searchNearby(badCenter));
    }
    
    @Test
    void testStats() {
        // Given
        loadMixedCluster();
        gateway.buildIndex();
        
        // When
        IndexStats stats = engine.stats();
        
        // Then
        assertEquals("memory", stats.getStoreType());
        assertEquals(6, stats.getTotalPoints());
        assertEquals(1, stats.getPrimaryPoints());
        assertEquals(5, stats.getSecondaryPoints());
        assertTrue(stats.isIndexBuilt());
        assertEquals(7, stats.getResolution());
        assertTrue(stats.getCellCount() >= 1);
        assertEquals(SearchStrategy.FLAT_SCAN, stats.getDefaultStrategy());
    }
}
