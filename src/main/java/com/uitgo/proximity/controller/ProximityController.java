package com.uitgo.proximity.controller;

import com.uitgo.proximity.aspect.TimingAspect;
import com.uitgo.proximity.loader.SyntheticFleetLoader;
import com.uitgo.proximity.model.Cell;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.model.IndexStats;
import com.uitgo.proximity.model.SearchStrategy;
import com.uitgo.proximity.model.param.LocationUpdateParam;
import com.uitgo.proximity.model.param.NearbySearchParam;
import com.uitgo.proximity.model.param.StatusUpdateParam;
import com.uitgo.proximity.model.result.ApiResponse;
import com.uitgo.proximity.model.result.LocationResult;
import com.uitgo.proximity.model.result.NearbyDriverResponse;
import com.uitgo.proximity.service.LocationUpdateGateway;
import com.uitgo.proximity.service.ProximitySearchEngine;

import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * HTTP REST API for driver location updates and proximity searches.
 * Domain errors are translated by {@link ProximityExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class ProximityController {

    @Autowired
    private ProximitySearchEngine proximitySearchEngine;

    @Autowired
    private LocationUpdateGateway locationUpdateGateway;

    @Autowired
    private SyntheticFleetLoader syntheticFleetLoader;

    @Autowired
    private GeometryFactory geometryFactory;

    /**
     * Report the current position of a driver
     * HTTP: PUT /api/v1/drivers/{id}/location
     */
    @PutMapping("/drivers/{id}/location")
    public ResponseEntity<ApiResponse<LocationResult>> reportLocation(
            @PathVariable String id,
            @Valid @RequestBody LocationUpdateParam param) {

        long startTime = System.currentTimeMillis();
        Optional<Cell> cell = locationUpdateGateway.reportLocation(id, param.getLongitude(), param.getLatitude());
        long duration = System.currentTimeMillis() - startTime;

        LocationResult result = LocationResult.builder()
                .driverId(id)
                .longitude(param.getLongitude())
                .latitude(param.getLatitude())
                .cell(cell.map(Cell::getAddress).orElse(null))
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, duration + "ms"));
    }

    /**
     * Last known position of a driver
     * HTTP: GET /api/v1/drivers/{id}/location
     */
    @GetMapping("/drivers/{id}/location")
    public ResponseEntity<ApiResponse<LocationResult>> locate(@PathVariable String id) {
        long startTime = System.currentTimeMillis();
        Optional<DriverPoint> point = locationUpdateGateway.locate(id);
        long duration = System.currentTimeMillis() - startTime;

        if (point.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        LocationResult result = LocationResult.builder()
                .driverId(id)
                .longitude(point.get().getLongitude())
                .latitude(point.get().getLatitude())
                .found(true)
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, duration + "ms"));
    }

    /**
     * HTTP: PUT /api/v1/drivers/{id}/status
     */
    @PutMapping("/drivers/{id}/status")
    public ResponseEntity<ApiResponse<LocationResult>> updateStatus(
            @PathVariable String id,
            @Valid @RequestBody StatusUpdateParam param) {

        long startTime = System.currentTimeMillis();
        boolean removed = locationUpdateGateway.updateStatus(id, param.getStatus());
        long duration = System.currentTimeMillis() - startTime;

        log.debug("Driver {} switched to {}, location removed: {}", id, param.getStatus(), removed);
        LocationResult result = LocationResult.builder()
                .driverId(id)
                .removed(removed ? 1 : 0)
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, duration + "ms"));
    }

    /**
     * HTTP: DELETE /api/v1/drivers/{id}
     */
    @DeleteMapping("/drivers/{id}")
    public ResponseEntity<ApiResponse<LocationResult>> deregister(@PathVariable String id) {
        long startTime = System.currentTimeMillis();
        boolean removed = locationUpdateGateway.deregister(id);
        long duration = System.currentTimeMillis() - startTime;

        LocationResult result = LocationResult.builder()
                .driverId(id)
                .removed(removed ? 1 : 0)
                .build();
        return ResponseEntity.ok(ApiResponse.success(result, duration + "ms"));
    }

    /**
     * Nearest drivers around a center
     * HTTP: GET /api/v1/drivers/search?latitude=10.77&longitude=106.7&radiusKm=5&count=10
     */
    @GetMapping("/drivers/search")
    public ResponseEntity<ApiResponse<NearbyDriverResponse>> search(
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam double radiusKm,
            @RequestParam int count,
            @RequestParam(required = false) String strategy,
            @RequestParam(required = false) Boolean preferPrimary) {

        NearbySearchParam param = NearbySearchParam.builder()
                .center(geometryFactory.createPoint(new Coordinate(longitude, latitude)))
                .radiusKm(radiusKm)
                .count(count)
                .strategy(strategy != null ? SearchStrategy.fromFlag(strategy) : null)
                .preferPrimary(preferPrimary)
                .build();

        log.debug("Searching {} drivers within {}km of ({},{})", count, radiusKm, longitude, latitude);
        NearbyDriverResponse response = proximitySearchEngine.searchNearby(param);
        return ResponseEntity.ok(ApiResponse.success(response, TimingAspect.getAndClearExecutionTime()));
    }

    /**
     * Build the H3 cell index from the current store content
     * HTTP: POST /api/v1/index/build
     */
    @PostMapping("/index/build")
    public ResponseEntity<ApiResponse<IndexStats>> buildIndex() {
        long startTime = System.currentTimeMillis();
        int indexed = locationUpdateGateway.buildIndex();
        long duration = System.currentTimeMillis() - startTime;

        log.info("Cell index built over {} points in {}ms", indexed, duration);
        return ResponseEntity.ok(ApiResponse.success(proximitySearchEngine.stats(), duration + "ms"));
    }

    /**
     * HTTP: DELETE /api/v1/index
     */
    @DeleteMapping("/index")
    public ResponseEntity<ApiResponse<IndexStats>> dropIndex() {
        long startTime = System.currentTimeMillis();
        locationUpdateGateway.dropIndex();
        long duration = System.currentTimeMillis() - startTime;

        return ResponseEntity.ok(ApiResponse.success(proximitySearchEngine.stats(), duration + "ms"));
    }

    /**
     * HTTP: GET /api/v1/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<IndexStats>> getStats() {
        long startTime = System.currentTimeMillis();
        IndexStats stats = proximitySearchEngine.stats();
        long duration = System.currentTimeMillis() - startTime;

        return ResponseEntity.ok(ApiResponse.success(stats, duration + "ms"));
    }

    /**
     * Remove every driver
     * HTTP: POST /api/v1/flushdb
     */
    @PostMapping("/flushdb")
    public ResponseEntity<ApiResponse<IndexStats>> flushDb() {
        long startTime = System.currentTimeMillis();
        locationUpdateGateway.flush();
        long duration = System.currentTimeMillis() - startTime;

        log.info("Flushed all drivers");
        return ResponseEntity.ok(ApiResponse.success(proximitySearchEngine.stats(), duration + "ms"));
    }

    /**
     * Generate synthetic drivers
     * HTTP: POST /api/v1/synthetic/generate
     */
    @PostMapping("/synthetic/generate")
    public ResponseEntity<Map<String, Object>> generateSynthetic(
            @RequestParam(defaultValue = "1000") int records,
            @RequestParam(defaultValue = "10.70") double minLat,
            @RequestParam(defaultValue = "10.85") double maxLat,
            @RequestParam(defaultValue = "106.60") double minLon,
            @RequestParam(defaultValue = "106.80") double maxLon,
            @RequestParam(defaultValue = "42") long seed) throws InterruptedException, ExecutionException {

        log.info("Starting synthetic fleet generation: {} records", records);
        SyntheticFleetLoader.LoadResult result = syntheticFleetLoader
                .generate(records, minLat, maxLat, minLon, maxLon, seed)
                .get();

        Map<String, Object> response = new HashMap<>();
        response.put("ok", result.isSuccess());
        response.put("records_generated", result.getRecordsLoaded());
        response.put("duration_ms", result.getDurationMs());
        response.put("message", result.getMessage());

        return result.isSuccess() ? ResponseEntity.ok(response) : ResponseEntity.badRequest().body(response);
    }

    /**
     * Remove every synthetic driver
     * HTTP: DELETE /api/v1/synthetic
     */
    @DeleteMapping("/synthetic")
    public ResponseEntity<ApiResponse<LocationResult>> purgeSynthetic() {
        long startTime = System.currentTimeMillis();
        int removed = syntheticFleetLoader.purge();
        long duration = System.currentTimeMillis() - startTime;

        LocationResult result = LocationResult.builder().removed(removed).build();
        return ResponseEntity.ok(ApiResponse.success(result, duration + "ms"));
    }
}
