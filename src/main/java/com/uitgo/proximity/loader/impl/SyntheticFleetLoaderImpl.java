package com.uitgo.proximity.loader.impl;

import com.uitgo.proximity.classifier.OverlayClassifier;
import com.uitgo.proximity.geo.GeoDistance;
import com.uitgo.proximity.loader.SyntheticFleetLoader;
import com.uitgo.proximity.model.DriverPoint;
import com.uitgo.proximity.repository.PointStore;
import com.uitgo.proximity.service.LocationUpdateGateway;

import org.springframework.stereotype.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

/**
 * SyntheticFleetLoader writing through the LocationUpdateGateway in fixed-size batches
 */
@Component
public class SyntheticFleetLoaderImpl implements SyntheticFleetLoader {
    
    private static final Logger logger = LoggerFactory.getLogger(SyntheticFleetLoaderImpl.class);
    
    // Batch size for processing - tuned for memory efficiency
    static final int BATCH_SIZE = 10000;
    
    private final LocationUpdateGateway locationUpdateGateway;
    private final PointStore pointStore;
    private final OverlayClassifier overlayClassifier;
    
    public SyntheticFleetLoaderImpl(LocationUpdateGateway locationUpdateGateway, PointStore pointStore,
                                    OverlayClassifier overlayClassifier) {
        this.locationUpdateGateway = locationUpdateGateway;
        this.pointStore = pointStore;
        this.overlayClassifier = overlayClassifier;
    }
    
    @Override
    public CompletableFuture<LoadResult> generate(int numberOfRecords, double minLat, double maxLat,
                                                  double minLon, double maxLon, long seed) {
        String problem = validate(numberOfRecords, minLat, maxLat, minLon, maxLon);
        if (problem != null) {
            logger.warn("Rejected synthetic fleet generation: {}", problem);
            return CompletableFuture.completedFuture(LoadResult.failed(problem));
        }
        
        return CompletableFuture.supplyAsync(() -> {
            logger.info("Generating {} synthetic drivers in [{},{}]x[{},{}] with seed {}", 
                       numberOfRecords, minLat, maxLat, minLon, maxLon, seed);
            long startTime = System.currentTimeMillis();
            Random random = new Random(seed);
            
            try {
                List<DriverPoint> batch = new ArrayList<>(Math.min(numberOfRecords, BATCH_SIZE));
                long totalRecords = 0;
                
                for (int i = 0; i < numberOfRecords; i++) {
                    double lat = minLat + (maxLat - minLat) * random.nextDouble();
                    double lon = minLon + (maxLon - minLon) * random.nextDouble();
                    batch.add(DriverPoint.builder()
                            .id(overlayClassifier.syntheticId(i))
                            .longitude(lon)
                            .latitude(lat)
                            .updatedAt(startTime)
                            .build());
                    
                    if (batch.size() >= BATCH_SIZE) {
                        totalRecords += locationUpdateGateway.bulkReport(batch);
                        logger.info("Generated {} synthetic drivers so far...", totalRecords);
                        batch.clear();
                    }
                }
                if (!batch.isEmpty()) {
                    totalRecords += locationUpdateGateway.bulkReport(batch);
                }
                
                long duration = System.currentTimeMillis() - startTime;
                logger.info("Completed synthetic fleet generation: {} drivers in {}ms", totalRecords, duration);
                return new LoadResult(true, totalRecords, duration, "Synthetic fleet generated successfully");
                
            } catch (Exception e) {
                long duration = System.currentTimeMillis() - startTime;
                logger.error("Error generating synthetic fleet", e);
                return new LoadResult(false, 0, duration, "Error: " + e.getMessage());
            }
        });
    }
    
    private static String validate(int numberOfRecords, double minLat, double maxLat, double minLon, double maxLon) {
        if (numberOfRecords <= 0) {
            return "Number of records must be positive, got: " + numberOfRecords;
        }
        if (!GeoDistance.isValid(minLon, minLat) || !GeoDistance.isValid(maxLon, maxLat)) {
            return String.format("Bounding box out of range: lat [%s,%s], lon [%s,%s]", minLat, maxLat, minLon, maxLon);
        }
        if (minLat > maxLat || minLon > maxLon) {
            return String.format("Bounding box minimum exceeds maximum: lat [%s,%s], lon [%s,%s]", minLat, maxLat, minLon, maxLon);
        }
        return null;
    }
    
    @Override
    public int purge() {
        int removed = 0;
        for (String id : pointStore.ids()) {
            if (overlayClassifier.isReserved(id) && locationUpdateGateway.deregister(id)) {
                removed++;
            }
        }
        logger.info("Purged {} synthetic drivers", removed);
        return removed;
    }
}
