package com.uitgo.proximity.loader;

import java.util.concurrent.CompletableFuture;

/**
 * Bulk generation of synthetic (secondary) drivers for demand overlays and load testing
 */
public interface SyntheticFleetLoader {
    
    /**
     * Generate {@code numberOfRecords} synthetic drivers spread uniformly over the box.
     * The same seed always produces the same fleet.
     */
    CompletableFuture<LoadResult> generate(int numberOfRecords, double minLat, double maxLat,
                                           double minLon, double maxLon, long seed);
    
    /**
     * Deregister every synthetic driver
     *
     * @return number of drivers removed
     */
    int purge();
    
    /**
     * Result of a generation run
     */
    class LoadResult {
        private final boolean success;
        private final long recordsLoaded;
        private final long durationMs;
        private final String message;
        
        public LoadResult(boolean success, long recordsLoaded, long durationMs, String message) {
            this.success = success;
            this.recordsLoaded = recordsLoaded;
            this.durationMs = durationMs;
            this.message = message;
        }
        
        public static LoadResult failed(String message) {
            return new LoadResult(false, 0, 0, message);
        }
        
        // Getters
        public boolean isSuccess() { return success; }
        public long getRecordsLoaded() { return recordsLoaded; }
        public long getDurationMs() { return durationMs; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("LoadResult{success=%s, records=%d, duration=%dms, message='%s'}", 
                               success, recordsLoaded, durationMs, message);
        }
    }
}
