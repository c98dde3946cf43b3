package com.uitgo.proximity.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of store and index sizes
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexStats {
    
    private String storeType;
    private long totalPoints;
    private long primaryPoints;
    private long secondaryPoints;
    private boolean indexBuilt;
    private int resolution;
    private long cellCount;
    private SearchStrategy defaultStrategy;
}
