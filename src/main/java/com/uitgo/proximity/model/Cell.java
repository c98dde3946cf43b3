package com.uitgo.proximity.model;

import lombok.Value;

/**
 * One hexagon of the H3 grid at a fixed resolution
 */
@Value
public class Cell {
    
    long cellId;
    int resolution;
    
    /**
     * Canonical H3 string form of the cell id
     */
    public String getAddress() {
        return Long.toHexString(cellId);
    }
    
    @Override
    public String toString() {
        return getAddress() + "@r" + resolution;
    }
}
