package com.uitgo.proximity.model;

public enum DriverStatus {
    ONLINE,
    BUSY,
    OFFLINE;
    
    /**
     * Busy and offline drivers must not be matched, so their point leaves the index
     */
    public boolean removesFromIndex() {
        return this != ONLINE;
    }
}
