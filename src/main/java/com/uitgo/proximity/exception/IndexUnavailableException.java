package com.uitgo.proximity.exception;

/**
 * Raised when the hierarchical strategy is asked for before the cell index has been built.
 * There is no fallback to the flat scan.
 */
public class IndexUnavailableException extends ProximityException {
    
    public static final String CODE = "INDEX_UNAVAILABLE";
    
    private final int resolution;
    
    public IndexUnavailableException(int resolution) {
        super(CODE, "Cell index at resolution " + resolution + " has not been built");
        this.resolution = resolution;
    }
    
    public int getResolution() {
        return resolution;
    }
}
