package com.uitgo.proximity.config;

import com.uitgo.proximity.model.SearchStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables of the proximity index, bound from {@code proximity.*}
 */
@Data
@ConfigurationProperties(prefix = "proximity")
public class ProximityProperties {
    
    private Store store = new Store();
    private Search search = new Search();
    private Index index = new Index();
    private Overlay overlay = new Overlay();
    
    @Data
    public static class Store {
        
        /**
         * {@code memory} keeps points in-process, {@code redis} uses a GEO sorted set
         */
        private String type = "memory";
        
        /**
         * Redis key of the geo sorted set
         */
        private String key = "drivers";
    }
    
    @Data
    public static class Search {
        
        /**
         * Strategy used when a request does not name one
         */
        private SearchStrategy strategy = SearchStrategy.FLAT_SCAN;
        
        /**
         * Candidates fetched before overlay filtering, raised to the requested count when smaller
         */
        private int candidateCeiling = 1000;
        
        /**
         * Rank real drivers ahead of synthetic ones unless a request says otherwise
         */
        private boolean preferPrimary = true;
    }
    
    @Data
    public static class Index {
        
        /**
         * H3 resolution of the cell membership index
         */
        private int resolution = 7;
        
        /**
         * Build the cell index from the store once the application is ready
         */
        private boolean buildOnStartup = true;
    }
    
    @Data
    public static class Overlay {
        
        /**
         * Id prefix reserved for synthetic entities; real ids must never start with it
         */
        private String syntheticPrefix = "ghost:";
    }
}
