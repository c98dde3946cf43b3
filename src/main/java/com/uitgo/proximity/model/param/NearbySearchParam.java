package com.uitgo.proximity.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.uitgo.proximity.model.SearchStrategy;
import org.locationtech.jts.geom.Point;

/**
 * Parameter class for nearby driver searches
 * Center is a JTS point with x = longitude and y = latitude
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NearbySearchParam {
    
    /**
     * Search center point
     */
    private Point center;
    
    /**
     * Search radius in kilometers
     */
    private Double radiusKm;
    
    /**
     * Number of drivers wanted
     */
    private Integer count;
    
    /**
     * Strategy override, configured default when null
     */
    private SearchStrategy strategy;
    
    /**
     * Primary-first ranking override, configured default when null
     */
    private Boolean preferPrimary;
    
    @JsonIgnore
    public boolean hasValidCenter() {
        return center != null && !center.isEmpty();
    }
    
    @JsonIgnore
    public double getLongitude() {
        return center.getX();
    }
    
    @JsonIgnore
    public double getLatitude() {
        return center.getY();
    }
}
