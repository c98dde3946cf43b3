package com.uitgo.proximity.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result class for location and registration operations
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LocationResult {
    
    private String driverId;
    private Double longitude;
    private Double latitude;
    private String cell;
    private Boolean found;
    private Integer removed;
}
