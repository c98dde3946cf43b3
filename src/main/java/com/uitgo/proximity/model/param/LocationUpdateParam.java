package com.uitgo.proximity.model.param;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import jakarta.validation.constraints.NotNull;

/**
 * Body of a driver location report
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationUpdateParam {
    
    @NotNull
    private Double longitude;
    
    @NotNull
    private Double latitude;
}
