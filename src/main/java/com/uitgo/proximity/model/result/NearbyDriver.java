package com.uitgo.proximity.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of a search hit: distance is a decimal string of kilometers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NearbyDriver {
    
    private String driverId;
    private String distance;
}
