package com.uitgo.proximity.model.result;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.uitgo.proximity.model.SearchStrategy;

import java.util.List;

/**
 * Result class for nearby driver searches
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NearbyDriverResponse {
    
    private List<NearbyDriver> list;
    private SearchStrategy strategy;
    private Integer candidates;
}
