package com.uitgo.proximity.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, capped outcome of a proximity search
 */
@Value
@Builder
public class SearchResult {
    
    SearchStrategy strategy;
    
    @Singular
    List<SearchHit> hits;
    
    /**
     * Number of in-radius candidates the strategy produced before the overlay policy ran
     */
    int candidateCount;
    
    public static SearchResult empty(SearchStrategy strategy) {
        return SearchResult.builder().strategy(strategy).candidateCount(0).build();
    }
    
    public int size() {
        return hits.size();
    }
    
    public boolean isEmpty() {
        return hits.isEmpty();
    }
    
    public List<String> ids() {
        return hits.stream().map(SearchHit::getId).collect(Collectors.toList());
    }
}
