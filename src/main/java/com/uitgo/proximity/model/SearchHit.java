package com.uitgo.proximity.model;

import lombok.Value;

import java.util.Comparator;

/**
 * One ranked entry of a proximity search
 */
@Value
public class SearchHit {
    
    /** Ascending distance, ties broken by id so equal distances rank the same way every time */
    public static final Comparator<SearchHit> BY_DISTANCE =
            Comparator.comparingDouble(SearchHit::getDistanceKm).thenComparing(SearchHit::getId);
    
    String id;
    double distanceKm;
}
