package com.uitgo.proximity.classifier;

import com.uitgo.proximity.config.ProximityProperties;
import com.uitgo.proximity.model.EntityClass;
import com.uitgo.proximity.model.SearchHit;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits search hits into real (primary) and synthetic (secondary) entities.
 * <p>
 * The class of an entity is decided by its id alone: ids starting with the reserved
 * synthetic prefix ({@code ghost:} by default) are secondary. Real id generation must
 * never produce that prefix. Nothing here is stored, so the class cannot drift from the id.
 */
@Component
public class OverlayClassifier {
    
    private final String syntheticPrefix;
    
    @Autowired
    public OverlayClassifier(ProximityProperties properties) {
        this(properties.getOverlay().getSyntheticPrefix());
    }
    
    public OverlayClassifier(String syntheticPrefix) {
        if (syntheticPrefix == null || syntheticPrefix.isEmpty()) {
            throw new IllegalArgumentException("Synthetic id prefix must not be empty");
        }
        this.syntheticPrefix = syntheticPrefix;
    }
    
    public EntityClass classify(String id) {
        return id.startsWith(syntheticPrefix) ? EntityClass.SECONDARY : EntityClass.PRIMARY;
    }
    
    public boolean isReserved(String id) {
        return classify(id) == EntityClass.SECONDARY;
    }
    
    /**
     * Id in the synthetic namespace, e.g. {@code ghost:42}
     */
    public String syntheticId(Object suffix) {
        return syntheticPrefix + suffix;
    }
    
    public String getSyntheticPrefix() {
        return syntheticPrefix;
    }
    
    /**
     * Cut a distance-ordered hit list down to {@code desiredCount} entries.
     * <p>
     * With {@code preferPrimary} the primary hits come first in their original order and secondary
     * hits only fill the slots that are left. Without it the first {@code desiredCount} hits are
     * returned as they are.
     */
    public List<SearchHit> partitionAndFill(List<SearchHit> results, int desiredCount, boolean preferPrimary) {
        if (desiredCount <= 0 || results.isEmpty()) {
            return Collections.emptyList();
        }
        if (!preferPrimary) {
            return new ArrayList<>(results.subList(0, Math.min(desiredCount, results.size())));
        }
        
        List<SearchHit> selected = new ArrayList<>(Math.min(desiredCount, results.size()));
        List<SearchHit> secondary = new ArrayList<>();
        for (SearchHit hit : results) {
            if (classify(hit.getId()) == EntityClass.PRIMARY) {
                selected.add(hit);
                if (selected.size() == desiredCount) {
                    return selected;
                }
            } else if (secondary.size() < desiredCount) {
                secondary.add(hit);
            }
        }
        
        for (SearchHit hit : secondary) {
            if (selected.size() == desiredCount) {
                break;
            }
            selected.add(hit);
        }
        return selected;
    }
}
