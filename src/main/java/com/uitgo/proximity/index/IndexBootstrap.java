package com.uitgo.proximity.index;

import com.uitgo.proximity.exception.StoreUnavailableException;
import com.uitgo.proximity.service.LocationUpdateGateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Builds the cell index from whatever the store already holds once the application has started.
 * Disabled with {@code proximity.index.build-on-startup=false}.
 */
@Component
@ConditionalOnProperty(prefix = "proximity.index", name = "build-on-startup", havingValue = "true", matchIfMissing = true)
@Slf4j
public class IndexBootstrap implements CommandLineRunner {
    
    @Autowired
    private LocationUpdateGateway locationUpdateGateway;
    
    @Override
    public void run(String... args) {
        try {
            int indexed = locationUpdateGateway.buildIndex();
            log.info("Startup cell index build finished with {} points", indexed);
        } catch (StoreUnavailableException e) {
            // Hierarchical searches answer INDEX_UNAVAILABLE until POST /api/v1/index/build succeeds
            log.error("Startup cell index build failed, index left unbuilt", e);
        }
    }
}
