package com.uitgo.proximity;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Driver proximity index server.
 * Keeps the latest driver positions and answers nearest-driver searches over them.
 */
@SpringBootApplication
public class ProximityIndexApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ProximityIndexApplication.class, args);
    }
}
