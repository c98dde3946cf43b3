package com.uitgo.proximity.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the HTTP API over the in-memory store
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
public class ProximityIntegrationTest {
    
    @LocalServerPort
    private int port;
    
    private TestRestTemplate restTemplate;
    private String baseUrl;
    
    @BeforeEach
    public void setUp() {
        restTemplate = new TestRestTemplate();
        baseUrl = "http://localhost:" + port + "/api/v1";
        
        // Clear the store and make sure the cell index is built
        restTemplate.postForEntity(baseUrl + "/flushdb", null, Map.class);
        restTemplate.postForEntity(baseUrl + "/index/build", null, Map.class);
    }
    
    private ResponseEntity<Map> report(String id, double longitude, double latitude) {
        Map<String, Object> body = Map.of("longitude", longitude, "latitude", latitude);
        return restTemplate.exchange(baseUrl + "/drivers/" + id + "/location", HttpMethod.PUT,
                new HttpEntity<>(body), Map.class);
    }
    
    private ResponseEntity<Map> search(String query) {
        return restTemplate.getForEntity(baseUrl + "/drivers/search?" + query, Map.class);
    }
    
    @Test
    @SuppressWarnings("unchecked")
    public void testRealDriverRankedAheadOfGhosts() {
        // 1. One real driver on the center, five ghosts around it
        assertEquals(HttpStatus.OK, report("real:1", 106.700, 10.770).getStatusCode());
        report("ghost:1", 106.702, 10.770);
        report("ghost:2", 106.700, 10.774);
        report("ghost:3", 106.694, 10.770);
        report("ghost:4", 106.708, 10.771);
        report("ghost:5", 106.691, 10.767);
        
        // 2. Both strategies agree
        for (String strategy : List.of("flat-scan", "hierarchical")) {
            ResponseEntity<Map> response = search(
                    "latitude=10.770&longitude=106.700&radiusKm=5&count=3&strategy=" + strategy);
            
            assertEquals(HttpStatus.OK, response.getStatusCode());
            Map<String, Object> data = (Map<String, Object>) response.getBody().get("data");
            List<Map<String, Object>> list = (List<Map<String, Object>>) data.get("list");
            assertEquals(3, list.size());
            assertEquals("real:1", list.get(0).get("driverId"));
            assertEquals("0", list.get(0).get("distance"));
            assertEquals("ghost:1", list.get(1).get("driverId"));
            assertEquals("ghost:2", list.get(2).get("driverId"));
        }
    }
    
    @Test
    @SuppressWarnings("unchecked")
    public void testLocationLifecycle() {
        // 1. Report and read back
        report("d1", 106.70, 10.77);
        ResponseEntity<Map> located = restTemplate.getForEntity(baseUrl + "/drivers/d1/location", Map.class);
        assertEquals(HttpStatus.OK, located.getStatusCode());
        
        // 2. Busy drivers disappear from searches
        Map<String, Object> status = Map.of("status", "BUSY");
        restTemplate.exchange(baseUrl + "/drivers/d1/status", HttpMethod.PUT, new HttpEntity<>(status), Map.class);
        ResponseEntity<Map> response = search("latitude=10.77&longitude=106.70&radiusKm=5&count=3");
        Map<String, Object> data = (Map<String, Object>) response.getBody().get("data");
        assertTrue(((List<?>) data.get("list")).isEmpty());
        
        // 3. And are gone from the store
        assertEquals(HttpStatus.NOT_FOUND,
                restTemplate.getForEntity(baseUrl + "/drivers/d1/location", Map.class).getStatusCode());
    }
    
    @Test
    public void testErrorMapping() {
        assertEquals(HttpStatus.BAD_REQUEST, report("d1", 200, 10).getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                search("latitude=10.77&longitude=106.70&radiusKm=0&count=3").getStatusCode());
        assertEquals(HttpStatus.BAD_REQUEST,
                search("latitude=10.77&longitude=106.70&radiusKm=5&count=0").getStatusCode());
        
        // Hierarchical search without an index
        restTemplate.exchange(baseUrl + "/index", HttpMethod.DELETE, null, Map.class);
        ResponseEntity<Map> response = search("latitude=10.77&longitude=106.70&radiusKm=5&count=3&strategy=hierarchical");
        assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
        assertEquals("INDEX_UNAVAILABLE", response.getBody().get("code"));
    }
    
    @Test
    @SuppressWarnings("unchecked")
    public void testSyntheticFleetGenerateAndPurge() {
        // 1. Generate
        ResponseEntity<Map> generated = restTemplate.postForEntity(
                baseUrl + "/synthetic/generate?records=500&seed=3", null, Map.class);
        assertEquals(HttpStatus.OK, generated.getStatusCode());
        assertEquals(Boolean.TRUE, generated.getBody().get("ok"));
        report("real:1", 106.70, 10.77);
        
        ResponseEntity<Map> stats = restTemplate.getForEntity(baseUrl + "/stats", Map.class);
        Map<String, Object> data = (Map<String, Object>) stats.getBody().get("data");
        assertEquals(501, ((Number) data.get("totalPoints")).intValue());
        assertEquals(500, ((Number) data.get("secondaryPoints")).intValue());
        
        // 2. Purge leaves the real driver alone
        restTemplate.exchange(baseUrl + "/synthetic", HttpMethod.DELETE, null, Map.class);
        stats = restTemplate.getForEntity(baseUrl + "/stats", Map.class);
        data = (Map<String, Object>) stats.getBody().get("data");
        assertEquals(1, ((Number) data.get("totalPoints")).intValue());
    }
}
