/**
 * Main application class for the movie discovery engine
 *
 * @author William Callahan
 *
 * Features:
 * - Wires the catalog client, caches, debouncer, batch manager and recommendation engine
 * - Enables scheduling for cache sweeps and profile flushes
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.movie_discovery_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MovieDiscoveryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MovieDiscoveryEngineApplication.class, args);
    }
}
