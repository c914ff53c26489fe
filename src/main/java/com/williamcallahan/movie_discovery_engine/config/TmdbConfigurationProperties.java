/**
 * Movie catalog (TMDB) API configuration properties
 *
 * @author William Callahan
 */

package com.williamcallahan.movie_discovery_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "tmdb")
public class TmdbConfigurationProperties {
    @NestedConfigurationProperty
    private Api api = new Api();

    public Api getApi() { return api; }
    public void setApi(Api api) { this.api = api; }

    public static class Api {
        private String key;
        private String baseUrl = "https://api.themoviedb.org/3";
        private Duration timeout = Duration.ofSeconds(30);
        private Duration searchTimeout = Duration.ofSeconds(10);

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public Duration getSearchTimeout() { return searchTimeout; }
        public void setSearchTimeout(Duration searchTimeout) { this.searchTimeout = searchTimeout; }
    }
}
