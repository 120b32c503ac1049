package com.skycaster.common.bulkhead;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration for bulkhead pattern implementation
 */
@Configuration
@EnableConfigurationProperties(BulkheadConfiguration.BulkheadProperties.class)
public class BulkheadConfiguration {

    @Bean
    public BulkheadService bulkheadService(BulkheadProperties properties) {
        return new BulkheadService(properties);
    }

    @ConfigurationProperties(prefix = "skycaster.bulkhead")
    public static class BulkheadProperties {

        private Compartment defaults = new Compartment();
        private Map<String, Compartment> compartments = new LinkedHashMap<>();

        /**
         * Settings for a named compartment, falling back to the defaults
         */
        public Compartment forCompartment(String name) {
            return compartments.getOrDefault(name, defaults);
        }

        public static class Compartment {
            private int poolSize = 4;
            private int permits = 8;
            private int timeoutSeconds = 30;

            public Compartment() {
            }

            public Compartment(int poolSize, int permits, int timeoutSeconds) {
                this.poolSize = poolSize;
                this.permits = permits;
                this.timeoutSeconds = timeoutSeconds;
            }

            public int getPoolSize() { return poolSize; }
            public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
            public int getPermits() { return permits; }
            public void setPermits(int permits) { this.permits = permits; }
            public int getTimeoutSeconds() { return timeoutSeconds; }
            public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        }

        public Compartment getDefaults() { return defaults; }
        public void setDefaults(Compartment defaults) { this.defaults = defaults; }
        public Map<String, Compartment> getCompartments() { return compartments; }
        public void setCompartments(Map<String, Compartment> compartments) { this.compartments = compartments; }
    }
}
