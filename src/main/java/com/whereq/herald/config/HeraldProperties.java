package com.whereq.herald.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneOffset;

/**
 * Configuration properties for WhereQ Herald.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "herald")
@Data
public class HeraldProperties {

    /**
     * UTC offset at which daily, weekly and monthly recurrences are computed.
     */
    private ZoneOffset zoneOffset = ZoneOffset.UTC;

    private StoreConfig store = new StoreConfig();

    private DispatchConfig dispatch = new DispatchConfig();

    private TimerConfig timer = new TimerConfig();

    @Data
    public static class StoreConfig {
        /**
         * Store backend.
         * REDIS: durable, survives restarts (default)
         * MEMORY: process-local, for development and tests
         */
        private StoreType type = StoreType.REDIS;

        /**
         * Maximum time the scheduler waits for a single store call.
         */
        private Duration timeout = Duration.ofSeconds(5);

        /**
         * Prefix of every Redis key written by the store.
         */
        private String keyPrefix = "herald";

        /**
         * Number of history entries retained, most recent first.
         */
        private int historyMaxEntries = 100;
    }

    @Data
    public static class DispatchConfig {
        /**
         * Base URL that relative destinations are resolved against.
         */
        private String webhookBaseUrl;

        /**
         * Maximum time a single delivery may take.
         */
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class TimerConfig {
        /**
         * Maximum number of threads running firing protocols concurrently.
         */
        private int threadCap = 8;
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }
}
