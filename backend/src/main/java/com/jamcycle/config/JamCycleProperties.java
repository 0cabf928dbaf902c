package com.jamcycle.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runtime switches and cadences of the competition loops, plus the tenant directory.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "jamcycle")
public class JamCycleProperties {

    private Scheduler scheduler = new Scheduler();
    private AdminPanel adminPanel = new AdminPanel();
    private Store store = new Store();
    private FaceOff faceOff = new FaceOff();
    private Themes themes = new Themes();
    private List<Tenant> tenants = new ArrayList<>();

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private long tickIntervalMs = 3_600_000;
        private long initialDelayMs = 10_000;
    }

    @Getter
    @Setter
    public static class AdminPanel {
        private boolean enabled = true;
        private long pollIntervalMs = 5_000;
        private long initialDelayMs = 5_000;
        private long statusIntervalSeconds = 30;
        private long errorLogIntervalSeconds = 120;
        private int requestTimeoutSeconds = 10;
        private String redisKeyPrefix = "jamcycle";
        private long resultTtlSeconds = 86_400;
        private int processedCacheSize = 256;
        private int maxCommandsPerPoll = 10;
        /**
         * Whether the Redis command queue may be used, as primary or as fallback transport.
         */
        private boolean queueEnabled = true;
    }

    @Getter
    @Setter
    public static class Store {
        /**
         * in_memory or redis.
         */
        private String mode = "in_memory";
        private String redisKeyPrefix = "jamcycle:guild";
        private long timeoutSeconds = 10;
    }

    @Getter
    @Setter
    public static class FaceOff {
        private int durationHours = 24;
    }

    @Getter
    @Setter
    public static class Themes {
        private List<String> pool = new ArrayList<>(List.of(
                "Cosmic Dreams",
                "Urban Legends",
                "Ocean Depths",
                "Forest Tales",
                "Heart Break"
        ));
    }

    @Getter
    @Setter
    public static class Tenant {
        private String id;
        private String name;
        /**
         * queue or http.
         */
        private String transport = "queue";
        private String backendUrl;
        private String backendToken;
    }
}
