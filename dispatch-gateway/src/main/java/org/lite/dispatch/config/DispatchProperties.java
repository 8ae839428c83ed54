package org.lite.dispatch.config;

import lombok.Data;
import org.lite.dispatch.enums.RoutingStrategyType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Configuration
@ConfigurationProperties(prefix = "dispatch")
@Data
public class DispatchProperties {

    /** Distinguishes this gateway's rollup buckets from other instances sharing the database. */
    private String instanceId = UUID.randomUUID().toString().substring(0, 8);
    private List<ProviderEntry> providers = new ArrayList<>();
    private Router router = new Router();
    private RateLimit rateLimit = new RateLimit();
    private Metrics metrics = new Metrics();
    private Alerts alerts = new Alerts();

    @Data
    public static class ProviderEntry {
        private String providerId;
        private String modelId;
        private boolean vision;
        private boolean toolUse;
        private int maxContextTokens = 128_000;
        private int maxOutputTokens = 4_096;
        private double inputPricePer1M;
        private double outputPricePer1M;
    }

    @Data
    public static class Router {
        private RoutingStrategyType defaultStrategy = RoutingStrategyType.WEIGHTED;
        private long snapshotTtlMs = 60_000;
        // snapshots older than ttl * this factor are treated as unavailable
        private int maxStalenessFactor = 5;
        private long metricsWindowMs = 3_600_000;
        private double minSuccessRate = 0.8;
        private long minSampleSize = 20;
        private int alternatives = 3;
        private int charsPerToken = 4;
        private long defaultOutputTokens = 500;
        private double defaultLatencyMs = 1_000;
        private Weights weights = new Weights();
        private Failover failover = new Failover();
        private List<ModelRule> modelRules = new ArrayList<>();
        private long snapshotRefreshIntervalMs = 30_000;
        private long decisionMemoryTtlMs = 600_000;
        private long decisionMemoryMaxSize = 100_000;
    }

    @Data
    public static class Weights {
        private int latency = 50;
        private int cost = 50;
    }

    @Data
    public static class Failover {
        /** Candidate key in provider/model form. */
        private String primary;
        private List<String> fallbacks = new ArrayList<>();
        private int failureThreshold = 3;
        // a demoted primary is preferred again after this long
        private long recoveryMs = 300_000;
    }

    @Data
    public static class ModelRule {
        private String name;
        private int priority;
        private Double maxCost;
        private Double maxLatencyMs;
        private Boolean requiresVision;
        private Integer maxTokens;
        /** Provider id to weight; a higher weight ranks first. */
        private Map<String, Integer> preferredProviders = new LinkedHashMap<>();
    }

    @Data
    public static class RateLimit {
        private ScopeLimit user = new ScopeLimit(true, 100, 60_000, 10);
        private ScopeLimit provider = new ScopeLimit(true, 1_000, 60_000, 100);
        private ScopeLimit ip = new ScopeLimit(true, 300, 60_000, 30);
        private ScopeLimit global = new ScopeLimit(true, 10_000, 60_000, 1_000);
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_CLOSED;
        private long idleEvictionMs = 86_400_000;
        private long violationRetentionMs = 604_800_000;
        private long cleanupIntervalMs = 3_600_000;
        private boolean persistBuckets = true;
        // changed buckets are written in one batch per interval
        private long flushIntervalMs = 1_000;
        private int maxRetries = 3;
        private long minBackoffMs = 200;
        private long maxBackoffMs = 5_000;
        private String cleanupLeaseKey = "dispatch:rate-limit:cleanup-lease";
    }

    @Data
    public static class ScopeLimit {
        private boolean enabled;
        private long limit;
        private long windowMs;
        private long burst;

        public ScopeLimit() {
        }

        public ScopeLimit(boolean enabled, long limit, long windowMs, long burst) {
            this.enabled = enabled;
            this.limit = limit;
            this.windowMs = windowMs;
            this.burst = burst;
        }
    }

    public enum FailurePolicy {
        FAIL_OPEN,
        FAIL_CLOSED
    }

    @Data
    public static class Metrics {
        private int bufferCapacity = 10_000;
        private int batchSize = 100;
        private int maxRetries = 3;
        private long minBackoffMs = 200;
        private long maxBackoffMs = 5_000;
        private long flushIntervalMs = 5_000;
        private long rollupIntervalMs = 60_000;
        private double sketchRelativeAccuracy = 0.01;
        private String rollupLeaseKey = "dispatch:metrics:rollup-lease";
        // held by the instance purging expired metrics from storage
        private long rollupLeaseTtlMs = 55_000;
        // raw events kept on the heap past the last rollup; older reads are answered from buckets
        private long rawMemoryMs = 7_200_000;
        private Retention retention = new Retention();
    }

    @Data
    public static class Retention {
        private long rawMs = 7L * 86_400_000;
        private long minuteMs = 30L * 86_400_000;
        private long hourMs = 90L * 86_400_000;
        private long dayMs = 365L * 86_400_000;
    }

    @Data
    public static class Alerts {
        private long evaluationIntervalMs = 60_000;
        private String transitionsChannel = "alerts:transitions";
        private int historySize = 1_000;
        private long statsWindowMs = 86_400_000;
    }
}
