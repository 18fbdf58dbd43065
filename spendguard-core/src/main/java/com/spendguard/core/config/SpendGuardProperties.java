package com.spendguard.core.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Core configuration properties for SpendGuard.
 * These map directly to the `spendguard.*` properties in your application.yml.
 */
public class SpendGuardProperties {

    private boolean enabled = true;
    private String mode = "ACTIVE"; // MONITOR or ACTIVE
    private Duration performanceTarget = Duration.ofMillis(10);

    private PricingProperties pricing = new PricingProperties();
    private EstimationProperties estimation = new EstimationProperties();
    private BudgetProperties budget = new BudgetProperties();
    private RecordingProperties recording = new RecordingProperties();
    private Map<String, StageProperties> stages = new HashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public boolean isActiveMode() {
        return "ACTIVE".equalsIgnoreCase(mode);
    }

    public boolean isMonitorMode() {
        return "MONITOR".equalsIgnoreCase(mode);
    }

    public Duration getPerformanceTarget() {
        return performanceTarget;
    }

    public void setPerformanceTarget(Duration performanceTarget) {
        this.performanceTarget = performanceTarget;
    }

    public PricingProperties getPricing() {
        return pricing;
    }

    public void setPricing(PricingProperties pricing) {
        this.pricing = pricing;
    }

    public EstimationProperties getEstimation() {
        return estimation;
    }

    public void setEstimation(EstimationProperties estimation) {
        this.estimation = estimation;
    }

    public BudgetProperties getBudget() {
        return budget;
    }

    public void setBudget(BudgetProperties budget) {
        this.budget = budget;
    }

    public RecordingProperties getRecording() {
        return recording;
    }

    public void setRecording(RecordingProperties recording) {
        this.recording = recording;
    }

    public Map<String, StageProperties> getStages() {
        return stages;
    }

    public void setStages(Map<String, StageProperties> stages) {
        this.stages = stages;
    }

    /**
     * Stages are enabled unless explicitly switched off.
     */
    public boolean isStageEnabled(String stageId) {
        StageProperties props = stages.get(stageId);
        if (props == null)
            return true;
        return props.isEnabled();
    }

    public static class PricingProperties {
        private Duration cacheTtl = Duration.ofHours(1);
        private long cacheMaximumSize = 10_000;
        private Duration storeTimeout = Duration.ofMillis(50);
        private String fallbackUnit = "PER_1K_TOKENS";
        // Deliberately high so unknown models over-estimate
        private BigDecimal fallbackInputRate = new BigDecimal("0.03");
        private BigDecimal fallbackOutputRate = new BigDecimal("0.06");
        private String fallbackCurrency = "USD";
        private Map<String, String> defaultModels = new HashMap<>(Map.of(
                "openai", "gpt-4o-mini",
                "gemini", "gemini-2.0-flash",
                "xai", "grok-2-1212"));
        private List<String> warmUp = new ArrayList<>(List.of(
                "openai:gpt-4o-mini",
                "openai:gpt-4o",
                "gemini:gemini-2.0-flash",
                "xai:grok-2-1212"));

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public long getCacheMaximumSize() {
            return cacheMaximumSize;
        }

        public void setCacheMaximumSize(long cacheMaximumSize) {
            this.cacheMaximumSize = cacheMaximumSize;
        }

        public Duration getStoreTimeout() {
            return storeTimeout;
        }

        public void setStoreTimeout(Duration storeTimeout) {
            this.storeTimeout = storeTimeout;
        }

        public String getFallbackUnit() {
            return fallbackUnit;
        }

        public void setFallbackUnit(String fallbackUnit) {
            this.fallbackUnit = fallbackUnit;
        }

        public BigDecimal getFallbackInputRate() {
            return fallbackInputRate;
        }

        public void setFallbackInputRate(BigDecimal fallbackInputRate) {
            this.fallbackInputRate = fallbackInputRate;
        }

        public BigDecimal getFallbackOutputRate() {
            return fallbackOutputRate;
        }

        public void setFallbackOutputRate(BigDecimal fallbackOutputRate) {
            this.fallbackOutputRate = fallbackOutputRate;
        }

        public String getFallbackCurrency() {
            return fallbackCurrency;
        }

        public void setFallbackCurrency(String fallbackCurrency) {
            this.fallbackCurrency = fallbackCurrency;
        }

        /** provider → model used when a request names no model. */
        public Map<String, String> getDefaultModels() {
            return defaultModels;
        }

        public void setDefaultModels(Map<String, String> defaultModels) {
            this.defaultModels = defaultModels;
        }

        /** "provider:model" pairs to preload at startup. */
        public List<String> getWarmUp() {
            return warmUp;
        }

        public void setWarmUp(List<String> warmUp) {
            this.warmUp = warmUp;
        }
    }

    public static class EstimationProperties {
        private int charsPerToken = 4;
        private double inputShare = 0.75; // of the estimated tokens, the rest counts as output

        public int getCharsPerToken() {
            return charsPerToken;
        }

        public void setCharsPerToken(int charsPerToken) {
            this.charsPerToken = charsPerToken;
        }

        public double getInputShare() {
            return inputShare;
        }

        public void setInputShare(double inputShare) {
            this.inputShare = inputShare;
        }
    }

    public static class BudgetProperties {
        private Duration limitCacheTtl = Duration.ofMinutes(5);
        private Duration spendCacheTtl = Duration.ofMinutes(1);
        private long cacheMaximumSize = 100_000;
        private Duration storeTimeout = Duration.ofMillis(50);
        private String zone = "UTC";
        private List<Integer> defaultAlertThresholds = new ArrayList<>(List.of(80, 95, 100));
        // scope type (user/project/organization) → period type (per-request/daily/monthly) → amount
        private Map<String, Map<String, BigDecimal>> defaultLimits = new HashMap<>();
        // scopes ("user:42", "project:search") preloaded at startup
        private List<String> warmUpScopes = new ArrayList<>();

        public Duration getLimitCacheTtl() {
            return limitCacheTtl;
        }

        public void setLimitCacheTtl(Duration limitCacheTtl) {
            this.limitCacheTtl = limitCacheTtl;
        }

        public Duration getSpendCacheTtl() {
            return spendCacheTtl;
        }

        public void setSpendCacheTtl(Duration spendCacheTtl) {
            this.spendCacheTtl = spendCacheTtl;
        }

        public long getCacheMaximumSize() {
            return cacheMaximumSize;
        }

        public void setCacheMaximumSize(long cacheMaximumSize) {
            this.cacheMaximumSize = cacheMaximumSize;
        }

        public Duration getStoreTimeout() {
            return storeTimeout;
        }

        public void setStoreTimeout(Duration storeTimeout) {
            this.storeTimeout = storeTimeout;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public List<Integer> getDefaultAlertThresholds() {
            return defaultAlertThresholds;
        }

        public void setDefaultAlertThresholds(List<Integer> defaultAlertThresholds) {
            this.defaultAlertThresholds = defaultAlertThresholds;
        }

        public Map<String, Map<String, BigDecimal>> getDefaultLimits() {
            return defaultLimits;
        }

        public void setDefaultLimits(Map<String, Map<String, BigDecimal>> defaultLimits) {
            this.defaultLimits = defaultLimits;
        }

        public List<String> getWarmUpScopes() {
            return warmUpScopes;
        }

        public void setWarmUpScopes(List<String> warmUpScopes) {
            this.warmUpScopes = warmUpScopes;
        }
    }

    public static class RecordingProperties {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(100);
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class StageProperties {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
