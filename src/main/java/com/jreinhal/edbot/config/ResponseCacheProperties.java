package com.jreinhal.edbot.config;

import com.jreinhal.edbot.model.Category;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edbot.cache")
public class ResponseCacheProperties {
    private boolean enabled = true;

    /**
     * Answers below this confidence are never stored.
     */
    private double minConfidence = 0.7;

    /**
     * Categories whose answers are never stored. Form answers point at documents that change
     * independently of the question; contact rosters change by shift.
     */
    private Set<Category> neverCache = EnumSet.of(Category.FORM, Category.CONTACT);

    private Map<Category, Long> ttlSeconds = defaultTtls();

    private long defaultTtlSeconds = 600L;

    /**
     * Entry bound of the in-process cache.
     */
    private long maximumSize = 1000L;

    private static Map<Category, Long> defaultTtls() {
        EnumMap<Category, Long> ttls = new EnumMap<>(Category.class);
        ttls.put(Category.PROTOCOL, 3600L);
        ttls.put(Category.CRITERIA, 1800L);
        ttls.put(Category.DOSAGE, 3600L);
        ttls.put(Category.SUMMARY, 300L);
        return ttls;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public Set<Category> getNeverCache() {
        return neverCache;
    }

    public void setNeverCache(Set<Category> neverCache) {
        this.neverCache = neverCache;
    }

    public Map<Category, Long> getTtlSeconds() {
        return ttlSeconds;
    }

    public void setTtlSeconds(Map<Category, Long> ttlSeconds) {
        this.ttlSeconds = ttlSeconds;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public void setDefaultTtlSeconds(long defaultTtlSeconds) {
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }
}
