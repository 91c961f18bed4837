package com.jreinhal.edbot.config;

import com.jreinhal.edbot.model.Tier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edbot.retrieval")
public class RetrievalProperties {
    /**
     * End-to-end deadline for one question. When it fires the safety fallback is returned.
     */
    private long requestTimeoutMs = 30000L;

    /**
     * Candidates whose lexical relevance does not exceed this value are discarded before confidence scoring.
     */
    private double minRelevance = 0.02;

    private TierSettings directLookup = TierSettings.defaults(Tier.DIRECT_LOOKUP, 5);
    private TierSettings curatedKb = TierSettings.defaults(Tier.CURATED_KB, 5);
    private TierSettings hybridSearch = TierSettings.defaults(Tier.HYBRID_SEARCH, 20);
    private TierSettings bestEffort = TierSettings.defaults(Tier.BEST_EFFORT, 50);

    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Vector vector = new Vector();

    /**
     * Reciprocal-rank-fusion constant for merging lexical and semantic results.
     */
    private int rrfK = 60;
    private double semanticWeight = 0.6;
    private double keywordWeight = 0.4;

    public TierSettings settingsFor(Tier tier) {
        return switch (tier) {
            case DIRECT_LOOKUP -> directLookup;
            case CURATED_KB -> curatedKb;
            case HYBRID_SEARCH -> hybridSearch;
            case BEST_EFFORT -> bestEffort;
            case SAFETY_FALLBACK -> new TierSettings(0.0, 0L, 0);
        };
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public double getMinRelevance() {
        return minRelevance;
    }

    public void setMinRelevance(double minRelevance) {
        this.minRelevance = minRelevance;
    }

    public TierSettings getDirectLookup() {
        return directLookup;
    }

    public void setDirectLookup(TierSettings directLookup) {
        this.directLookup = directLookup;
    }

    public TierSettings getCuratedKb() {
        return curatedKb;
    }

    public void setCuratedKb(TierSettings curatedKb) {
        this.curatedKb = curatedKb;
    }

    public TierSettings getHybridSearch() {
        return hybridSearch;
    }

    public void setHybridSearch(TierSettings hybridSearch) {
        this.hybridSearch = hybridSearch;
    }

    public TierSettings getBestEffort() {
        return bestEffort;
    }

    public void setBestEffort(TierSettings bestEffort) {
        this.bestEffort = bestEffort;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public void setCircuitBreaker(CircuitBreaker circuitBreaker) {
        this.circuitBreaker = circuitBreaker;
    }

    public Vector getVector() {
        return vector;
    }

    public void setVector(Vector vector) {
        this.vector = vector;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public double getSemanticWeight() {
        return semanticWeight;
    }

    public void setSemanticWeight(double semanticWeight) {
        this.semanticWeight = semanticWeight;
    }

    public double getKeywordWeight() {
        return keywordWeight;
    }

    public void setKeywordWeight(double keywordWeight) {
        this.keywordWeight = keywordWeight;
    }

    public static class TierSettings {
        /**
         * Minimum candidate confidence for the tier's answer to be accepted.
         */
        private double threshold;
        private long timeoutMs;
        /**
         * Maximum records requested from the tier's store.
         */
        private int limit;

        public TierSettings() {
        }

        public TierSettings(double threshold, long timeoutMs, int limit) {
            this.threshold = threshold;
            this.timeoutMs = timeoutMs;
            this.limit = limit;
        }

        static TierSettings defaults(Tier tier, int limit) {
            return new TierSettings(tier.defaultThreshold(), tier.defaultTimeoutMs(), limit);
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }
    }

    public static class CircuitBreaker {
        private int failureThreshold = 5;
        private long openSeconds = 30L;

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public long getOpenSeconds() {
            return openSeconds;
        }

        public void setOpenSeconds(long openSeconds) {
            this.openSeconds = openSeconds;
        }
    }

    public static class Vector {
        private int topK = 10;
        private double similarityThreshold = 0.3;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getSimilarityThreshold() {
            return similarityThreshold;
        }

        public void setSimilarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
        }
    }
}
