package com.jreinhal.edbot.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edbot.curated")
public class CuratedKbProperties {
    /**
     * JSON array of curated question/answer entries.
     */
    private String resource = "classpath:curated/curated-qa.json";

    private int maxResults = 5;

    /**
     * Entries matching the question below this score are not returned.
     */
    private double minScore = 0.3;

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public double getMinScore() {
        return minScore;
    }

    public void setMinScore(double minScore) {
        this.minScore = minScore;
    }
}
