package com.jreinhal.edbot;

import com.jreinhal.edbot.config.RetrievalProperties;
import com.jreinhal.edbot.model.Tier;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdBotApplication {
    private static final Logger log = LoggerFactory.getLogger(EdBotApplication.class);
    private final RetrievalProperties retrievalProperties;

    public EdBotApplication(RetrievalProperties retrievalProperties) {
        this.retrievalProperties = retrievalProperties;
    }

    public static void main(String[] args) {
        SpringApplication.run(EdBotApplication.class, args);
    }

    @PostConstruct
    public void validateRetrievalConfiguration() {
        long requestTimeout = this.retrievalProperties.getRequestTimeoutMs();
        if (requestTimeout <= 0L) {
            throw new IllegalStateException("edbot.retrieval.request-timeout-ms must be positive");
        }
        for (Tier tier : Tier.values()) {
            if (tier.isTerminal()) {
                continue;
            }
            RetrievalProperties.TierSettings settings = this.retrievalProperties.settingsFor(tier);
            if (settings.getThreshold() < 0.0 || settings.getThreshold() > 1.0) {
                throw new IllegalStateException("Acceptance threshold for " + tier + " must be within [0,1]");
            }
            if (settings.getTimeoutMs() > requestTimeout) {
                log.warn("Tier {} timeout {}ms exceeds the request deadline {}ms; the request deadline wins",
                        tier, settings.getTimeoutMs(), requestTimeout);
            }
        }
    }
}
