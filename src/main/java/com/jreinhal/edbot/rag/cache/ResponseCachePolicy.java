package com.jreinhal.edbot.rag.cache;

import com.jreinhal.edbot.config.ResponseCacheProperties;
import com.jreinhal.edbot.model.Answer;
import com.jreinhal.edbot.model.Category;
import java.time.Duration;
import org.springframework.stereotype.Component;

/**
 * Decides what may be read from and written to the response cache, and for how long.
 */
@Component
public class ResponseCachePolicy {
    private final ResponseCacheProperties props;

    public ResponseCachePolicy(ResponseCacheProperties props) {
        this.props = props;
    }

    /**
     * Key over the normalized question and its category.
     */
    public static String key(String normalizedQuery, Category category) {
        return (category == null ? "none" : category.label()) + "|" + (normalizedQuery == null ? "" : normalizedQuery);
    }

    public boolean isLookupAllowed(Category category) {
        return this.props.isEnabled() && category != null && !this.props.getNeverCache().contains(category);
    }

    public boolean shouldStore(Answer answer) {
        if (answer == null || !this.isLookupAllowed(answer.category())) {
            return false;
        }
        if (answer.isSafetyFallback() || answer.cached()) {
            return false;
        }
        return answer.confidence() >= this.props.getMinConfidence();
    }

    public Duration ttlFor(Category category) {
        Long seconds = category == null ? null : this.props.getTtlSeconds().get(category);
        long ttl = seconds != null ? seconds : this.props.getDefaultTtlSeconds();
        return Duration.ofSeconds(Math.max(1L, ttl));
    }
}
