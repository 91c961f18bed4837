package com.jreinhal.edbot.rag.cache;

import com.jreinhal.edbot.config.ResponseCacheProperties;
import com.jreinhal.edbot.model.Answer;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.Tier;
import com.jreinhal.edbot.model.ValidationSummary;
import com.jreinhal.edbot.model.Verdict;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCachePolicyTest {

    private final ResponseCacheProperties props = new ResponseCacheProperties();
    private final ResponseCachePolicy policy = new ResponseCachePolicy(props);

    @Test
    void keyCombinesCategoryAndNormalizedQuestion() {
        assertEquals("protocol|what is the stemi protocol", ResponseCachePolicy.key("what is the stemi protocol", Category.PROTOCOL));
        assertEquals("none|", ResponseCachePolicy.key(null, null));
        assertNotEquals(ResponseCachePolicy.key("sepsis", Category.PROTOCOL), ResponseCachePolicy.key("sepsis", Category.CRITERIA));
    }

    @Test
    void formAndContactAreNeverCached() {
        assertFalse(policy.isLookupAllowed(Category.FORM));
        assertFalse(policy.isLookupAllowed(Category.CONTACT));
        assertFalse(policy.shouldStore(answer(Category.FORM, 0.95, Tier.DIRECT_LOOKUP)));
        assertTrue(policy.isLookupAllowed(Category.PROTOCOL));
    }

    @Test
    void onlyConfidentNonFallbackAnswersAreStored() {
        assertTrue(policy.shouldStore(answer(Category.PROTOCOL, 0.85, Tier.CURATED_KB)));
        assertFalse(policy.shouldStore(answer(Category.PROTOCOL, 0.5, Tier.CURATED_KB)));
        assertFalse(policy.shouldStore(answer(Category.PROTOCOL, 0.0, Tier.SAFETY_FALLBACK)));
        assertFalse(policy.shouldStore(answer(Category.PROTOCOL, 0.85, Tier.CURATED_KB).asCached()));
        assertFalse(policy.shouldStore(null));
    }

    @Test
    void disabledCacheAllowsNothing() {
        props.setEnabled(false);

        assertFalse(policy.isLookupAllowed(Category.PROTOCOL));
        assertFalse(policy.shouldStore(answer(Category.PROTOCOL, 0.95, Tier.CURATED_KB)));
    }

    @Test
    void ttlComesFromCategoryOrDefault() {
        assertEquals(Duration.ofHours(1), policy.ttlFor(Category.PROTOCOL));
        assertEquals(Duration.ofMinutes(5), policy.ttlFor(Category.SUMMARY));
        assertEquals(Duration.ofSeconds(600), policy.ttlFor(null));

        props.setTtlSeconds(Map.of(Category.PROTOCOL, 0L));
        assertEquals(Duration.ofSeconds(1), policy.ttlFor(Category.PROTOCOL));
    }

    private static Answer answer(Category category, double confidence, Tier tier) {
        return new Answer("text", category, confidence, null, tier.index(), List.of(),
                new ValidationSummary(Verdict.VALID, List.of()), List.of("Source"), false);
    }
}
