package com.jreinhal.edbot.store;

import com.jreinhal.edbot.config.ResponseCacheProperties;
import com.jreinhal.edbot.model.Answer;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.ValidationSummary;
import com.jreinhal.edbot.model.Verdict;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineResponseCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final CaffeineResponseCache cache = new CaffeineResponseCache(new ResponseCacheProperties(), nanos::get);

    @Test
    void storedAnswerIsReturnedUntilItsTtlElapses() {
        Answer answer = answer("Call the STEMI pager.");
        cache.set("protocol|stemi", answer, Duration.ofSeconds(60));

        assertEquals(answer, cache.get("protocol|stemi").orElseThrow());

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(59));
        assertTrue(cache.get("protocol|stemi").isPresent());

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(2));
        assertTrue(cache.get("protocol|stemi").isEmpty());
    }

    @Test
    void eachEntryKeepsItsOwnTtl() {
        cache.set("short", answer("a"), Duration.ofSeconds(10));
        cache.set("long", answer("b"), Duration.ofSeconds(100));

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(30));

        assertTrue(cache.get("short").isEmpty());
        assertTrue(cache.get("long").isPresent());
    }

    @Test
    void laterWriteReplacesEarlierValue() {
        cache.set("k", answer("first"), Duration.ofSeconds(60));
        cache.set("k", answer("second"), Duration.ofSeconds(60));

        assertEquals("second", cache.get("k").orElseThrow().text());
        assertEquals(1, cache.estimatedSize());
    }

    @Test
    void invalidWritesAreIgnored() {
        cache.set("k", answer("a"), Duration.ZERO);
        cache.set("k", null, Duration.ofSeconds(5));
        cache.set(null, answer("a"), Duration.ofSeconds(5));

        assertTrue(cache.get("k").isEmpty());
        assertTrue(cache.get(null).isEmpty());
    }

    private static Answer answer(String text) {
        return new Answer(text, Category.PROTOCOL, 0.9, null, 1, List.of(),
                new ValidationSummary(Verdict.VALID, List.of()), List.of(), false);
    }
}
