package com.jreinhal.edbot.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.jreinhal.edbot.config.ResponseCacheProperties;
import com.jreinhal.edbot.model.Answer;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-process response cache with a per-entry time to live.
 */
@Component
public class CaffeineResponseCache implements ResponseCache {
    private final Cache<String, Entry> cache;

    @Autowired
    public CaffeineResponseCache(ResponseCacheProperties props) {
        this(props, Ticker.systemTicker());
    }

    CaffeineResponseCache(ResponseCacheProperties props, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, props.getMaximumSize()))
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    @Override
    public Optional<Answer> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        Entry entry = this.cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.answer());
    }

    @Override
    public void set(String key, Answer answer, Duration ttl) {
        if (key == null || answer == null || ttl == null || ttl.isZero() || ttl.isNegative()) {
            return;
        }
        this.cache.put(key, new Entry(answer, ttl));
    }

    long estimatedSize() {
        this.cache.cleanUp();
        return this.cache.estimatedSize();
    }

    private record Entry(Answer answer, Duration ttl) {
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
