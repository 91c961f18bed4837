package com.jreinhal.edbot.store;

import com.jreinhal.edbot.model.Answer;
import java.time.Duration;
import java.util.Optional;

/**
 * Shared answer cache. Implementations must not block callers and keep at most one value per key.
 */
public interface ResponseCache {

    Optional<Answer> get(String key);

    void set(String key, Answer answer, Duration ttl);
}
