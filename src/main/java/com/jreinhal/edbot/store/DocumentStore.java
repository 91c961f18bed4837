package com.jreinhal.edbot.store;

import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.KnowledgeRecord;
import java.util.List;
import java.util.Set;
import org.springframework.lang.Nullable;

/**
 * Lexical/full-text search over general document chunks. Implementations are read-only and may
 * throw unchecked exceptions when the backing store is unavailable.
 */
public interface DocumentStore {

    /**
     * @param terms expanded search terms
     * @param category restrict to chunks tagged with this category, or search everything when null
     * @param limit maximum records to return
     */
    List<KnowledgeRecord> searchChunks(Set<String> terms, @Nullable Category category, int limit);
}
