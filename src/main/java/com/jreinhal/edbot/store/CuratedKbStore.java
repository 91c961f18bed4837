package com.jreinhal.edbot.store;

import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.KnowledgeRecord;
import java.util.List;
import java.util.Set;
import org.springframework.lang.Nullable;

/**
 * Hand-authored question/answer records. Each returned record's text is the curated answer and its
 * store score is the match strength against the question.
 */
public interface CuratedKbStore {

    List<KnowledgeRecord> lookup(Set<String> expandedTerms, @Nullable Category category);
}
