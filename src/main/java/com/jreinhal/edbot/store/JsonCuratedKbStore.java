package com.jreinhal.edbot.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.TrustTier;
import com.jreinhal.edbot.util.ClinicalText;
import com.jreinhal.edbot.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Curated Q&A records bundled as a classpath JSON array.
 *
 * <p>An entry's match score against the expanded question is
 * {@code 0.4 * keywordScore + 0.6 * questionCoverage}, plus 0.2 when at least two question words
 * are shared, capped at 1. A keyword counts when any of its words occurs among the question words.</p>
 */
@Component
public class JsonCuratedKbStore implements CuratedKbStore {
    private static final Logger log = LoggerFactory.getLogger(JsonCuratedKbStore.class);

    private final CuratedKbProperties props;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private volatile List<CuratedEntry> entries = List.of();

    public JsonCuratedKbStore(CuratedKbProperties props, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void init() {
        this.entries = this.load();
        log.info("Curated KB loaded {} entr{}", this.entries.size(), this.entries.size() == 1 ? "y" : "ies");
    }

    public int size() {
        return this.entries.size();
    }

    @Override
    public List<KnowledgeRecord> lookup(Set<String> expandedTerms, @Nullable Category category) {
        if (expandedTerms == null || expandedTerms.isEmpty()) {
            return List.of();
        }
        Set<String> questionWords = new HashSet<>();
        for (String term : expandedTerms) {
            questionWords.addAll(ClinicalText.tokens(term));
        }
        List<KnowledgeRecord> matches = new ArrayList<>();
        for (CuratedEntry entry : this.entries) {
            Category entryCategory = Category.fromString(entry.category());
            if (category != null && entryCategory != category) {
                continue;
            }
            double score = matchScore(entry, questionWords);
            if (score >= this.props.getMinScore()) {
                matches.add(toRecord(entry, entryCategory, score));
            }
        }
        matches.sort(Comparator.comparingDouble(KnowledgeRecord::storeScore).reversed());
        int max = Math.max(1, this.props.getMaxResults());
        return matches.size() > max ? new ArrayList<>(matches.subList(0, max)) : matches;
    }

    static double matchScore(CuratedEntry entry, Set<String> questionWords) {
        List<String> keywords = entry.keywords() == null ? List.of() : entry.keywords();
        int keywordMatches = 0;
        for (String keyword : keywords) {
            if (ClinicalText.tokens(keyword).stream().anyMatch(questionWords::contains)) {
                keywordMatches++;
            }
        }
        double keywordScore = keywords.isEmpty() ? 0.0 : (double) keywordMatches / keywords.size();

        Set<String> curatedWords = new HashSet<>(ClinicalText.tokens(entry.question()));
        long common = curatedWords.stream().filter(questionWords::contains).count();
        double coverage = curatedWords.isEmpty() ? 0.0 : (double) common / curatedWords.size();
        double phraseBoost = common >= 2 ? 0.2 : 0.0;
        return Math.min(1.0, keywordScore * 0.4 + coverage * 0.6 + phraseBoost);
    }

    private static KnowledgeRecord toRecord(CuratedEntry entry, Category category, double score) {
        String documentId = entry.sourceDocument() != null ? entry.sourceDocument() : entry.id();
        return KnowledgeRecord.builder(entry.id())
                .documentId(documentId)
                .displayName(entry.displayName() != null ? entry.displayName() : documentId)
                .text(entry.answer())
                .page(entry.page())
                .trustTier(TrustTier.CURATED_QA)
                .category(category)
                .storeScore(score)
                .metadata("content_type", "curated")
                .metadata("question", entry.question())
                .build();
    }

    private List<CuratedEntry> load() {
        String location = this.props.getResource();
        if (location == null || location.isBlank()) {
            return List.of();
        }
        Resource resource = this.resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Curated KB resource {} not found; continuing without curated answers", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<CuratedEntry> loaded = this.objectMapper.readValue(in, new TypeReference<List<CuratedEntry>>() {});
            if (loaded == null) {
                return List.of();
            }
            List<CuratedEntry> valid = new ArrayList<>();
            for (CuratedEntry entry : loaded) {
                if (entry != null && entry.id() != null && entry.question() != null && entry.answer() != null) {
                    valid.add(entry);
                } else {
                    log.warn("Skipping incomplete curated entry {}", entry == null ? "null" : LogSanitizer.sanitize(entry.id()));
                }
            }
            return List.copyOf(valid);
        } catch (IOException e) {
            log.error("Failed to read curated KB {}: {}", location, e.getMessage());
            return List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CuratedEntry(
            String id,
            String question,
            String answer,
            List<String> keywords,
            String category,
            @JsonProperty("source_document") String sourceDocument,
            @JsonProperty("display_name") String displayName,
            Integer page) {
    }
}
