package com.jreinhal.edbot.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.lang.Nullable;

/**
 * A unit of retrievable content from one of the knowledge stores.
 *
 * <p>{@code storeScore} is the store's own match score in [0,1] when it reports
 * one (curated lookups, vector similarity), otherwise 0.</p>
 */
public record KnowledgeRecord(
        String id,
        String documentId,
        String displayName,
        String text,
        @Nullable Integer page,
        List<SpanBox> spanIndex,
        TrustTier trustTier,
        @Nullable Category category,
        double storeScore,
        Map<String, Object> metadata) {

    public KnowledgeRecord {
        Objects.requireNonNull(id, "id");
        documentId = documentId == null ? id : documentId;
        displayName = displayName == null ? documentId : displayName;
        text = text == null ? "" : text;
        spanIndex = spanIndex == null ? List.of() : List.copyOf(spanIndex);
        trustTier = trustTier == null ? TrustTier.GENERIC_CHUNK : trustTier;
        storeScore = Math.max(0.0, Math.min(1.0, storeScore));
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public String contentType() {
        Object type = metadata.get("content_type");
        return type != null ? type.toString() : "";
    }

    public KnowledgeRecord withStoreScore(double score) {
        return new KnowledgeRecord(id, documentId, displayName, text, page, spanIndex, trustTier, category, score, metadata);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String documentId;
        private String displayName;
        private String text;
        private Integer page;
        private final List<SpanBox> spanIndex = new ArrayList<>();
        private TrustTier trustTier = TrustTier.GENERIC_CHUNK;
        private Category category;
        private double storeScore;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder page(Integer page) {
            this.page = page;
            return this;
        }

        public Builder span(SpanBox span) {
            this.spanIndex.add(span);
            return this;
        }

        public Builder trustTier(TrustTier trustTier) {
            this.trustTier = trustTier;
            return this;
        }

        public Builder category(Category category) {
            this.category = category;
            return this;
        }

        public Builder storeScore(double storeScore) {
            this.storeScore = storeScore;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key != null && value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public KnowledgeRecord build() {
            return new KnowledgeRecord(id, documentId, displayName, text, page, spanIndex, trustTier, category, storeScore, metadata);
        }
    }
}
