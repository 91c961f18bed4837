package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.TrustTier;
import java.util.Map;
import org.springframework.ai.document.Document;

/**
 * Converts Spring AI documents into knowledge records.
 *
 * <p>Metadata keys: {@code document_id}, {@code source}, {@code page_number}, {@code category},
 * {@code trust_tier}. Other entries are carried through unchanged.</p>
 */
final class VectorRecordMapper {
    static final String DOCUMENT_ID = "document_id";
    static final String SOURCE = "source";
    static final String PAGE_NUMBER = "page_number";
    static final String CATEGORY = "category";
    static final String TRUST_TIER = "trust_tier";

    private VectorRecordMapper() {
    }

    static KnowledgeRecord toRecord(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        String source = asString(metadata.get(SOURCE));
        String documentId = asString(metadata.get(DOCUMENT_ID));
        if (documentId == null) {
            documentId = source != null ? source : document.getId();
        }
        Double score = document.getScore();
        KnowledgeRecord.Builder builder = KnowledgeRecord.builder(document.getId())
                .documentId(documentId)
                .displayName(source != null ? source : documentId)
                .text(document.getText())
                .page(asPage(metadata.get(PAGE_NUMBER)))
                .trustTier(TrustTier.fromString(asString(metadata.get(TRUST_TIER)), TrustTier.GENERIC_CHUNK))
                .category(Category.fromString(asString(metadata.get(CATEGORY))))
                .storeScore(score != null ? score : 0.0);
        metadata.forEach(builder::metadata);
        builder.metadata("retrieval", "semantic");
        return builder.build();
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static Integer asPage(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        String s = asString(value);
        if (s == null) {
            return null;
        }
        try {
            return Integer.valueOf(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
