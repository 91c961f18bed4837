package com.jreinhal.edbot.rag.evidence;

import com.jreinhal.edbot.config.EvidenceProperties;
import com.jreinhal.edbot.model.BBox;
import com.jreinhal.edbot.model.EvidenceSpan;
import com.jreinhal.edbot.model.KnowledgeRecord;
import com.jreinhal.edbot.model.OffsetRange;
import com.jreinhal.edbot.model.SpanBox;
import com.jreinhal.edbot.store.SpanIndex;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Maps an answer back to the character ranges of its source records that contain it, for citation
 * highlighting.
 *
 * <p>Long word n-grams of the normalized answer are searched in the normalized source, longest first
 * at every window position. Matches are mapped to original offsets, merged when they overlap or sit
 * within {@code mergeGap} characters, and resolved to page and bounding box through the record's own
 * span index or the external {@link SpanIndex}. No match means no evidence, never an error.</p>
 */
@Component
public class EvidenceMapper {
    private static final Logger log = LoggerFactory.getLogger(EvidenceMapper.class);

    private final EvidenceProperties props;
    @Nullable
    private final SpanIndex spanIndex;

    public EvidenceMapper(EvidenceProperties props, @Nullable SpanIndex spanIndex) {
        this.props = props;
        this.spanIndex = spanIndex;
    }

    public List<EvidenceSpan> map(String answerText, List<KnowledgeRecord> sources) {
        if (!this.props.isEnabled() || answerText == null || answerText.isBlank() || sources == null) {
            return List.of();
        }
        List<EvidenceSpan> out = new ArrayList<>();
        for (KnowledgeRecord record : sources) {
            if (record == null || record.text().isBlank()) {
                continue;
            }
            try {
                out.addAll(this.mapRecord(answerText, record));
            } catch (RuntimeException e) {
                log.warn("Evidence mapping failed for document {}: {}", record.documentId(), e.getMessage());
            }
        }
        return out;
    }

    List<EvidenceSpan> mapRecord(String answerText, KnowledgeRecord record) {
        NormalizedText answer = NormalizedText.of(answerText);
        NormalizedText source = NormalizedText.of(record.text());
        if (answer.normalizedLength() == 0 || source.normalizedLength() == 0) {
            return List.of();
        }

        List<SpanMatch> raw = new ArrayList<>();
        String[] tokens = answer.normalized().split(" ");
        int maxN = Math.max(1, this.props.getMaxNgram());
        int minN = Math.max(1, Math.min(this.props.getMinNgram(), maxN));
        for (int i = 0; i + minN <= tokens.length; i++) {
            for (int n = Math.min(maxN, tokens.length - i); n >= minN; n--) {
                String ngram = String.join(" ", Arrays.asList(tokens).subList(i, i + n));
                if (ngram.length() < this.props.getMinMatchChars()) {
                    continue;
                }
                int pos = findAtWordBoundary(source.normalized(), ngram);
                if (pos < 0) {
                    continue;
                }
                OffsetRange original = this.toOriginal(source, pos, pos + ngram.length(), ngram);
                if (original != null) {
                    raw.add(new SpanMatch(original, 1));
                }
                break;
            }
        }
        if (raw.isEmpty()) {
            return List.of();
        }

        List<SpanMatch> merged = mergeSpans(raw, this.props.getMergeGap());
        List<EvidenceSpan> spans = new ArrayList<>(merged.size());
        double answerLength = Math.max(1, answerText.length());
        for (SpanMatch match : merged) {
            double coverage = match.range().length() / answerLength;
            double confidence = Math.min(1.0, coverage + Math.min(0.3, match.count() * 0.1));
            Placement placement = this.resolvePlacement(record, match.range());
            spans.add(new EvidenceSpan(record.documentId(), placement.page(), match.range().start(), match.range().end(),
                    placement.bbox(), confidence));
        }
        if (log.isDebugEnabled()) {
            log.debug("Evidence for {}: {} raw match(es) merged into {} span(s)", record.documentId(), raw.size(), spans.size());
        }
        return spans;
    }

    /**
     * Maps a normalized range back to original offsets. The offset map is exact; the re-scan and the
     * proportional estimate only apply if the mapped text does not reproduce the target.
     */
    OffsetRange toOriginal(NormalizedText source, int normStart, int normEnd, String target) {
        int start = source.sourceIndexOf(normStart);
        int end = source.sourceIndexOf(normEnd - 1) + 1;
        if (start < end && NormalizedText.normalize(source.original().substring(start, end)).equals(target)) {
            return new OffsetRange(start, end);
        }
        int estimate = proportional(normStart, source.normalizedLength(), source.originalLength());
        int window = Math.max(0, this.props.getRescanWindow());
        for (int delta = 0; delta <= window; delta++) {
            for (int candidate : new int[]{estimate - delta, estimate + delta}) {
                int length = source.matchLengthAt(candidate, target);
                if (length > 0) {
                    return new OffsetRange(candidate, candidate + length);
                }
            }
        }
        int s = Math.min(estimate, source.originalLength() - 1);
        int e = Math.min(source.originalLength(), Math.max(s + 1,
                proportional(normEnd, source.normalizedLength(), source.originalLength())));
        return s >= 0 && s < e ? new OffsetRange(s, e) : null;
    }

    static int proportional(int normalizedOffset, int normalizedLength, int originalLength) {
        if (normalizedLength <= 0) {
            return 0;
        }
        long scaled = Math.round((double) normalizedOffset * originalLength / normalizedLength);
        return (int) Math.max(0, Math.min(originalLength, scaled));
    }

    /**
     * Sorts and merges ranges that overlap or are separated by at most {@code gap} characters.
     */
    static List<SpanMatch> mergeSpans(List<SpanMatch> spans, int gap) {
        List<SpanMatch> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt((SpanMatch m) -> m.range().start()).thenComparingInt(m -> m.range().end()));
        List<SpanMatch> merged = new ArrayList<>();
        SpanMatch current = null;
        for (SpanMatch next : sorted) {
            if (current == null) {
                current = next;
            } else if (next.range().start() <= current.range().end() + gap) {
                int end = Math.max(current.range().end(), next.range().end());
                current = new SpanMatch(new OffsetRange(current.range().start(), end), current.count() + next.count());
            } else {
                merged.add(current);
                current = next;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    private Placement resolvePlacement(KnowledgeRecord record, OffsetRange range) {
        Integer page = record.page();
        BBox bbox = null;
        SpanBox best = null;
        int bestOverlap = 0;
        for (SpanBox box : record.spanIndex()) {
            int overlap = box.range().overlap(range);
            if (overlap > bestOverlap) {
                best = box;
                bestOverlap = overlap;
            }
        }
        if (best != null) {
            page = best.page() != null ? best.page() : page;
            for (SpanBox box : record.spanIndex()) {
                if (box.bbox() != null && box.range().overlap(range) > 0 && Objects.equals(box.page(), best.page())) {
                    bbox = bbox == null ? box.bbox() : bbox.union(box.bbox());
                }
            }
        }
        if (bbox == null && this.spanIndex != null) {
            try {
                bbox = this.spanIndex.bboxFor(record.documentId(), page, range);
            } catch (RuntimeException e) {
                if (log.isDebugEnabled()) {
                    log.debug("Span index lookup failed for {}: {}", record.documentId(), e.getMessage());
                }
            }
        }
        return new Placement(page, bbox);
    }

    private static int findAtWordBoundary(String haystack, String needle) {
        int first = -1;
        int from = 0;
        while (true) {
            int idx = haystack.indexOf(needle, from);
            if (idx < 0) {
                return first;
            }
            if (first < 0) {
                first = idx;
            }
            boolean startOk = idx == 0 || haystack.charAt(idx - 1) == ' ';
            boolean endOk = idx + needle.length() == haystack.length() || haystack.charAt(idx + needle.length()) == ' ';
            if (startOk && endOk) {
                return idx;
            }
            from = idx + 1;
        }
    }

    record SpanMatch(OffsetRange range, int count) {
    }

    private record Placement(@Nullable Integer page, @Nullable BBox bbox) {
    }
}
