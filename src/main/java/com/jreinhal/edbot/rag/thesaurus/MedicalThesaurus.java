package com.jreinhal.edbot.rag.thesaurus;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.edbot.constant.StopWords;
import com.jreinhal.edbot.model.Category;
import com.jreinhal.edbot.util.ClinicalText;
import com.jreinhal.edbot.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

/**
 * Deterministic medical term expansion: bidirectional abbreviation lookup plus synonym sections
 * ordered by their relevance to the question's category.
 *
 * Expansion is closed under the dictionary, so re-expanding an expanded set adds nothing:
 * - every term is lowercased and trimmed
 * - a group whose member is present contributes all of its members
 * - passes repeat until no group adds a new term
 * Two-letter abbreviations (MI, PE, OR, ...) only match as whole terms or as uppercase tokens
 * in the raw question, never inside running lowercase text.
 */
@Service
public class MedicalThesaurus {
    private static final Logger log = LoggerFactory.getLogger(MedicalThesaurus.class);

    static final String ABBREVIATIONS = "abbreviations";
    private static final Pattern UPPERCASE_TOKEN = Pattern.compile("\\b[A-Za-z]*[A-Z][A-Za-z0-9]*\\b");
    private static final Set<String> AMBIGUOUS = Set.of("sob", "epi");

    private static final Map<Category, List<String>> SECTION_PRIORITY = new EnumMap<>(Map.of(
            Category.CONTACT, List.of("specialties", "query_type_contexts", ABBREVIATIONS),
            Category.FORM, List.of("query_type_contexts", "procedures", "clinical_conditions"),
            Category.PROTOCOL, List.of("procedures", "clinical_conditions", ABBREVIATIONS, "specialties"),
            Category.CRITERIA, List.of("clinical_conditions", ABBREVIATIONS, "units_measurements"),
            Category.DOSAGE, List.of("medications", "units_measurements", ABBREVIATIONS),
            Category.SUMMARY, List.of("clinical_conditions", "specialties", "procedures")));

    private static final Map<Category, List<String>> CONTEXT_TERMS = new EnumMap<>(Map.of(
            Category.CONTACT, List.of("call", "pager", "phone"),
            Category.FORM, List.of("document", "pdf"),
            Category.PROTOCOL, List.of("procedure", "guideline"),
            Category.CRITERIA, List.of("rules", "requirements"),
            Category.DOSAGE, List.of("dose", "amount"),
            Category.SUMMARY, List.of("overview", "management")));

    private final MedicalThesaurusProperties props;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    private Map<String, List<TermGroup>> groupsBySection = Map.of();
    private Map<String, Set<String>> relatedIndex = Map.of();
    private Set<String> abbreviationKeys = Set.of();

    public MedicalThesaurus(MedicalThesaurusProperties props, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void init() {
        this.rebuildIndex();
    }

    public boolean isEnabled() {
        return this.props != null && this.props.isEnabled();
    }

    /**
     * Expands a question into its term set: the normalized question, its keywords, abbreviation
     * expansions, category-prioritised synonyms and the category's context words.
     */
    public Set<String> expand(String text, Category category) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        LinkedHashSet<String> seed = new LinkedHashSet<>();
        String normalized = ClinicalText.normalizeQuery(text);
        if (!normalized.isEmpty()) {
            seed.add(normalized);
        }
        seed.addAll(ClinicalText.significantTokens(normalized, StopWords.QUERY_KEYWORDS, 3));
        seed.addAll(this.abbreviationsIn(text));
        Set<String> expanded = this.expandTerms(seed, category);
        if (log.isDebugEnabled()) {
            log.debug("MedicalThesaurus: {} term(s) for query {} (category={})", expanded.size(), LogSanitizer.querySummary(text), category);
        }
        return expanded;
    }

    /**
     * Closes an existing term set under the dictionary. Applying it to its own output returns an equal set.
     */
    public Set<String> expandTerms(Collection<String> terms, Category category) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (terms != null) {
            for (String term : terms) {
                String t = normalizeTerm(term);
                if (!t.isEmpty()) {
                    out.add(t);
                }
            }
        }
        if (out.isEmpty()) {
            return Collections.unmodifiableSet(out);
        }
        Category effective = category == null ? Category.SUMMARY : category;
        out.addAll(CONTEXT_TERMS.getOrDefault(effective, List.of()));
        if (!isEnabled()) {
            return Collections.unmodifiableSet(out);
        }
        List<TermGroup> ordered = this.groupsInPriority(effective);
        int passes = 0;
        boolean changed = true;
        while (changed && passes < Math.max(1, this.props.getMaxPasses())) {
            changed = false;
            passes++;
            for (TermGroup group : ordered) {
                if (group.presentIn(out)) {
                    for (String member : group.members()) {
                        changed |= out.add(member);
                    }
                }
            }
        }
        if (changed) {
            log.warn("MedicalThesaurus: expansion did not converge after {} passes", passes);
        }
        return Collections.unmodifiableSet(out);
    }

    /**
     * Fixed context words added for a category.
     */
    public List<String> contextTermsFor(Category category) {
        return CONTEXT_TERMS.getOrDefault(category == null ? Category.SUMMARY : category, List.of());
    }

    /**
     * Direct dictionary neighbours of a term (its abbreviation, full forms or synonyms), excluding itself.
     */
    public Set<String> relatedTerms(String term) {
        return this.relatedIndex.getOrDefault(normalizeTerm(term), Set.of());
    }

    /**
     * Dictionary terms that occur in the given text.
     */
    public Set<String> knownTermsIn(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> tokens = new LinkedHashSet<>(ClinicalText.tokens(lower));
        LinkedHashSet<String> found = new LinkedHashSet<>();
        for (String term : this.relatedIndex.keySet()) {
            if (isLooseMatchable(term) ? ClinicalText.containsPhrase(lower, term) : tokens.contains(term)) {
                found.add(term);
            }
        }
        return found;
    }

    public boolean isAbbreviation(String token) {
        return token != null && this.abbreviationKeys.contains(normalizeTerm(token));
    }

    /**
     * Lowercased abbreviation keys written in uppercase in the raw text, e.g. "DKA" or "SpO2".
     */
    Set<String> abbreviationsIn(String rawText) {
        LinkedHashSet<String> found = new LinkedHashSet<>();
        Matcher m = UPPERCASE_TOKEN.matcher(rawText);
        while (m.find()) {
            String token = m.group();
            long upper = token.chars().filter(Character::isUpperCase).count();
            if (upper < 2) {
                continue;
            }
            String key = token.toLowerCase(Locale.ROOT);
            if (this.abbreviationKeys.contains(key)) {
                found.add(key);
            }
        }
        return found;
    }

    private List<TermGroup> groupsInPriority(Category category) {
        List<String> priority = SECTION_PRIORITY.getOrDefault(category, List.of());
        ArrayList<TermGroup> ordered = new ArrayList<>();
        for (String section : priority) {
            ordered.addAll(this.groupsBySection.getOrDefault(section, List.of()));
        }
        if (!priority.contains(ABBREVIATIONS)) {
            ordered.addAll(this.groupsBySection.getOrDefault(ABBREVIATIONS, List.of()));
        }
        for (Map.Entry<String, List<TermGroup>> e : this.groupsBySection.entrySet()) {
            if (!priority.contains(e.getKey()) && !ABBREVIATIONS.equals(e.getKey())) {
                ordered.addAll(e.getValue());
            }
        }
        return ordered;
    }

    private void rebuildIndex() {
        LinkedHashMap<String, List<TermGroup>> sections = new LinkedHashMap<>();

        Map<String, List<String>> abbreviations = new LinkedHashMap<>(this.readAbbreviations());
        if (this.props.getExtraAbbreviations() != null) {
            abbreviations.putAll(this.props.getExtraAbbreviations());
        }
        ArrayList<TermGroup> abbreviationGroups = new ArrayList<>();
        LinkedHashSet<String> keys = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> e : abbreviations.entrySet()) {
            TermGroup group = TermGroup.of(ABBREVIATIONS, e.getKey(), e.getValue());
            if (group != null) {
                abbreviationGroups.add(group);
                keys.add(group.key());
            }
        }
        sections.put(ABBREVIATIONS, Collections.unmodifiableList(abbreviationGroups));

        for (Map.Entry<String, Map<String, List<String>>> section : this.readSynonyms().entrySet()) {
            if (section.getKey() == null || section.getValue() == null || ABBREVIATIONS.equals(section.getKey())) {
                continue;
            }
            ArrayList<TermGroup> groups = new ArrayList<>();
            for (Map.Entry<String, List<String>> e : section.getValue().entrySet()) {
                TermGroup group = TermGroup.of(section.getKey(), e.getKey(), e.getValue());
                if (group != null) {
                    groups.add(group);
                }
            }
            sections.put(section.getKey(), Collections.unmodifiableList(groups));
        }

        HashMap<String, Set<String>> related = new HashMap<>();
        for (List<TermGroup> groups : sections.values()) {
            for (TermGroup group : groups) {
                for (String member : group.members()) {
                    Set<String> neighbours = related.computeIfAbsent(member, k -> new LinkedHashSet<>());
                    for (String other : group.members()) {
                        if (!other.equals(member)) {
                            neighbours.add(other);
                        }
                    }
                }
            }
        }
        HashMap<String, Set<String>> frozen = new HashMap<>();
        related.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));

        this.groupsBySection = Collections.unmodifiableMap(sections);
        this.relatedIndex = Collections.unmodifiableMap(frozen);
        this.abbreviationKeys = Collections.unmodifiableSet(keys);
        log.info("MedicalThesaurus loaded {} abbreviation(s) and {} synonym section(s)", keys.size(), sections.size() - 1);
    }

    private Map<String, List<String>> readAbbreviations() {
        Map<String, List<String>> loaded = this.readJson(this.props.getAbbreviationsResource(), new TypeReference<Map<String, List<String>>>() {});
        return loaded != null ? loaded : Map.of();
    }

    private Map<String, Map<String, List<String>>> readSynonyms() {
        Map<String, Map<String, List<String>>> loaded = this.readJson(this.props.getSynonymsResource(), new TypeReference<Map<String, Map<String, List<String>>>>() {});
        return loaded != null ? loaded : Map.of();
    }

    private <T> T readJson(String location, TypeReference<T> type) {
        if (location == null || location.isBlank()) {
            return null;
        }
        Resource resource = this.resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("MedicalThesaurus: lexicon resource {} not found; continuing without it", location);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return this.objectMapper.readValue(in, type);
        } catch (IOException e) {
            log.error("MedicalThesaurus: failed to read lexicon {}: {}", location, e.getMessage());
            return null;
        }
    }

    static String normalizeTerm(String term) {
        if (term == null) {
            return "";
        }
        return term.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    static boolean isLooseMatchable(String member) {
        return member.length() > 2 && !AMBIGUOUS.contains(member);
    }

    record TermGroup(String section, String key, List<String> members) {
        static TermGroup of(String section, String key, List<String> expansions) {
            String k = normalizeTerm(key);
            if (k.isEmpty() || expansions == null) {
                return null;
            }
            LinkedHashSet<String> members = new LinkedHashSet<>();
            members.add(k);
            expansions.stream()
                    .filter(Objects::nonNull)
                    .map(MedicalThesaurus::normalizeTerm)
                    .filter(s -> !s.isEmpty())
                    .forEach(members::add);
            if (members.size() < 2) {
                return null;
            }
            return new TermGroup(section, k, List.copyOf(members));
        }

        boolean presentIn(Set<String> terms) {
            for (String member : this.members) {
                if (terms.contains(member)) {
                    return true;
                }
            }
            for (String member : this.members) {
                if (!isLooseMatchable(member)) {
                    continue;
                }
                for (String term : terms) {
                    if (term.length() > member.length() && ClinicalText.containsPhrase(term, member)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
