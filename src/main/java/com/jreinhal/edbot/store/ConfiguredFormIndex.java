package com.jreinhal.edbot.store;

import com.jreinhal.edbot.model.DocumentRef;
import com.jreinhal.edbot.util.ClinicalText;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Form index backed by the keyword-to-filename table in {@code edbot.forms.mappings}.
 */
@Component
public class ConfiguredFormIndex implements FormIndex {
    private static final Logger log = LoggerFactory.getLogger(ConfiguredFormIndex.class);

    private final FormIndexProperties props;
    private Map<String, List<String>> mappings = Map.of();

    public ConfiguredFormIndex(FormIndexProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void init() {
        Map<String, List<String>> normalized = new LinkedHashMap<>();
        this.props.getMappings().forEach((keyword, files) -> {
            String key = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
            if (!key.isEmpty() && files != null && !files.isEmpty()) {
                normalized.computeIfAbsent(key, k -> new ArrayList<>()).addAll(files);
            }
        });
        this.mappings = normalized;
        log.info("Form index loaded {} keyword mapping(s)", normalized.size());
    }

    /**
     * Every (file, keyword) pair whose keyword occurs as a phrase in one of the given keywords.
     */
    @Override
    public List<DocumentRef> resolve(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return List.of();
        }
        List<String> lowered = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        List<DocumentRef> refs = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> entry : this.mappings.entrySet()) {
            String key = entry.getKey();
            if (lowered.stream().noneMatch(k -> ClinicalText.containsPhrase(k, key))) {
                continue;
            }
            for (String file : entry.getValue()) {
                if (seen.add(file + "|" + key)) {
                    refs.add(new DocumentRef(file, this.displayName(file), key));
                }
            }
        }
        return refs;
    }

    String displayName(String filename) {
        String configured = this.props.getDisplayNames().get(filename);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return titleFromFilename(filename);
    }

    static String titleFromFilename(String filename) {
        String base = filename.replaceAll("(?i)\\.pdf$", "").replace('_', ' ').replaceAll("\\s+", " ").trim();
        StringBuilder sb = new StringBuilder(base.length());
        for (String word : base.split(" ")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }
}
