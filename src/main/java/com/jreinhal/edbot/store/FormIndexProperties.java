package com.jreinhal.edbot.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edbot.forms")
public class FormIndexProperties {
    /**
     * Keyword phrase to form filenames, most specific first. Keys containing spaces must be written
     * in bracket notation in YAML, e.g. {@code "[blood transfusion]"}.
     */
    private Map<String, List<String>> mappings = new LinkedHashMap<>();

    /**
     * Friendly titles by filename. Unlisted files get a title derived from the filename.
     */
    private Map<String, String> displayNames = new LinkedHashMap<>();

    public Map<String, List<String>> getMappings() {
        return mappings;
    }

    public void setMappings(Map<String, List<String>> mappings) {
        this.mappings = mappings;
    }

    public Map<String, String> getDisplayNames() {
        return displayNames;
    }

    public void setDisplayNames(Map<String, String> displayNames) {
        this.displayNames = displayNames;
    }
}
