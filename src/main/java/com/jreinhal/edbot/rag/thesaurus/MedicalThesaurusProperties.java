package com.jreinhal.edbot.rag.thesaurus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "edbot.thesaurus")
public class MedicalThesaurusProperties {
    /**
     * Master toggle for abbreviation and synonym expansion. When off, expansion returns the
     * normalized question and its keywords only.
     */
    private boolean enabled = true;

    /**
     * JSON object mapping an abbreviation to its full forms.
     */
    private String abbreviationsResource = "classpath:lexicon/medical-abbreviations.json";

    /**
     * JSON object of synonym sections ("clinical_conditions", "medications", ...), each mapping a term to its synonyms.
     */
    private String synonymsResource = "classpath:lexicon/medical-synonyms.json";

    /**
     * Site-specific abbreviations merged over the bundled dictionary.
     *
     * Example:
     * edbot.thesaurus.extra-abbreviations.MSH[0]=mount sinai hospital
     */
    private Map<String, List<String>> extraAbbreviations = new LinkedHashMap<>();

    /**
     * Upper bound on fixpoint passes when closing an expansion.
     */
    private int maxPasses = 32;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAbbreviationsResource() {
        return abbreviationsResource;
    }

    public void setAbbreviationsResource(String abbreviationsResource) {
        this.abbreviationsResource = abbreviationsResource;
    }

    public String getSynonymsResource() {
        return synonymsResource;
    }

    public void setSynonymsResource(String synonymsResource) {
        this.synonymsResource = synonymsResource;
    }

    public Map<String, List<String>> getExtraAbbreviations() {
        return extraAbbreviations;
    }

    public void setExtraAbbreviations(Map<String, List<String>> extraAbbreviations) {
        this.extraAbbreviations = extraAbbreviations;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    public void setMaxPasses(int maxPasses) {
        this.maxPasses = maxPasses;
    }
}
