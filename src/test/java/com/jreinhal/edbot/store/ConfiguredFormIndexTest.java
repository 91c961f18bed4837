package com.jreinhal.edbot.store;

import com.jreinhal.edbot.model.DocumentRef;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredFormIndexTest {

    private ConfiguredFormIndex index;

    @BeforeEach
    void setUp() {
        FormIndexProperties props = new FormIndexProperties();
        Map<String, List<String>> mappings = new LinkedHashMap<>();
        mappings.put("Blood  Transfusion", List.of("MSHS_Consent_for_Elective_Blood_Transfusion.pdf", "TransfusionConsentFormSpanish.pdf"));
        mappings.put("ama", List.of("AMA Departure Form.pdf"));
        mappings.put("", List.of("ignored.pdf"));
        props.setMappings(mappings);
        props.setDisplayNames(Map.of("MSHS_Consent_for_Elective_Blood_Transfusion.pdf", "Blood Transfusion Consent Form"));
        index = new ConfiguredFormIndex(props);
        index.init();
    }

    @Test
    void resolvesKeywordPhraseToAllMappedFiles() {
        List<DocumentRef> refs = index.resolve(List.of("show me the blood transfusion consent form"));

        assertEquals(2, refs.size());
        assertEquals("MSHS_Consent_for_Elective_Blood_Transfusion.pdf", refs.get(0).documentId());
        assertEquals("Blood Transfusion Consent Form", refs.get(0).displayName());
        assertEquals("blood transfusion", refs.get(0).matchedKeyword());
        assertEquals("TransfusionConsentFormSpanish", refs.get(1).displayName());
    }

    @Test
    void shortKeywordsOnlyMatchWholeWords() {
        assertTrue(index.resolve(List.of("llama bedding")).isEmpty());
        assertEquals(1, index.resolve(List.of("AMA form")).size());
    }

    @Test
    void emptyInputResolvesNothing() {
        assertTrue(index.resolve(List.of()).isEmpty());
        assertTrue(index.resolve(null).isEmpty());
    }

    @Test
    void titleIsDerivedFromFilename() {
        assertEquals("Surgical Pathology Req Form", ConfiguredFormIndex.titleFromFilename("Surgical_Pathology_Req_form.pdf"));
        assertEquals("AMA Departure Form", ConfiguredFormIndex.titleFromFilename("AMA Departure Form.PDF"));
    }
}
