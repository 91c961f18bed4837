package com.jreinhal.edbot.rag.tier;

import com.jreinhal.edbot.model.Category;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Guidance-only messages returned when no tier produced an acceptable answer. Kept apart from the
 * retrieval code so wording can change without touching it.
 */
@Component
@ConfigurationProperties(prefix = "edbot.safety")
public class SafetyFallbackTemplates {
    static final String GENERIC = "I could not verify an answer to this question in the available clinical documents. "
            + "Please consult your institution's clinical references or the attending physician.";

    /**
     * Overrides per category. Missing categories use the built-in defaults.
     */
    private Map<Category, String> messages = new EnumMap<>(Category.class);

    public String messageFor(Category category) {
        if (category != null) {
            String configured = this.messages.get(category);
            if (configured != null && !configured.isBlank()) {
                return configured;
            }
        }
        return defaultMessage(category);
    }

    static String defaultMessage(Category category) {
        if (category == null) {
            return GENERIC;
        }
        return switch (category) {
            case CONTACT -> "I could not verify current contact information for this request. "
                    + "Please check the department directory or call the hospital operator.";
            case FORM -> "I could not find a matching form. "
                    + "Please check the forms library on the intranet or ask the charge nurse.";
            case PROTOCOL -> "I could not verify this protocol in the available documents. "
                    + "Please consult your institution's clinical protocols or contact the attending physician.";
            case CRITERIA -> "I could not verify these criteria in the available documents. "
                    + "Please consult the current institutional guideline or the attending physician.";
            case DOSAGE -> "I could not verify dosing for this request. "
                    + "Please consult pharmacy or a current drug reference before administering any medication.";
            case SUMMARY -> GENERIC;
        };
    }

    public Map<Category, String> getMessages() {
        return messages;
    }

    public void setMessages(Map<Category, String> messages) {
        this.messages = messages;
    }
}
