package com.jreinhal.edbot.util;

import ch.qos.logback.classic.pattern.ClassicConverter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.regex.Pattern;

/**
 * Redacts common patient identifiers from formatted log messages.
 *
 * Registered in logback-spring.xml as the {@code %maskedMsg} conversion word.
 */
public class PhiMaskingConverter extends ClassicConverter {
    private static final Pattern MRN = Pattern.compile("\\b(?:MRN|medical record(?: number)?)\\s*[:#]?\\s*[A-Z0-9-]{5,}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATE_OF_BIRTH = Pattern.compile("\\b(?:DOB|date of birth)\\s*[:#]?\\s*\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern EMAIL = Pattern.compile("\\b[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile("\\b(?:\\+?1[-.\\s]?)?\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b");
    private static final Pattern PAGER = Pattern.compile("\\bpager\\s*[:#]?\\s*\\d{3,}\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String convert(ILoggingEvent event) {
        String msg = event.getFormattedMessage();
        if (msg == null || msg.isEmpty()) {
            return "";
        }
        return mask(msg);
    }

    static String mask(String message) {
        String sanitized = message;
        sanitized = MRN.matcher(sanitized).replaceAll("[MRN-REDACTED]");
        sanitized = DATE_OF_BIRTH.matcher(sanitized).replaceAll("[DOB-REDACTED]");
        sanitized = SSN.matcher(sanitized).replaceAll("[SSN-REDACTED]");
        sanitized = EMAIL.matcher(sanitized).replaceAll("[EMAIL-REDACTED]");
        sanitized = PAGER.matcher(sanitized).replaceAll("[PAGER-REDACTED]");
        sanitized = PHONE.matcher(sanitized).replaceAll("[PHONE-REDACTED]");
        return sanitized;
    }
}
