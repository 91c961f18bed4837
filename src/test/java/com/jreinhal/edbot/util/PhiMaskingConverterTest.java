package com.jreinhal.edbot.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PhiMaskingConverterTest {

    @Test
    void masksRecordNumbersAndBirthDates() {
        assertEquals("patient [MRN-REDACTED] arrived", PhiMaskingConverter.mask("patient MRN: 00482913 arrived"));
        assertEquals("[DOB-REDACTED] noted", PhiMaskingConverter.mask("DOB 03/14/1962 noted"));
    }

    @Test
    void masksContactIdentifiers() {
        assertEquals("ssn [SSN-REDACTED]", PhiMaskingConverter.mask("ssn 123-45-6789"));
        assertEquals("mail [EMAIL-REDACTED]", PhiMaskingConverter.mask("mail jane.doe@example.org"));
        assertEquals("call [PAGER-REDACTED]", PhiMaskingConverter.mask("call pager 4417"));
        assertEquals("call [PHONE-REDACTED] now", PhiMaskingConverter.mask("call 212-555-0199 now"));
    }

    @Test
    void leavesClinicalTextAlone() {
        String text = "Tier 2 returned 3 candidates for protocol question; aspirin 324 mg";
        assertEquals(text, PhiMaskingConverter.mask(text));
    }
}
