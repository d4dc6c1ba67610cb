package com.adpanel.service.sync;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AdNameParserTest {

    private final AdNameParser parser = new AdNameParser();

    @Test
    void productGroup_readsLeadingBracketedCode() {
        assertEquals("J3", parser.productGroup("[J3]_ABX_VV_(F_RETAIL_18_54)_SALE#01"));
        assertEquals("K10", parser.productGroup("  [k10]_ACE_VV"));
        assertNull(parser.productGroup("Summer Sale [J3]"));
        assertNull(parser.productGroup(null));
    }

    @Test
    void firstProductGroup_usesFirstNameWithCode() {
        assertEquals("J3", parser.firstProductGroup("Spring promo", null, "[J3]_ABX_VV"));
        assertNull(parser.firstProductGroup("Spring promo", "Brand"));
    }

    @Test
    void groupStyle_readsSuffixBeforeSequence() {
        assertEquals("SALE", parser.groupStyle("[J3]_ABX_VV_(F_RETAIL_18_54)_SALE#01"));
        assertEquals("REVIEW", parser.groupStyle("[J3]_ABX_VV_review#12"));
        assertNull(parser.groupStyle("[J3]_ABX_VV"));
        assertNull(parser.groupStyle(null));
    }
}
