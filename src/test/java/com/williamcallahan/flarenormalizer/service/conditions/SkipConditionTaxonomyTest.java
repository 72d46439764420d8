package com.williamcallahan.flarenormalizer.service.conditions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.flarenormalizer.service.conditions.SkipConditionTaxonomy.SkipFamily;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SkipConditionTaxonomyTest {

    private final SkipConditionTaxonomy taxonomy = new SkipConditionTaxonomy();

    @Test
    void classify_coversEverySkipFamily() {
        assertEquals(Optional.of(SkipFamily.COLOR_CODED), taxonomy.classify("Default.Red"));
        assertEquals(Optional.of(SkipFamily.DEPRECATED), taxonomy.classify("Legacy"));
        assertEquals(Optional.of(SkipFamily.HALTED), taxonomy.classify("Paused"));
        assertEquals(Optional.of(SkipFamily.PRINT_ONLY), taxonomy.classify("Print-Only"));
        assertEquals(Optional.of(SkipFamily.CANCELLED), taxonomy.classify("Shelved"));
        assertEquals(Optional.of(SkipFamily.HIDDEN), taxonomy.classify("Draft"));
    }

    @Test
    void classify_isCaseInsensitive() {
        assertTrue(taxonomy.matches("INTERNAL"));
        assertTrue(taxonomy.matches("deprecated"));
    }

    @Test
    void classify_keepsOrdinaryConditions() {
        assertFalse(taxonomy.matches("Online"));
        assertFalse(taxonomy.matches("Required"));
        assertFalse(taxonomy.matches(""));
        assertFalse(taxonomy.matches(null));
    }

    @Test
    void shouldSkipDocument_scansConditionAttributes() {
        assertTrue(taxonomy.shouldSkipDocument("<p madcap:conditions=\"General.Obsolete\">x</p>"));
        assertTrue(taxonomy.shouldSkipDocument("<div data-mc-conditions=\"Web,Hidden\">x</div>"));
        assertFalse(taxonomy.shouldSkipDocument("<p class=\"Hidden\">Deprecated wording in text</p>"));
    }

    @Test
    void splitConditionNames_stripsQuotesAndNamespaces() {
        assertEquals(List.of("Draft", "Web", "Print"),
            SkipConditionTaxonomy.splitConditionNames("General.Draft, 'Web';Default.Print"));
        assertTrue(SkipConditionTaxonomy.splitConditionNames(" ; ").isEmpty());
    }
}
