package com.williamcallahan.flarenormalizer.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies validation of the normalizer settings.
 */
class AppPropertiesValidationTest {

    @Test
    void acceptsDefaults() {
        AppProperties appProperties = new AppProperties();

        assertDoesNotThrow(appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveFileContentCacheSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getNormalizer().getCache().setFileContentMaxEntries(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveLargeListThreshold() {
        AppProperties appProperties = new AppProperties();
        appProperties.getNormalizer().getLists().setLargeListThreshold(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNegativeShortFragmentLength() {
        AppProperties appProperties = new AppProperties();
        appProperties.getNormalizer().getLists().setShortFragmentLength(-1);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void rejectsNonPositiveIconSize() {
        AppProperties appProperties = new AppProperties();
        appProperties.getNormalizer().getImages().setInlineIconMaxSize(0);

        assertThrows(IllegalArgumentException.class, appProperties::validateConfiguration);
    }

    @Test
    void acceptsEmptyScreenshotKeywords() {
        AppProperties appProperties = new AppProperties();
        appProperties.getNormalizer().getImages().setScreenshotKeywords(List.of());

        assertDoesNotThrow(appProperties::validateConfiguration);
    }
}
