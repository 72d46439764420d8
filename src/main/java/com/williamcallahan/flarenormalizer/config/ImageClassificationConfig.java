package com.williamcallahan.flarenormalizer.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Signals used to tell inline icons from block screenshots.
 */
public class ImageClassificationConfig {

    private static final int ICON_MAX_DEF = 32;
    private static final List<String> SCREENSHOT_KEYWORDS_DEF =
            List.of("CreateActivity", "AddFundingSource", "InvestItem", "BudgetTab", "FundingSource");
    private static final String ICON_MAX_KEY = "app.normalizer.images.inline-icon-max-size";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int inlineIconMaxSize = ICON_MAX_DEF;
    private List<String> screenshotKeywords = new ArrayList<>(SCREENSHOT_KEYWORDS_DEF);

    /**
     * Validates image classification settings.
     */
    public void validateConfiguration() {
        if (inlineIconMaxSize <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, ICON_MAX_KEY));
        }
    }

    /**
     * Returns the largest width and height, in pixels, an image may have to count as an icon.
     *
     * @return inline icon size bound
     */
    public int getInlineIconMaxSize() {
        return inlineIconMaxSize;
    }

    public void setInlineIconMaxSize(final int inlineIconMaxSize) {
        this.inlineIconMaxSize = inlineIconMaxSize;
    }

    public List<String> getScreenshotKeywords() {
        return screenshotKeywords;
    }

    public void setScreenshotKeywords(final List<String> screenshotKeywords) {
        this.screenshotKeywords = screenshotKeywords == null ? new ArrayList<>() : new ArrayList<>(screenshotKeywords);
    }
}
