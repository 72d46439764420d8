package com.williamcallahan.flarenormalizer.config;

import java.util.Locale;

/**
 * Thresholds used by the list reconstruction heuristics.
 */
public class ListHeuristicsConfig {

    private static final int LARGE_LIST_DEF = 5;
    private static final int SHORT_FRAGMENT_DEF = 50;
    private static final String LARGE_LIST_KEY = "app.normalizer.lists.large-list-threshold";
    private static final String SHORT_FRAGMENT_KEY = "app.normalizer.lists.short-fragment-length";
    private static final String POSITIVE_FMT = "%s must be greater than 0.";

    private int largeListThreshold = LARGE_LIST_DEF;
    private int shortFragmentLength = SHORT_FRAGMENT_DEF;

    /**
     * Validates list heuristic thresholds.
     */
    public void validateConfiguration() {
        if (largeListThreshold <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, LARGE_LIST_KEY));
        }
        if (shortFragmentLength <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, SHORT_FRAGMENT_KEY));
        }
    }

    /**
     * Returns the item count at which a top-level list is treated as an independent section.
     *
     * @return large list item count
     */
    public int getLargeListThreshold() {
        return largeListThreshold;
    }

    public void setLargeListThreshold(final int largeListThreshold) {
        this.largeListThreshold = largeListThreshold;
    }

    /**
     * Returns the length below which unpunctuated text is treated as a continuation fragment.
     *
     * @return short fragment length in characters
     */
    public int getShortFragmentLength() {
        return shortFragmentLength;
    }

    public void setShortFragmentLength(final int shortFragmentLength) {
        this.shortFragmentLength = shortFragmentLength;
    }
}
