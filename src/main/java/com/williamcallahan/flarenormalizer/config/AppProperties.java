package com.williamcallahan.flarenormalizer.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root of the {@code app.*} configuration tree.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Normalizer normalizer = new Normalizer();

    public Normalizer getNormalizer() {
        return normalizer;
    }

    public void setNormalizer(Normalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Validates every configuration section, failing startup on the first invalid value.
     */
    @PostConstruct
    public void validateConfiguration() {
        normalizer.getCache().validateConfiguration();
        normalizer.getLists().validateConfiguration();
        normalizer.getImages().validateConfiguration();
    }

    /**
     * Settings under {@code app.normalizer}.
     */
    public static class Normalizer {
        private NormalizerCacheConfig cache = new NormalizerCacheConfig();
        private ListHeuristicsConfig lists = new ListHeuristicsConfig();
        private ImageClassificationConfig images = new ImageClassificationConfig();

        public NormalizerCacheConfig getCache() { return cache; }
        public void setCache(NormalizerCacheConfig cache) { this.cache = cache; }

        public ListHeuristicsConfig getLists() { return lists; }
        public void setLists(ListHeuristicsConfig lists) { this.lists = lists; }

        public ImageClassificationConfig getImages() { return images; }
        public void setImages(ImageClassificationConfig images) { this.images = images; }
    }
}
