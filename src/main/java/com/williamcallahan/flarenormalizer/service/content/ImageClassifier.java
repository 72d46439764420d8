package com.williamcallahan.flarenormalizer.service.content;

import com.williamcallahan.flarenormalizer.config.AppProperties;
import com.williamcallahan.flarenormalizer.config.ImageClassificationConfig;
import com.williamcallahan.flarenormalizer.support.DomNodes;
import java.util.List;
import java.util.regex.Pattern;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Decides whether an image flows with text (icon) or stands on its own line (screenshot).
 *
 * Checks run in order: an {@code IconInline} class is inline; screenshot folders and known
 * screenshot names are block; GUI/icon/button folders are inline; images no larger than the
 * icon bound in both dimensions are inline; anything else is block.
 */
@Component
public class ImageClassifier {

    private static final String ICON_INLINE_CLASS = "IconInline";
    private static final Pattern SCREENSHOT_PATH = Pattern.compile("/(Screens|Screenshots)", Pattern.CASE_INSENSITIVE);
    private static final Pattern UI_ICON_PATH = Pattern.compile("/(GUI|Icon|Button)", Pattern.CASE_INSENSITIVE);

    private final int inlineIconMaxSize;
    private final List<String> screenshotKeywords;

    public ImageClassifier(AppProperties appProperties) {
        ImageClassificationConfig config = appProperties.getNormalizer().getImages();
        this.inlineIconMaxSize = config.getInlineIconMaxSize();
        this.screenshotKeywords = List.copyOf(config.getScreenshotKeywords());
    }

    /**
     * @param image an {@code img} element
     * @return true when the image should be isolated in its own paragraph
     */
    public boolean isBlockImage(Element image) {
        if (image.className().contains(ICON_INLINE_CLASS)) {
            return false;
        }
        String src = image.attr("src");
        if (SCREENSHOT_PATH.matcher(src).find() || screenshotKeywords.stream().anyMatch(src::contains)) {
            return true;
        }
        if (UI_ICON_PATH.matcher(src).find()) {
            return false;
        }
        int width = DomNodes.intAttribute(image, "width", -1);
        int height = DomNodes.intAttribute(image, "height", -1);
        if (width >= 0 && height >= 0 && width <= inlineIconMaxSize && height <= inlineIconMaxSize) {
            return false;
        }
        return true;
    }
}
