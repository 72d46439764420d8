package com.williamcallahan.flarenormalizer.domain;

/**
 * Target emitter the normalized tree is destined for.
 *
 * Later passes consult the hint to skip normalization the emitter performs itself.
 */
public enum OutputFormat {
    ASCIIDOC,
    WRITERSIDE_MARKDOWN,
    ZENDESK,
    UNSPECIFIED;

    /**
     * Whether inline formatting elements should be flattened into lightweight markup text
     * before emission.
     *
     * @return true only for AsciiDoc output
     */
    public boolean flattensInlineFormatting() {
        return this == ASCIIDOC;
    }
}
