package net.linkcoverage.service.content;

import java.util.List;

/**
 * Structured text extracted from one HTML page.
 *
 * @param bodyText text of the main content area with navigation chrome removed
 * @param outboundLinkCount anchors carrying both an href and visible text
 */
record PageContent(
    String title,
    String metaDescription,
    List<String> headings,
    String bodyText,
    int outboundLinkCount,
    int wordCount
) {

    PageContent {
        headings = headings == null ? List.of() : List.copyOf(headings);
    }
}
