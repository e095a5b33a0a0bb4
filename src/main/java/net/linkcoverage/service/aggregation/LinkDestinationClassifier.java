package net.linkcoverage.service.aggregation;

import java.util.Locale;
import java.util.Set;
import net.linkcoverage.model.LinkDestination;
import net.linkcoverage.util.UrlUtils;

/**
 * Path heuristics for the kind of page a backlink points at.
 * Blog segments win over product segments when a path contains both.
 */
final class LinkDestinationClassifier {

    private static final Set<String> BLOG_SEGMENTS = Set.of(
        "blog", "blogs", "news", "article", "articles", "post", "posts", "press", "stories", "insights"
    );
    private static final Set<String> PRODUCT_SEGMENTS = Set.of(
        "product", "products", "shop", "store", "catalog", "catalogue", "item", "items", "collections", "pricing"
    );

    private LinkDestinationClassifier() {
    }

    static LinkDestination classify(String destinationUrl) {
        String path = UrlUtils.pathOf(destinationUrl);
        if (path.isEmpty()) {
            return LinkDestination.HOMEPAGE;
        }
        String[] segments = path.toLowerCase(Locale.ROOT).split("/");
        boolean product = false;
        for (String segment : segments) {
            if (segment.isEmpty()) {
                continue;
            }
            if (BLOG_SEGMENTS.contains(segment)) {
                return LinkDestination.BLOG_PAGE;
            }
            if (PRODUCT_SEGMENTS.contains(segment)) {
                product = true;
            }
        }
        return product ? LinkDestination.PRODUCT : LinkDestination.OTHER;
    }
}
