package net.linkcoverage.model;

import jakarta.annotation.Nullable;
import java.time.LocalDate;

/**
 * Canonical, deduplicated and classified backlink produced by aggregation.
 *
 * <p>{@code sourceApi} is a sorted, comma-joined list of provider keys, e.g.
 * {@code "ahrefs,dataforseo"} when both providers reported the pair.</p>
 */
public record BacklinkRecord(
    String sourceUrl,
    String destinationUrl,
    @Nullable String anchorText,
    @Nullable LocalDate firstSeen,
    @Nullable Double domainRating,
    @Nullable Double urlRating,
    String linkType,
    boolean content,
    boolean redirect,
    boolean canonical,
    CoverageStatus coverageStatus,
    LinkDestination linkDestination,
    double confidenceScore,
    String sourceApi
) {

    public static final String LINK_TYPE_DOFOLLOW = "dofollow";
    public static final String LINK_TYPE_NOFOLLOW = "nofollow";

    /** Natural key used for deduplication and upserts. */
    public String pairKey() {
        return sourceUrl + "->" + destinationUrl;
    }
}
