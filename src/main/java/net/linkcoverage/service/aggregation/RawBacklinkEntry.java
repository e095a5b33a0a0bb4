package net.linkcoverage.service.aggregation;

import jakarta.annotation.Nullable;
import java.time.LocalDate;
import net.linkcoverage.model.ProviderName;

/**
 * One provider row after field mapping and URL normalization, before deduplication.
 *
 * @param pageText title and surrounding text of the source page, used for keyword matching
 * @param dofollow null when the provider does not report follow status
 */
record RawBacklinkEntry(
    ProviderName provider,
    String sourceUrl,
    String destinationUrl,
    @Nullable String anchorText,
    @Nullable String pageText,
    @Nullable LocalDate firstSeen,
    @Nullable Double domainRating,
    @Nullable Double urlRating,
    @Nullable Boolean dofollow,
    boolean content,
    boolean redirect,
    boolean canonical
) {

    String pairKey() {
        return sourceUrl + "->" + destinationUrl;
    }
}
