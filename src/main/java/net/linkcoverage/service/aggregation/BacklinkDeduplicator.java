package net.linkcoverage.service.aggregation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collapses raw rows that share a normalized (source, destination) pair.
 *
 * <p>Merging is independent of input order: ratings take the maximum, the first-seen date takes
 * the earliest, boolean flags are OR-ed, and text fields are chosen by a fixed ordering. Output is
 * sorted by pair key.</p>
 */
final class BacklinkDeduplicator {

    DedupeResult deduplicate(List<RawBacklinkEntry> entries) {
        Map<String, MergedBacklink> merged = new TreeMap<>();
        int duplicates = 0;
        for (RawBacklinkEntry entry : entries) {
            MergedBacklink existing = merged.get(entry.pairKey());
            if (existing == null) {
                merged.put(entry.pairKey(), MergedBacklink.from(entry));
            } else {
                merged.put(entry.pairKey(), existing.merge(entry));
                duplicates++;
            }
        }
        return new DedupeResult(new ArrayList<>(merged.values()), duplicates);
    }

    record DedupeResult(List<MergedBacklink> backlinks, int duplicatesMerged) {
    }

    /**
     * Provider-neutral view of one pair after merging.
     */
    record MergedBacklink(
        String sourceUrl,
        String destinationUrl,
        String anchorText,
        SortedSet<String> pageTexts,
        LocalDate firstSeen,
        Double domainRating,
        Double urlRating,
        Boolean dofollow,
        boolean content,
        boolean redirect,
        boolean canonical,
        SortedSet<String> providers
    ) {

        static MergedBacklink from(RawBacklinkEntry entry) {
            SortedSet<String> texts = new TreeSet<>();
            if (entry.pageText() != null && !entry.pageText().isBlank()) {
                texts.add(entry.pageText());
            }
            SortedSet<String> providers = new TreeSet<>();
            providers.add(entry.provider().key());
            return new MergedBacklink(
                entry.sourceUrl(),
                entry.destinationUrl(),
                blankToNull(entry.anchorText()),
                texts,
                entry.firstSeen(),
                entry.domainRating(),
                entry.urlRating(),
                entry.dofollow(),
                entry.content(),
                entry.redirect(),
                entry.canonical(),
                providers
            );
        }

        MergedBacklink merge(RawBacklinkEntry entry) {
            MergedBacklink other = from(entry);
            SortedSet<String> texts = new TreeSet<>(pageTexts);
            texts.addAll(other.pageTexts);
            SortedSet<String> mergedProviders = new TreeSet<>(providers);
            mergedProviders.addAll(other.providers);
            return new MergedBacklink(
                sourceUrl,
                destinationUrl,
                preferredAnchor(anchorText, other.anchorText),
                texts,
                earliest(firstSeen, other.firstSeen),
                max(domainRating, other.domainRating),
                max(urlRating, other.urlRating),
                mergeFollow(dofollow, other.dofollow),
                content || other.content,
                redirect || other.redirect,
                canonical || other.canonical,
                mergedProviders
            );
        }

        /** Anchor, titles and surrounding text joined for keyword matching. */
        String searchableText() {
            StringBuilder text = new StringBuilder();
            if (anchorText != null) {
                text.append(anchorText);
            }
            for (String pageText : pageTexts) {
                text.append(' ').append(pageText);
            }
            return text.toString();
        }

        String sourceApi() {
            return String.join(",", providers);
        }

        private static String preferredAnchor(String first, String second) {
            if (first == null) {
                return second;
            }
            if (second == null) {
                return first;
            }
            if (first.length() != second.length()) {
                return first.length() > second.length() ? first : second;
            }
            return first.compareTo(second) <= 0 ? first : second;
        }

        private static LocalDate earliest(LocalDate first, LocalDate second) {
            if (first == null) {
                return second;
            }
            if (second == null) {
                return first;
            }
            return first.isBefore(second) ? first : second;
        }

        private static Double max(Double first, Double second) {
            if (first == null) {
                return second;
            }
            if (second == null) {
                return first;
            }
            return Math.max(first, second);
        }

        private static Boolean mergeFollow(Boolean first, Boolean second) {
            if (Boolean.TRUE.equals(first) || Boolean.TRUE.equals(second)) {
                return Boolean.TRUE;
            }
            if (first == null && second == null) {
                return null;
            }
            return Boolean.FALSE;
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value;
        }
    }
}
