package net.linkcoverage.service.aggregation;

/**
 * Weighted 0..100 confidence from direct-link presence, keyword evidence and source authority.
 */
final class ConfidenceScorer {

    private final ScoringWeights weights;
    private final double totalWeight;

    ConfidenceScorer(ScoringWeights weights) {
        this.weights = weights;
        this.totalWeight = weights.directLinkWeight() + weights.keywordWeight() + weights.authorityWeight();
    }

    /**
     * @param directLink record points at the campaign URL or domain
     * @param keywordOccurrences total keyword hits in the source text
     * @param domainRating source authority on a 0..100 scale, null when unknown
     */
    double score(boolean directLink, int keywordOccurrences, Double domainRating) {
        if (totalWeight <= 0) {
            return 0.0;
        }
        double direct = directLink ? 1.0 : 0.0;
        double keyword = Math.min(Math.max(keywordOccurrences, 0), weights.keywordSaturation())
            / (double) weights.keywordSaturation();
        double authority = domainRating == null ? 0.0 : Math.min(Math.max(domainRating, 0.0), 100.0) / 100.0;

        double raw = weights.directLinkWeight() * direct
            + weights.keywordWeight() * keyword
            + weights.authorityWeight() * authority;
        // Rescale so that the weights need not sum to 100
        double scaled = raw * 100.0 / totalWeight;
        return Math.round(Math.min(100.0, Math.max(0.0, scaled)) * 100.0) / 100.0;
    }
}
