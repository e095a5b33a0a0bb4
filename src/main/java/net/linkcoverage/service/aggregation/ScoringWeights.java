package net.linkcoverage.service.aggregation;

/**
 * Tunable confidence policy. Weights are non-negative, which keeps the score monotonic in
 * every signal.
 *
 * @param keywordSaturation keyword occurrences at which the keyword signal reaches its maximum
 */
public record ScoringWeights(double directLinkWeight,
                             double keywordWeight,
                             double authorityWeight,
                             int keywordSaturation) {

    public ScoringWeights {
        if (directLinkWeight < 0 || keywordWeight < 0 || authorityWeight < 0) {
            throw new IllegalArgumentException("Scoring weights must be non-negative");
        }
        if (keywordSaturation < 1) {
            throw new IllegalArgumentException("keywordSaturation must be at least 1 but was " + keywordSaturation);
        }
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(60, 25, 15, 3);
    }
}
