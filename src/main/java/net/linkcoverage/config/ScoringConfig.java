package net.linkcoverage.config;

import net.linkcoverage.service.aggregation.ScoringWeights;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Confidence score policy for aggregation.
 */
@Configuration
public class ScoringConfig {

    @Bean
    public ScoringWeights scoringWeights(
            @Value("${app.scoring.direct-link-weight:60}") double directLinkWeight,
            @Value("${app.scoring.keyword-weight:25}") double keywordWeight,
            @Value("${app.scoring.authority-weight:15}") double authorityWeight,
            @Value("${app.scoring.keyword-saturation:3}") int keywordSaturation) {
        return new ScoringWeights(directLinkWeight, keywordWeight, authorityWeight, keywordSaturation);
    }
}
