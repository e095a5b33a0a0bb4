package net.linkcoverage.service.risk;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.RiskAlert;
import net.linkcoverage.model.RiskAssessment;
import net.linkcoverage.model.RiskSeverity;
import net.linkcoverage.util.UrlUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Scans an aggregated backlink set for toxicity signals.
 *
 * <p>Pure function of the records passed in: no I/O and no mutation. The one input not taken
 * from the records is {@code detectedAt}, read from the injected {@link Clock}; with a fixed
 * clock two calls on the same records return equal assessments. Signals:</p>
 * <ul>
 *   <li>{@code spam_anchor}: one anchor text reused by many low-authority source domains</li>
 *   <li>{@code link_velocity}: a burst of records first seen on the same day</li>
 *   <li>{@code low_quality_tld}: sources under TLDs commonly used by link farms</li>
 *   <li>{@code low_authority}: the set is dominated by near-zero-authority sources</li>
 * </ul>
 */
@Service
public class RiskAssessmentService {

    static final int MAX_ALERTS = 100;
    static final int MAX_AFFECTED_URLS = 20;

    static final double LOW_AUTHORITY_RATING = 20.0;
    static final int SPAM_ANCHOR_MEDIUM_DOMAINS = 5;
    static final int SPAM_ANCHOR_HIGH_DOMAINS = 10;

    static final int VELOCITY_BURST_RECORDS = 10;
    static final double VELOCITY_HIGH_SHARE = 0.5;

    static final double NEGLIGIBLE_AUTHORITY_RATING = 5.0;
    static final int NEGLIGIBLE_AUTHORITY_MIN_RECORDS = 10;
    static final double NEGLIGIBLE_AUTHORITY_SHARE = 0.5;

    static final Set<String> LOW_QUALITY_TLDS = Set.of(
        "xyz", "top", "click", "loan", "work", "gq", "tk", "ml", "cf", "ga"
    );

    private final Clock clock;

    @Autowired
    public RiskAssessmentService() {
        this(Clock.systemUTC());
    }

    RiskAssessmentService(Clock clock) {
        this.clock = clock;
    }

    public RiskAssessment assessRisk(List<BacklinkRecord> records) {
        if (records == null || records.isEmpty()) {
            return RiskAssessment.empty();
        }
        Instant now = clock.instant();
        List<RiskAlert> alerts = new ArrayList<>();
        alerts.addAll(spamAnchors(records, now));
        alerts.addAll(linkVelocity(records, now));
        alerts.addAll(lowQualityTlds(records, now));
        alerts.addAll(negligibleAuthority(records, now));

        alerts.sort(Comparator.comparingInt((RiskAlert alert) -> alert.severity().rank()).reversed()
            .thenComparing(RiskAlert::riskType)
            .thenComparing(RiskAlert::description));
        List<RiskAlert> capped = alerts.size() > MAX_ALERTS ? alerts.subList(0, MAX_ALERTS) : alerts;
        return new RiskAssessment(capped, records.size());
    }

    private List<RiskAlert> spamAnchors(List<BacklinkRecord> records, Instant now) {
        Map<String, Set<String>> domainsByAnchor = new TreeMap<>();
        Map<String, Set<String>> urlsByAnchor = new TreeMap<>();
        for (BacklinkRecord record : records) {
            String anchor = normalizeAnchor(record.anchorText());
            if (anchor == null || !isLowAuthority(record)) {
                continue;
            }
            String domain = UrlUtils.extractDomain(record.sourceUrl());
            if (domain == null) {
                continue;
            }
            domainsByAnchor.computeIfAbsent(anchor, key -> new TreeSet<>()).add(domain);
            urlsByAnchor.computeIfAbsent(anchor, key -> new LinkedHashSet<>()).add(record.sourceUrl());
        }

        List<RiskAlert> alerts = new ArrayList<>();
        domainsByAnchor.forEach((anchor, domains) -> {
            if (domains.size() < SPAM_ANCHOR_MEDIUM_DOMAINS) {
                return;
            }
            RiskSeverity severity = domains.size() >= SPAM_ANCHOR_HIGH_DOMAINS ? RiskSeverity.HIGH : RiskSeverity.MEDIUM;
            alerts.add(new RiskAlert(
                "spam_anchor",
                severity,
                "Anchor text \"" + anchor + "\" repeated across " + domains.size() + " low-authority domains",
                limit(urlsByAnchor.get(anchor)),
                "Review these links and disavow the ones you did not build",
                now
            ));
        });
        return alerts;
    }

    private List<RiskAlert> linkVelocity(List<BacklinkRecord> records, Instant now) {
        Map<LocalDate, Integer> recordsByDay = new TreeMap<>();
        Map<LocalDate, Set<String>> urlsByDay = new TreeMap<>();
        int dated = 0;
        for (BacklinkRecord record : records) {
            if (record.firstSeen() == null) {
                continue;
            }
            dated++;
            recordsByDay.merge(record.firstSeen(), 1, Integer::sum);
            urlsByDay.computeIfAbsent(record.firstSeen(), key -> new LinkedHashSet<>()).add(record.sourceUrl());
        }

        List<RiskAlert> alerts = new ArrayList<>();
        for (Map.Entry<LocalDate, Integer> entry : recordsByDay.entrySet()) {
            int count = entry.getValue();
            if (count < VELOCITY_BURST_RECORDS) {
                continue;
            }
            RiskSeverity severity = count >= dated * VELOCITY_HIGH_SHARE ? RiskSeverity.HIGH : RiskSeverity.MEDIUM;
            alerts.add(new RiskAlert(
                "link_velocity",
                severity,
                count + " backlinks first seen on " + entry.getKey() + " (" + dated + " dated in total)",
                limit(urlsByDay.get(entry.getKey())),
                "Check whether this burst comes from a paid placement or automated link network",
                now
            ));
        }
        return alerts;
    }

    private List<RiskAlert> lowQualityTlds(List<BacklinkRecord> records, Instant now) {
        Map<String, Set<String>> urlsByTld = new TreeMap<>();
        for (BacklinkRecord record : records) {
            String domain = UrlUtils.extractDomain(record.sourceUrl());
            if (domain == null) {
                continue;
            }
            String tld = domain.substring(domain.lastIndexOf('.') + 1);
            if (LOW_QUALITY_TLDS.contains(tld)) {
                urlsByTld.computeIfAbsent(tld, key -> new LinkedHashSet<>()).add(record.sourceUrl());
            }
        }

        List<RiskAlert> alerts = new ArrayList<>();
        urlsByTld.forEach((tld, urls) -> alerts.add(new RiskAlert(
            "low_quality_tld",
            RiskSeverity.LOW,
            urls.size() + " backlink(s) from ." + tld + " domains",
            limit(urls),
            "Verify these sources are genuine publications",
            now
        )));
        return alerts;
    }

    private List<RiskAlert> negligibleAuthority(List<BacklinkRecord> records, Instant now) {
        if (records.size() < NEGLIGIBLE_AUTHORITY_MIN_RECORDS) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        for (BacklinkRecord record : records) {
            if (record.domainRating() != null && record.domainRating() < NEGLIGIBLE_AUTHORITY_RATING) {
                urls.add(record.sourceUrl());
            }
        }
        if (urls.size() < records.size() * NEGLIGIBLE_AUTHORITY_SHARE) {
            return List.of();
        }
        return List.of(new RiskAlert(
            "low_authority",
            RiskSeverity.LOW,
            urls.size() + " of " + records.size() + " backlinks come from domains rated below "
                + (int) NEGLIGIBLE_AUTHORITY_RATING,
            limit(urls),
            "Prioritize outreach to higher-authority publications",
            now
        ));
    }

    private static boolean isLowAuthority(BacklinkRecord record) {
        return record.domainRating() == null || record.domainRating() < LOW_AUTHORITY_RATING;
    }

    private static String normalizeAnchor(String anchor) {
        if (anchor == null) {
            return null;
        }
        String normalized = anchor.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    private static List<String> limit(Set<String> urls) {
        List<String> list = new ArrayList<>(urls);
        return list.size() > MAX_AFFECTED_URLS ? List.copyOf(list.subList(0, MAX_AFFECTED_URLS)) : list;
    }
}
