package net.linkcoverage.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.zip.CRC32;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQuery;
import net.linkcoverage.util.UrlUtils;
import org.springframework.stereotype.Service;

/**
 * Deterministic synthetic provider payloads.
 *
 * <p>Output depends only on the provider, the normalized query domain and the target URL, so two
 * calls for the same campaign always return identical data. Payloads use each provider's native
 * JSON shape so they flow through the same parsing path as live responses.</p>
 *
 * <p>Every domain gets a fixed core: a direct link to the target, a blog-page link, a pair that
 * both providers report (with different ratings), a keyword-bearing page that does not link to
 * the target, and a low-authority source. A seeded generator adds a few extra publisher links.</p>
 */
@Service
public class MockBacklinkDataService {

    private static final LocalDate BASE_DATE = LocalDate.of(2025, 9, 1);
    private static final List<String> PUBLISHER_HOSTS = List.of(
        "techdaily.example.org",
        "marketwatch.sample.com",
        "reviews.sample.net",
        "industry-digest.example.io",
        "weekly-roundup.sample.org",
        "startup-radar.example.net"
    );
    private static final List<String> DESTINATION_PATHS = List.of("", "/blog/launch", "/products/flagship", "/about");

    private final ObjectMapper objectMapper;

    public MockBacklinkDataService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode mockPayload(ProviderName provider, ProviderQuery query) {
        String domain = normalizedDomain(query.domain());
        String target = resolveTarget(domain, query.targetUrl());
        Random random = new Random(seed(provider, domain));
        return switch (provider) {
            case AHREFS -> ahrefsPayload(domain, target, random);
            case DATAFORSEO -> dataForSeoPayload(domain, target, random);
        };
    }

    private JsonNode ahrefsPayload(String domain, String target, Random random) {
        String brand = brandOf(domain);
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode backlinks = root.putArray("backlinks");

        backlinks.add(ahrefsRow("https://example.com/article-1", target, "Example Article 1",
            brand + " launch coverage", BASE_DATE, 42, 18, true));
        backlinks.add(ahrefsRow("https://example.com/article-2", "https://" + domain + "/blog",
            "Example Article 2", "read the " + brand + " blog", BASE_DATE.plusDays(1), 13, 6, true));

        int extras = 2 + random.nextInt(3);
        for (int i = 0; i < extras; i++) {
            String host = PUBLISHER_HOSTS.get(random.nextInt(PUBLISHER_HOSTS.size()));
            String path = DESTINATION_PATHS.get(random.nextInt(DESTINATION_PATHS.size()));
            int rating = 10 + random.nextInt(71);
            backlinks.add(ahrefsRow(
                "https://" + host + "/mentions/" + brand + "-" + (i + 1),
                "https://" + domain + path,
                "Roundup " + (i + 1) + " featuring " + brand,
                brand,
                BASE_DATE.plusDays(5 + random.nextInt(20)),
                rating,
                Math.max(1, rating / 3),
                random.nextInt(4) != 0
            ));
        }
        return root;
    }

    private ObjectNode ahrefsRow(String from, String to, String title, String anchor,
                                 LocalDate firstSeen, int domainRating, int urlRating, boolean dofollow) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("url_from", from);
        row.put("url_to", to);
        row.put("title", title);
        row.put("anchor", anchor);
        row.put("first_seen", firstSeen.toString());
        row.put("domain_rating", domainRating);
        row.put("url_rating", urlRating);
        row.put("nofollow", !dofollow);
        row.put("is_content", true);
        row.put("is_redirect", false);
        row.put("is_canonical", true);
        return row;
    }

    private JsonNode dataForSeoPayload(String domain, String target, Random random) {
        String brand = brandOf(domain);
        ObjectNode root = objectMapper.createObjectNode();
        root.put("status_code", 20000);
        root.put("status_message", "Ok.");
        ObjectNode task = root.putArray("tasks").addObject();
        task.put("status_code", 20000);
        ObjectNode result = task.putArray("result").addObject();
        result.put("target", domain);
        ArrayNode items = result.putArray("items");

        items.add(dataForSeoRow("https://news.example.net/story-a", target, "Story A",
            "coverage of " + brand, BASE_DATE.plusDays(2), 55, 30, true, ""));
        items.add(dataForSeoRow("https://blog.sample.io/post-b", "https://" + domain,
            "Post B", "visit " + brand, BASE_DATE.plusDays(3), 12, 4, false, ""));
        // Same pair as the first Ahrefs row, reported with a higher rating
        items.add(dataForSeoRow("https://example.com/article-1", target, "Example Article 1",
            brand + " launch coverage", BASE_DATE, 47, 21, true, ""));
        items.add(dataForSeoRow("https://forum.sample.org/thread-" + (100 + random.nextInt(900)),
            "https://community.sample.org/discussions", "Community thread",
            "join the discussion", BASE_DATE.plusDays(6), 24 + random.nextInt(20), 8, true,
            "Members compared notes on " + brand + " and its rivals"));
        items.add(dataForSeoRow("https://cheap-links.xyz/p/" + (1 + random.nextInt(50)),
            "https://" + domain, "Link directory", "best deals", BASE_DATE.plusDays(7), 2, 1, true, ""));
        return root;
    }

    private ObjectNode dataForSeoRow(String from, String to, String title, String anchor,
                                     LocalDate firstSeen, int domainRank, int pageRank,
                                     boolean dofollow, String surroundingText) {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("url_from", from);
        row.put("url_to", to);
        row.put("page_from_title", title);
        row.put("anchor", anchor);
        row.put("first_seen", firstSeen + " 00:00:00 +00:00");
        row.put("domain_from_rank", domainRank);
        row.put("page_from_rank", pageRank);
        row.put("dofollow", dofollow);
        row.put("is_redirect", false);
        row.put("text_pre", surroundingText);
        row.put("text_post", "");
        return row;
    }

    /** Same value on every JVM run for a given provider and domain. */
    static long seed(ProviderName provider, String domain) {
        CRC32 crc = new CRC32();
        crc.update((provider.key() + "|" + domain).getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    private static String normalizedDomain(String domain) {
        String normalized = UrlUtils.normalizeDomain(domain);
        return normalized == null ? domain.trim().toLowerCase(Locale.ROOT) : normalized;
    }

    private static String resolveTarget(String domain, String targetUrl) {
        String normalized = UrlUtils.normalize(targetUrl);
        return normalized != null ? normalized : "https://" + domain;
    }

    static String brandOf(String domain) {
        int dot = domain.indexOf('.');
        return dot > 0 ? domain.substring(0, dot) : domain;
    }
}
