package net.linkcoverage.service.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import net.linkcoverage.model.ProviderName;
import net.linkcoverage.model.ProviderQueryResult;
import net.linkcoverage.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps provider-native payloads to {@link RawBacklinkEntry} rows.
 *
 * <p>Rows without a parseable source or destination URL are skipped and counted; a malformed row
 * never aborts the payload.</p>
 */
final class ProviderPayloadReader {

    private static final Logger log = LoggerFactory.getLogger(ProviderPayloadReader.class);

    ParsedPayload read(ProviderQueryResult result) {
        if (result == null || !result.hasPayload()) {
            return new ParsedPayload(List.of(), 0);
        }
        List<JsonNode> rows = switch (result.provider()) {
            case AHREFS -> ahrefsRows(result.payload());
            case DATAFORSEO -> dataForSeoRows(result.payload());
        };

        List<RawBacklinkEntry> entries = new ArrayList<>(rows.size());
        int skipped = 0;
        for (JsonNode row : rows) {
            RawBacklinkEntry entry = switch (result.provider()) {
                case AHREFS -> fromAhrefs(row);
                case DATAFORSEO -> fromDataForSeo(row);
            };
            if (entry == null) {
                skipped++;
            } else {
                entries.add(entry);
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed {} row(s)", skipped, result.provider().displayName());
        }
        return new ParsedPayload(entries, skipped);
    }

    private List<JsonNode> ahrefsRows(JsonNode payload) {
        List<JsonNode> rows = new ArrayList<>();
        payload.path("backlinks").forEach(rows::add);
        return rows;
    }

    private List<JsonNode> dataForSeoRows(JsonNode payload) {
        List<JsonNode> rows = new ArrayList<>();
        for (JsonNode task : payload.path("tasks")) {
            for (JsonNode result : task.path("result")) {
                result.path("items").forEach(rows::add);
            }
        }
        return rows;
    }

    private RawBacklinkEntry fromAhrefs(JsonNode row) {
        if (row == null || !row.isObject()) {
            return null;
        }
        String source = UrlUtils.normalize(text(row, "url_from"));
        String destination = UrlUtils.normalize(text(row, "url_to"));
        if (source == null || destination == null) {
            return null;
        }
        Boolean dofollow = row.has("is_dofollow")
            ? Boolean.valueOf(row.path("is_dofollow").asBoolean())
            : row.has("nofollow") ? Boolean.valueOf(!row.path("nofollow").asBoolean()) : null;
        return new RawBacklinkEntry(
            ProviderName.AHREFS,
            source,
            destination,
            text(row, "anchor"),
            text(row, "title"),
            date(row, "first_seen"),
            number(row, "domain_rating", "domain_rating_source"),
            number(row, "url_rating", "url_rating_source"),
            dofollow,
            row.path("is_content").asBoolean(false),
            row.path("is_redirect").asBoolean(false),
            row.path("is_canonical").asBoolean(false)
        );
    }

    private RawBacklinkEntry fromDataForSeo(JsonNode row) {
        if (row == null || !row.isObject()) {
            return null;
        }
        String source = UrlUtils.normalize(firstText(row, "url_from", "source_url"));
        String destination = UrlUtils.normalize(firstText(row, "url_to", "target_url"));
        if (source == null || destination == null) {
            return null;
        }
        Boolean dofollow = row.has("dofollow")
            ? Boolean.valueOf(row.path("dofollow").asBoolean())
            : row.has("nofollow") ? Boolean.valueOf(!row.path("nofollow").asBoolean()) : null;
        String pageText = join(
            firstText(row, "page_from_title", "title"),
            text(row, "text_pre"),
            text(row, "text_post")
        );
        return new RawBacklinkEntry(
            ProviderName.DATAFORSEO,
            source,
            destination,
            text(row, "anchor"),
            pageText,
            date(row, "first_seen"),
            number(row, "domain_from_rank", "domain_rank"),
            number(row, "page_from_rank", "page_rank"),
            dofollow,
            true,
            row.path("is_redirect").asBoolean(row.path("redirect").asBoolean(false)),
            false
        );
    }

    private static String text(JsonNode row, String field) {
        JsonNode value = row.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    private static String firstText(JsonNode row, String... fields) {
        for (String field : fields) {
            String value = text(row, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Double number(JsonNode row, String... fields) {
        for (String field : fields) {
            JsonNode value = row.get(field);
            if (value != null && value.isNumber()) {
                return value.asDouble();
            }
            if (value != null && value.isTextual()) {
                try {
                    return Double.valueOf(value.asText().trim());
                } catch (NumberFormatException ignored) {
                    log.trace("Non-numeric {} value '{}'", field, value.asText());
                }
            }
        }
        return null;
    }

    /**
     * Accepts {@code 2025-09-01} and timestamp forms such as {@code 2025-09-01 10:00:00 +00:00}
     * or {@code 2025-09-01T10:00:00Z}; only the date part is kept.
     */
    private static LocalDate date(JsonNode row, String field) {
        String value = text(row, field);
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static String join(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append(' ');
            }
            joined.append(part);
        }
        return joined.length() == 0 ? null : joined.toString();
    }

    record ParsedPayload(List<RawBacklinkEntry> entries, int skipped) {
    }
}
