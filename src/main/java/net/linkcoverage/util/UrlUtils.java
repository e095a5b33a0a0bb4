package net.linkcoverage.util;

import jakarta.annotation.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * URL normalization and host matching used to key, classify and filter backlinks.
 */
public final class UrlUtils {

    private static final Logger log = LoggerFactory.getLogger(UrlUtils.class);
    private static final String WWW_PREFIX = "www.";

    private UrlUtils() {
    }

    /**
     * Canonical form used as a deduplication key: lowercase scheme and host, default port dropped,
     * fragment dropped, trailing slash stripped. A missing scheme is treated as {@code http}.
     *
     * @return normalized URL, or null when the input is blank or not an http(s) URL
     *
     * @example
     * <pre>
     * UrlUtils.normalize("HTTPS://Example.com:443/Blog/") → "https://example.com/Blog"
     * UrlUtils.normalize("example.com/")                 → "http://example.com"
     * UrlUtils.normalize("ftp://example.com")            → null
     * </pre>
     */
    @Nullable
    public static String normalize(@Nullable String url) {
        URI uri = parse(url);
        if (uri == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);

        StringBuilder normalized = new StringBuilder(scheme).append("://").append(host);
        if (!defaultPort) {
            normalized.append(':').append(port);
        }
        String path = uri.getRawPath();
        if (path != null) {
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            normalized.append(path);
        }
        if (uri.getRawQuery() != null && !uri.getRawQuery().isEmpty()) {
            normalized.append('?').append(uri.getRawQuery());
        }
        return normalized.toString();
    }

    /**
     * Lowercase host without a leading {@code www.}, or null when the URL cannot be parsed.
     */
    @Nullable
    public static String extractDomain(@Nullable String url) {
        URI uri = parse(url);
        if (uri == null) {
            return null;
        }
        return stripWww(uri.getHost().toLowerCase(Locale.ROOT));
    }

    /**
     * Accepts either a bare domain ({@code Example.com}) or a URL and returns the bare domain.
     */
    @Nullable
    public static String normalizeDomain(@Nullable String domainOrUrl) {
        if (domainOrUrl == null || domainOrUrl.isBlank()) {
            return null;
        }
        return extractDomain(domainOrUrl.trim());
    }

    /**
     * True when {@code host} is {@code domain} itself or one of its subdomains.
     * {@code news.spam.com} matches {@code spam.com}; {@code notspam.com} does not.
     */
    public static boolean hostMatchesDomain(@Nullable String host, @Nullable String domain) {
        if (host == null || domain == null || host.isBlank() || domain.isBlank()) {
            return false;
        }
        String normalizedHost = stripWww(host.trim().toLowerCase(Locale.ROOT));
        String normalizedDomain = stripWww(domain.trim().toLowerCase(Locale.ROOT));
        return normalizedHost.equals(normalizedDomain) || normalizedHost.endsWith("." + normalizedDomain);
    }

    /**
     * Path component of a URL without trailing slashes; empty string for the root.
     */
    public static String pathOf(@Nullable String url) {
        URI uri = parse(url);
        if (uri == null || uri.getPath() == null) {
            return "";
        }
        String path = uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    /**
     * Same host (ignoring {@code www.}) and same path once trailing slashes are removed.
     */
    public static boolean sameResource(@Nullable String first, @Nullable String second) {
        String firstDomain = extractDomain(first);
        String secondDomain = extractDomain(second);
        if (firstDomain == null || !firstDomain.equals(secondDomain)) {
            return false;
        }
        return pathOf(first).equalsIgnoreCase(pathOf(second));
    }

    public static boolean isHttpUrl(@Nullable String url) {
        return parse(url) != null;
    }

    @Nullable
    private static URI parse(@Nullable String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "http://" + candidate;
        }
        try {
            URI uri = new URI(candidate);
            String scheme = uri.getScheme();
            if (scheme == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
                || uri.getHost() == null) {
                return null;
            }
            return uri;
        } catch (URISyntaxException ex) {
            log.debug("Invalid URL syntax '{}': {}", url, ex.getMessage());
            return null;
        }
    }

    private static String stripWww(String host) {
        return host.startsWith(WWW_PREFIX) ? host.substring(WWW_PREFIX.length()) : host;
    }
}
