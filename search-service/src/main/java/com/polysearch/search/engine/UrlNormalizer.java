package com.polysearch.search.engine;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the deduplication key for a result URL. Case, a leading {@code www.} host label, one trailing
 * slash and common tracking parameters do not contribute to the key.
 */
public final class UrlNormalizer {

    static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source",
            "utm_medium",
            "utm_campaign",
            "utm_term",
            "utm_content",
            "fbclid",
            "gclid"
    );

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        String lowered = url == null ? "" : url.trim().toLowerCase(Locale.ROOT);
        try {
            URI uri = new URI(lowered);
            if (uri.getScheme() == null || uri.getHost() == null) {
                return fallback(lowered);
            }
            StringBuilder out = new StringBuilder(lowered.length());
            out.append(uri.getScheme()).append("://");
            if (uri.getRawUserInfo() != null) {
                out.append(uri.getRawUserInfo()).append('@');
            }
            out.append(stripWww(uri.getHost()));
            if (uri.getPort() != -1) {
                out.append(':').append(uri.getPort());
            }
            out.append(stripTrailingSlash(uri.getRawPath() == null ? "" : uri.getRawPath()));
            String query = stripTrackingParams(uri.getRawQuery());
            if (!query.isEmpty()) {
                out.append('?').append(query);
            }
            if (uri.getRawFragment() != null) {
                out.append('#').append(uri.getRawFragment());
            }
            return out.toString();
        } catch (URISyntaxException ex) {
            return fallback(lowered);
        }
    }

    // unparseable input keeps its text, minus the www. prefix and trailing slash
    private static String fallback(String lowered) {
        return stripTrailingSlash(stripWww(lowered));
    }

    private static String stripWww(String value) {
        return value.startsWith("www.") ? value.substring(4) : value;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private static String stripTrackingParams(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        StringBuilder kept = new StringBuilder(rawQuery.length());
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (TRACKING_PARAMS.contains(name)) {
                continue;
            }
            if (kept.length() > 0) {
                kept.append('&');
            }
            kept.append(pair);
        }
        return kept.toString();
    }
}
