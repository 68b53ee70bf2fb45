package com.delta.adfeed.monitor.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class AdUrlUtils {
    private AdUrlUtils() {
    }

    public static String stripQuery(String href) {
        if (href == null) {
            return null;
        }
        String trimmed = href.trim();
        int cut = trimmed.length();
        int query = trimmed.indexOf('?');
        if (query >= 0) {
            cut = query;
        }
        int fragment = trimmed.indexOf('#');
        if (fragment >= 0 && fragment < cut) {
            cut = fragment;
        }
        return trimmed.substring(0, cut);
    }

    public static String toAbsolute(String baseUrl, String href) {
        String stripped = stripQuery(href);
        if (stripped == null || stripped.isBlank()) {
            return null;
        }
        String lower = stripped.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return stripped;
        }
        if (!stripped.startsWith("/")) {
            stripped = "/" + stripped;
        }
        return baseUrl + stripped;
    }

    public static boolean hasSchemeAndHost(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        URI uri = safeUri(candidate.trim());
        return uri != null
            && uri.getScheme() != null
            && !uri.getScheme().isBlank()
            && uri.getHost() != null
            && !uri.getHost().isBlank();
    }

    /**
     * Marketplace sessions that get bounced to a login or checkpoint page return a 200 with no listings.
     */
    public static boolean isSoftBlockUrl(String finalUrl) {
        if (finalUrl == null) {
            return false;
        }
        String lower = finalUrl.toLowerCase(Locale.ROOT);
        return lower.contains("login") || lower.contains("checkpoint");
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
