package com.delta.opportunities.pipeline.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class OpportunityUrlUtils {
    private static final Set<String> TRACKING_PARAMS = Set.of(
        "gclid", "fbclid", "ref", "ref_src", "trk", "trackingid", "source", "src", "mc_cid", "mc_eid"
    );

    private OpportunityUrlUtils() {
    }

    /**
     * Canonical form of a posting URL used for fingerprinting: lower-case scheme and host,
     * no {@code www.} prefix, default ports dropped, no fragment, tracking parameters removed,
     * no trailing slash. Returns {@code null} for anything that is not an absolute http(s) URL.
     */
    public static String canonicalUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        URI uri = safeUri(candidate.trim());
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);

        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = canonicalQuery(uri.getRawQuery());

        StringBuilder out = new StringBuilder();
        // Scheme is folded: http and https copies of a posting are the same posting.
        out.append("https://").append(host);
        if (!defaultPort) {
            out.append(':').append(port);
        }
        out.append(path);
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            String name = pair.contains("=") ? pair.substring(0, pair.indexOf('=')) : pair;
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith("utm_") || TRACKING_PARAMS.contains(lower)) {
                continue;
            }
            kept.add(pair);
        }
        kept.sort(String::compareTo);
        return String.join("&", kept);
    }
}
