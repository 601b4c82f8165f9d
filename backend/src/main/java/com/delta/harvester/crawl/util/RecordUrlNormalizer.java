package com.delta.harvester.crawl.util;

import com.delta.harvester.config.HarvesterProperties;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw listing hrefs into identity keys: absolute, query/fragment free, no trailing slash,
 * and restricted to {@code <prefix><slug>} paths on the listing host.
 */
public final class RecordUrlNormalizer {
    private static final Pattern SLUG = Pattern.compile("[a-z0-9-]+");

    private final URI base;
    private final String baseHost;
    private final String pathPrefix;
    private final Set<String> reservedSlugs;

    public RecordUrlNormalizer(String baseUrl, String pathPrefix, List<String> reservedSlugs) {
        URI parsed = safeUri(baseUrl);
        if (parsed == null || parsed.getHost() == null) {
            throw new IllegalArgumentException("Listing URL must be absolute: " + baseUrl);
        }
        this.base = parsed;
        this.baseHost = parsed.getHost().toLowerCase(Locale.ROOT);
        this.pathPrefix = pathPrefix;
        this.reservedSlugs = Set.copyOf(reservedSlugs);
    }

    public static RecordUrlNormalizer forListing(HarvesterProperties.Listing listing) {
        return new RecordUrlNormalizer(listing.getUrl(), listing.getRecordPathPrefix(), listing.getReservedSlugs());
    }

    public Optional<String> normalize(String rawHref) {
        if (rawHref == null || rawHref.isBlank()) {
            return Optional.empty();
        }
        URI resolved;
        try {
            resolved = base.resolve(rawHref.trim());
        } catch (IllegalArgumentException ignored) {
            return Optional.empty();
        }
        String scheme = resolved.getScheme();
        if (scheme == null || (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))) {
            return Optional.empty();
        }
        String host = resolved.getHost();
        if (host == null || !baseHost.equals(host.toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String path = stripTrailingSlashes(resolved.getRawPath() == null ? "" : resolved.getRawPath());
        if (!path.startsWith(pathPrefix)) {
            return Optional.empty();
        }
        String slug = path.substring(pathPrefix.length());
        if (!SLUG.matcher(slug).matches() || reservedSlugs.contains(slug)) {
            return Optional.empty();
        }
        String port = resolved.getPort() < 0 ? "" : ":" + resolved.getPort();
        return Optional.of(scheme.toLowerCase(Locale.ROOT) + "://" + baseHost + port + path);
    }

    static String stripTrailingSlashes(String path) {
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(0, end);
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
