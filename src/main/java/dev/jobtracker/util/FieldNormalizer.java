package dev.jobtracker.util;

import org.jsoup.Jsoup;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Text and URL cleanup applied to every field before a job is built.
 */
public final class FieldNormalizer {

    private static final Pattern INVISIBLE_CHARS = Pattern.compile("[\\u200B-\\u200D\\uFEFF]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "trk", "trackingid", "refid", "lipi", "midtoken", "midsig", "eid", "otptoken",
            "ssid", "fccid", "from", "tk", "alid", "gclid", "fbclid", "mc_cid", "mc_eid",
            "ref", "source", "gh_src");

    private FieldNormalizer() {
    }

    /**
     * Strip tracking query parameters and the fragment, keeping the path and any
     * job-identifying parameters (Indeed {@code jk}, Greenhouse {@code gh_jid}).
     */
    public static String cleanUrl(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String trimmed = INVISIBLE_CHARS.matcher(url.trim()).replaceAll("");
        try {
            UriComponents components = UriComponentsBuilder.fromUriString(trimmed).build();
            MultiValueMap<String, String> params = components.getQueryParams();
            UriComponentsBuilder builder = UriComponentsBuilder.newInstance()
                    .uriComponents(components)
                    .fragment(null);
            for (String name : params.keySet()) {
                if (isTrackingParam(name)) {
                    builder.replaceQueryParam(name);
                }
            }
            return builder.build().toUriString();
        } catch (IllegalArgumentException e) {
            int hash = trimmed.indexOf('#');
            return hash >= 0 ? trimmed.substring(0, hash) : trimmed;
        }
    }

    static boolean isTrackingParam(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.startsWith("utm_") || TRACKING_PARAMS.contains(lower);
    }

    /**
     * Collapse whitespace runs (including non-breaking and zero-width characters) and trim.
     */
    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        String visible = INVISIBLE_CHARS.matcher(text).replaceAll("");
        return WHITESPACE.matcher(visible).replaceAll(" ").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    /**
     * Clean then clamp, the usual treatment for a stored text field.
     */
    public static String cleanAndTruncate(String text, int maxLength) {
        return truncate(cleanText(text), maxLength).trim();
    }

    public static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    /**
     * Turn a URL slug into a display name (e.g. "acme-corp" -> "Acme corp").
     */
    public static String formatCompanySlug(String slug) {
        if (slug == null || slug.isBlank()) {
            return "";
        }
        String spaced = slug.replace("-", " ").replace("_", " ").trim();
        if (spaced.length() < 2) {
            return spaced.toUpperCase(Locale.ROOT);
        }
        return spaced.substring(0, 1).toUpperCase(Locale.ROOT) + spaced.substring(1);
    }
}
