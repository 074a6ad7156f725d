package com.example.mobileview.web;

import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * Resolved settings for one controller class.
 *
 * @param fallBack        normalized fall-back format, {@code null} when disabled
 * @param skipXhrRequests whether ajax requests bypass detection
 */
public record MobileViewOptions(String fallBack, boolean skipXhrRequests) {

    public static final String NO_FALL_BACK = "none";

    public MobileViewOptions {
        fallBack = normalize(fallBack);
    }

    public static MobileViewOptions of(String fallBack, boolean skipXhrRequests) {
        return new MobileViewOptions(fallBack, skipXhrRequests);
    }

    public Optional<String> fallBackFormat() {
        return Optional.ofNullable(fallBack);
    }

    private static String normalize(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String v = raw.trim().toLowerCase(Locale.ROOT);
        if (NO_FALL_BACK.equals(v) || "false".equals(v)) {
            return null;
        }
        return v;
    }
}
