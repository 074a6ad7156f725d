package com.example.mobileview.session;

import java.util.Locale;
import java.util.Optional;

/**
 * Per-session switch that wins over user-agent detection.
 * An absent attribute means no override.
 */
public enum MobileOverride {

    /** Render every request of the session as mobile. */
    FORCE_MOBILE,

    /** Leave every request of the session untouched, even {@code format=mobile}. */
    IGNORE_MOBILE;

    /**
     * Accepts the enum itself or its name in any case, e.g. {@code "force_mobile"}.
     */
    public static Optional<MobileOverride> from(Object raw) {
        if (raw instanceof MobileOverride o) {
            return Optional.of(o);
        }
        if (raw instanceof String s && !s.isBlank()) {
            String key = s.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (MobileOverride o : values()) {
                if (o.name().equals(key)) {
                    return Optional.of(o);
                }
            }
        }
        return Optional.empty();
    }
}
