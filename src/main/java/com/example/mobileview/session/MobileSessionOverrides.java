package com.example.mobileview.session;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Reads and writes the {@link MobileOverride} flag kept in the host's {@link HttpSession}.
 *
 * <p>Reading never creates a session; writing does.</p>
 */
@Slf4j
public class MobileSessionOverrides {

    private final String attributeName;

    public MobileSessionOverrides(String attributeName) {
        this.attributeName = attributeName;
    }

    public Optional<MobileOverride> current(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        Object raw;
        try {
            raw = session.getAttribute(attributeName);
        } catch (IllegalStateException invalidated) {
            return Optional.empty();
        }
        return MobileOverride.from(raw);
    }

    public boolean isForced(HttpServletRequest request) {
        return current(request).filter(o -> o == MobileOverride.FORCE_MOBILE).isPresent();
    }

    public boolean isIgnored(HttpServletRequest request) {
        return current(request).filter(o -> o == MobileOverride.IGNORE_MOBILE).isPresent();
    }

    public void set(HttpServletRequest request, MobileOverride override) {
        request.getSession(true).setAttribute(attributeName, override);
        log.debug("[mobile-view] session override set to {}", override);
    }

    public void clear(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.removeAttribute(attributeName);
            log.debug("[mobile-view] session override cleared");
        }
    }
}
