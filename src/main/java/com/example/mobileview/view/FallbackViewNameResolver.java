package com.example.mobileview.view;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the view name to render for a switched format: the format-specific
 * template when it exists, otherwise the fall-back format's view.
 */
@Slf4j
@RequiredArgsConstructor
public class FallbackViewNameResolver {

    private final ViewTemplateLocator locator;
    private final MobileViewNames names;

    /**
     * @param viewName the logical view name returned by the handler
     * @param format   the negotiated format, e.g. {@code mobile}
     * @param fallBack the fall-back format, {@code null} when disabled
     * @throws MobileViewNotFoundException when the template is missing and there is no fall-back
     */
    public String resolve(String viewName, String format, String fallBack) {
        String candidate = names.forFormat(viewName, format);
        if (locator.exists(candidate)) {
            return candidate;
        }
        if (fallBack == null) {
            log.warn("[mobile-view] no '{}' template for view '{}' and fallback disabled", format, viewName);
            throw new MobileViewNotFoundException(viewName, format);
        }
        String fallBackName = names.forFormat(viewName, fallBack);
        log.debug("[mobile-view] '{}' missing, falling back to '{}'", candidate, fallBackName);
        return fallBackName;
    }
}
