package com.example.mobileview.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Request attributes written by {@link MobileViewInterceptor}.
 *
 * <p>The two helper flags are plain request attributes, so JSP/EL and
 * Thymeleaf can read them as {@code ${isMobileRequest}} and
 * {@code ${isMobileView}}. Rendered views also receive them as model
 * attributes.</p>
 */
public final class MobileRequests {

    /** The negotiated format; absent unless the request was switched. */
    public static final String FORMAT_ATTRIBUTE = MobileRequests.class.getName() + ".FORMAT";

    /** The {@link MobileViewOptions} in effect for the handler. */
    public static final String OPTIONS_ATTRIBUTE = MobileRequests.class.getName() + ".OPTIONS";

    /** User agent matched the mobile pattern. */
    public static final String IS_MOBILE_REQUEST = "isMobileRequest";

    /** Request is rendered, or explicitly asked to be rendered, as mobile. */
    public static final String IS_MOBILE_VIEW = "isMobileView";

    private MobileRequests() {
    }

    public static String format(HttpServletRequest request) {
        Object v = request.getAttribute(FORMAT_ATTRIBUTE);
        return v instanceof String s ? s : null;
    }

    public static boolean isMobileRequest(HttpServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(IS_MOBILE_REQUEST));
    }

    public static boolean isMobileView(HttpServletRequest request) {
        return Boolean.TRUE.equals(request.getAttribute(IS_MOBILE_VIEW));
    }

    static MobileViewOptions options(HttpServletRequest request) {
        Object v = request.getAttribute(OPTIONS_ATTRIBUTE);
        return v instanceof MobileViewOptions o ? o : null;
    }
}
