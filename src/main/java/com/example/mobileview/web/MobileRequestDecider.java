package com.example.mobileview.web;

import com.example.mobileview.config.MobileViewProperties;
import com.example.mobileview.detect.MobileUserAgents;
import com.example.mobileview.session.MobileSessionOverrides;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

import java.util.Locale;

/**
 * Decides, per request, whether the response is rendered in the mobile format.
 *
 * <p>A request is mobile when nothing stops it (an XHR under
 * {@code skipXhrRequests}, or {@code skip_mobile=true}) and something asks for
 * it: a {@code FORCE_MOBILE} session override, a mobile user agent, or
 * {@code format=mobile}. A session {@code IGNORE_MOBILE} override is checked
 * separately by the caller and short-circuits everything.</p>
 */
public class MobileRequestDecider {

    static final String XHR_HEADER = "X-Requested-With";
    static final String XHR_VALUE = "XMLHttpRequest";

    private final MobileUserAgents userAgents;
    private final MobileSessionOverrides overrides;
    private final String mobileFormat;
    private final String formatParam;
    private final String skipParam;

    public MobileRequestDecider(MobileUserAgents userAgents,
                                MobileSessionOverrides overrides,
                                MobileViewProperties props) {
        this.userAgents = userAgents;
        this.overrides = overrides;
        this.mobileFormat = props.getMobileFormat();
        this.formatParam = props.getFormatParam();
        this.skipParam = props.getSkipParam();
    }

    public MobileRequestDecider(MobileViewProperties props) {
        this(new MobileUserAgents(props.getUserAgentPattern()),
                new MobileSessionOverrides(props.getSessionAttribute()),
                props);
    }

    public boolean isIgnoredBySession(HttpServletRequest request) {
        return overrides.isIgnored(request);
    }

    public boolean respondAsMobile(HttpServletRequest request, MobileViewOptions options) {
        boolean impediments = stopBecauseXhr(request, options) || stopBecauseParam(request);
        return !impediments
                && (overrides.isForced(request) || isMobileRequest(request) || isMobileFormatParam(request));
    }

    public boolean isMobileRequest(HttpServletRequest request) {
        return userAgents.isMobile(request.getHeader(HttpHeaders.USER_AGENT));
    }

    public boolean isMobileView(HttpServletRequest request) {
        return isMobileFormatParam(request) || mobileFormat.equals(MobileRequests.format(request));
    }

    boolean stopBecauseXhr(HttpServletRequest request, MobileViewOptions options) {
        return options.skipXhrRequests() && isXhr(request);
    }

    boolean stopBecauseParam(HttpServletRequest request) {
        return "true".equals(request.getParameter(skipParam));
    }

    private boolean isMobileFormatParam(HttpServletRequest request) {
        return mobileFormat.equals(request.getParameter(formatParam));
    }

    static boolean isXhr(HttpServletRequest request) {
        String v = request.getHeader(XHR_HEADER);
        return v != null && v.toLowerCase(Locale.ROOT).contains(XHR_VALUE.toLowerCase(Locale.ROOT));
    }

    public String getMobileFormat() {
        return mobileFormat;
    }
}
