package com.example.mobileview.config;

import com.example.mobileview.detect.MobileUserAgents;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for mobile view switching.
 *
 * <p>These are the process-wide defaults. A controller annotated with
 * {@link com.example.mobileview.web.MobileViews} carries its own fall-back
 * format and XHR policy and ignores {@link #fallBack} and
 * {@link #skipXhrRequests}. Bindings are loaded from {@code mobile-view.*}
 * in application.yml or application.properties.</p>
 */
@ConfigurationProperties(prefix = "mobile-view")
public class MobileViewProperties {

    /** Whether the interceptor is registered at all. */
    private boolean enabled = true;

    /** Format rendered when no mobile template exists. {@code none} or {@code false} disables it. */
    private String fallBack = "html";

    /** When {@code true}, XMLHttpRequests are never switched to mobile. */
    private boolean skipXhrRequests = true;

    /** The format whose view name is the plain, unsuffixed one. */
    private String defaultFormat = "html";

    /** The format written onto mobile requests; also the view-name suffix. */
    private String mobileFormat = "mobile";

    /** Request parameter carrying an explicit format, e.g. {@code ?format=mobile}. */
    private String formatParam = "format";

    /** Request parameter that opts a single request out when set to {@code true}. */
    private String skipParam = "skip_mobile";

    /** Session attribute holding the {@link com.example.mobileview.session.MobileOverride}. */
    private String sessionAttribute = "mobile_view_override";

    /** Regex searched in the lower-cased User-Agent header. */
    private String userAgentPattern = MobileUserAgents.DEFAULT_PATTERN;

    /** Location prefix used to check whether a template exists. */
    private String templatePrefix = "classpath:/templates/";

    /** Location suffix used to check whether a template exists. */
    private String templateSuffix = ".html";

    private final OverrideEndpoint overrideEndpoint = new OverrideEndpoint();

    public static class OverrideEndpoint {

        /** Exposes a POST endpoint that sets or clears the session override. */
        private boolean enabled = false;

        private String path = "/mobile-view/override";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getFallBack() {
        return fallBack;
    }

    public void setFallBack(String fallBack) {
        this.fallBack = fallBack;
    }

    public boolean isSkipXhrRequests() {
        return skipXhrRequests;
    }

    public void setSkipXhrRequests(boolean skipXhrRequests) {
        this.skipXhrRequests = skipXhrRequests;
    }

    public String getDefaultFormat() {
        return defaultFormat;
    }

    public void setDefaultFormat(String defaultFormat) {
        this.defaultFormat = defaultFormat;
    }

    public String getMobileFormat() {
        return mobileFormat;
    }

    public void setMobileFormat(String mobileFormat) {
        this.mobileFormat = mobileFormat;
    }

    public String getFormatParam() {
        return formatParam;
    }

    public void setFormatParam(String formatParam) {
        this.formatParam = formatParam;
    }

    public String getSkipParam() {
        return skipParam;
    }

    public void setSkipParam(String skipParam) {
        this.skipParam = skipParam;
    }

    public String getSessionAttribute() {
        return sessionAttribute;
    }

    public void setSessionAttribute(String sessionAttribute) {
        this.sessionAttribute = sessionAttribute;
    }

    public String getUserAgentPattern() {
        return userAgentPattern;
    }

    public void setUserAgentPattern(String userAgentPattern) {
        this.userAgentPattern = userAgentPattern;
    }

    public String getTemplatePrefix() {
        return templatePrefix;
    }

    public void setTemplatePrefix(String templatePrefix) {
        this.templatePrefix = templatePrefix;
    }

    public String getTemplateSuffix() {
        return templateSuffix;
    }

    public void setTemplateSuffix(String templateSuffix) {
        this.templateSuffix = templateSuffix;
    }

    public OverrideEndpoint getOverrideEndpoint() {
        return overrideEndpoint;
    }
}
