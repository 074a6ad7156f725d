package com.example.mobileview.detect;

import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * User-agent matching for mobile devices.
 *
 * <p>This is a plain substring alternation over lower-cased user-agent tokens,
 * not a device database. Anything the pattern does not hit is treated as a
 * desktop browser, including a missing header.</p>
 */
public final class MobileUserAgents {

    /** Lower-case device tokens, joined as a regex alternation. */
    public static final String DEFAULT_PATTERN =
            "palm|blackberry|nokia|phone|midp|mobi|symbian|chtml|ericsson|minimo|"
            + "audiovox|motorola|samsung|telit|upg1|windows ce|ucweb|astel|plucker|"
            + "x320|x240|j2me|sgh|portable|sprint|docomo|kddi|softbank|android|mmp|"
            + "pdxgw|netfront|xiino|vodafone|portalmmm|sagem|mot-|sie-|ipod|up\\.b|"
            + "webos|amoi|novarra|cdm|alcatel|pocket|iphone|mobileexplorer|mobile|opera mini";

    private static final MobileUserAgents DEFAULT = new MobileUserAgents(DEFAULT_PATTERN);

    private final Pattern pattern;

    public MobileUserAgents(String pattern) {
        this.pattern = Pattern.compile(StringUtils.hasText(pattern) ? pattern : DEFAULT_PATTERN,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public static MobileUserAgents defaults() {
        return DEFAULT;
    }

    public boolean isMobile(String userAgent) {
        if (!StringUtils.hasText(userAgent)) {
            return false;
        }
        return pattern.matcher(userAgent.toLowerCase(Locale.ROOT)).find();
    }

    public String pattern() {
        return pattern.pattern();
    }
}
