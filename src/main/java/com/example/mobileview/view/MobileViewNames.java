package com.example.mobileview.view;

/**
 * Maps a logical view name and a format to a concrete view name.
 * The default format keeps the plain name; any other format is appended,
 * so {@code index} renders as {@code index.mobile} or {@code index.txt}.
 */
public class MobileViewNames {

    private final String defaultFormat;

    public MobileViewNames(String defaultFormat) {
        this.defaultFormat = defaultFormat;
    }

    public String forFormat(String viewName, String format) {
        if (format == null || format.isBlank() || format.equalsIgnoreCase(defaultFormat)) {
            return viewName;
        }
        return viewName + "." + format;
    }
}
