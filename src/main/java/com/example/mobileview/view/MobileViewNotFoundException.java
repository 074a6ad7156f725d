package com.example.mobileview.view;

/**
 * Thrown when a request was switched to a format whose template does not
 * exist and fallback is disabled for the controller.
 */
public class MobileViewNotFoundException extends RuntimeException {

    private final String viewName;
    private final String format;

    public MobileViewNotFoundException(String viewName, String format) {
        super("No template for view '" + viewName + "' in format '" + format + "' and fallback is disabled");
        this.viewName = viewName;
        this.format = format;
    }

    public String getViewName() {
        return viewName;
    }

    public String getFormat() {
        return format;
    }
}
