package com.example.mobileview.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Per-controller mobile view settings.
 *
 * <pre>
 * &#64;Controller
 * &#64;MobileViews(fallBack = "html", skipXhrRequests = false)
 * public class StoreController { ... }
 * </pre>
 *
 * Controllers without the annotation use the {@code mobile-view.*} defaults.
 * Subclasses inherit the settings of an annotated base controller.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
public @interface MobileViews {

    /**
     * Format rendered when the mobile template is missing.
     * Use {@link MobileViewOptions#NO_FALL_BACK} to fail instead.
     */
    String fallBack() default "html";

    /**
     * Leave XMLHttpRequests alone. Turn off for ajax-driven mobile front ends
     * that expect mobile fragments back.
     */
    boolean skipXhrRequests() default true;
}
