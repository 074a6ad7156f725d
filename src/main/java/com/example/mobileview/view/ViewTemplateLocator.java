package com.example.mobileview.view;

/**
 * Answers whether a template backs a given view name.
 *
 * <p>Spring view resolvers do not reliably report missing templates (an
 * {@code InternalResourceViewResolver} always returns a view), so fallback
 * decisions are made against this lookup instead.</p>
 */
@FunctionalInterface
public interface ViewTemplateLocator {

    boolean exists(String viewName);
}
