package com.example.mobileview.view;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * {@link ViewTemplateLocator} backed by a {@link ResourceLoader}: the template
 * for {@code index.mobile} is {@code prefix + "index.mobile" + suffix}.
 */
public class ResourceViewTemplateLocator implements ViewTemplateLocator {

    private final ResourceLoader resourceLoader;
    private final String prefix;
    private final String suffix;

    public ResourceViewTemplateLocator(ResourceLoader resourceLoader, String prefix, String suffix) {
        this.resourceLoader = resourceLoader;
        this.prefix = prefix == null ? "" : prefix;
        this.suffix = suffix == null ? "" : suffix;
    }

    @Override
    public boolean exists(String viewName) {
        Resource resource = resourceLoader.getResource(prefix + viewName + suffix);
        return resource.exists();
    }
}
