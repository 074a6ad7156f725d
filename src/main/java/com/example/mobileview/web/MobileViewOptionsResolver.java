package com.example.mobileview.web;

import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;
import org.springframework.web.method.HandlerMethod;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up the {@link MobileViewOptions} for a handler.
 *
 * <p>Options are read from {@link MobileViews} once per controller class and
 * cached; handlers that are not controller methods (static resources,
 * functional endpoints) get the defaults.</p>
 */
public class MobileViewOptionsResolver {

    private final MobileViewOptions defaults;
    private final Map<Class<?>, MobileViewOptions> byType = new ConcurrentHashMap<>();

    public MobileViewOptionsResolver(MobileViewOptions defaults) {
        this.defaults = defaults;
    }

    public MobileViewOptions resolve(Object handler) {
        if (handler instanceof HandlerMethod method) {
            return forType(method.getBeanType());
        }
        return defaults;
    }

    public MobileViewOptions forType(Class<?> type) {
        return byType.computeIfAbsent(ClassUtils.getUserClass(type), this::read);
    }

    public MobileViewOptions getDefaults() {
        return defaults;
    }

    private MobileViewOptions read(Class<?> type) {
        MobileViews ann = AnnotatedElementUtils.findMergedAnnotation(type, MobileViews.class);
        if (ann == null) {
            return defaults;
        }
        return MobileViewOptions.of(ann.fallBack(), ann.skipXhrRequests());
    }
}
