package com.example.mobileview.web;

import org.junit.jupiter.api.Test;
import org.springframework.web.method.HandlerMethod;

import static org.junit.jupiter.api.Assertions.*;

class MobileViewOptionsResolverTest {

    private final MobileViewOptionsResolver resolver =
            new MobileViewOptionsResolver(MobileViewOptions.of("html", true));

    @Test
    void unannotatedControllerGetsDefaults() throws Exception {
        MobileViewOptions options = resolver.resolve(handler(new PlainController()));

        assertEquals("html", options.fallBack());
        assertTrue(options.skipXhrRequests());
    }

    @Test
    void annotationOverridesDefaults() throws Exception {
        MobileViewOptions options = resolver.resolve(handler(new AjaxController()));

        assertEquals("txt", options.fallBack());
        assertFalse(options.skipXhrRequests());
    }

    @Test
    void annotationIsInheritedBySubclasses() {
        MobileViewOptions options = resolver.forType(ChildController.class);

        assertEquals("txt", options.fallBack());
        assertFalse(options.skipXhrRequests());
    }

    @Test
    void disabledFallBackNormalizesToNull() {
        MobileViewOptions options = resolver.forType(StrictController.class);

        assertNull(options.fallBack());
        assertTrue(options.fallBackFormat().isEmpty());
        assertNull(MobileViewOptions.of("false", true).fallBack());
        assertNull(MobileViewOptions.of("", true).fallBack());
        assertEquals("html", MobileViewOptions.of(" HTML ", true).fallBack());
    }

    @Test
    void nonControllerHandlersGetDefaults() {
        assertSame(resolver.getDefaults(), resolver.resolve(new Object()));
    }

    @Test
    void optionsAreCachedPerClass() {
        assertSame(resolver.forType(AjaxController.class), resolver.forType(AjaxController.class));
    }

    private static HandlerMethod handler(Object controller) throws NoSuchMethodException {
        return new HandlerMethod(controller, controller.getClass().getMethod("page"));
    }

    public static class PlainController {
        public String page() {
            return "page";
        }
    }

    @MobileViews(fallBack = "txt", skipXhrRequests = false)
    public static class AjaxController {
        public String page() {
            return "page";
        }
    }

    public static class ChildController extends AjaxController {
    }

    @MobileViews(fallBack = MobileViewOptions.NO_FALL_BACK)
    public static class StrictController {
    }
}
