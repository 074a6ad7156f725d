package com.example.mobileview.web;

import com.example.mobileview.view.FallbackViewNameResolver;
import jakarta.servlet.DispatcherType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.view.UrlBasedViewResolver;

/**
 * Switches mobile requests to the mobile view format.
 *
 * <p>{@code preHandle} decides and records the negotiated format on the
 * request; {@code postHandle} rewrites the handler's view name before the
 * view resolvers run, so {@code index} becomes {@code index.mobile} or, when
 * that template is missing, the fall-back format's view. The interceptor never
 * blocks a request. Error dispatches and {@link ErrorController} handlers are
 * left alone; the error page always renders in its own format.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class MobileViewInterceptor implements HandlerInterceptor {

    private final MobileRequestDecider decider;
    private final MobileViewOptionsResolver optionsResolver;
    private final FallbackViewNameResolver viewNameResolver;

    @Override
    public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler) {
        if (isErrorDispatch(req, handler)) {
            return true;
        }
        MobileViewOptions options = optionsResolver.resolve(handler);
        req.setAttribute(MobileRequests.OPTIONS_ATTRIBUTE, options);

        if (decider.isIgnoredBySession(req)) {
            log.debug("[mobile-view] ignored by session override: {}", req.getRequestURI());
        } else if (decider.respondAsMobile(req, options)) {
            req.setAttribute(MobileRequests.FORMAT_ATTRIBUTE, decider.getMobileFormat());
            log.debug("[mobile-view] responding as {}: {}", decider.getMobileFormat(), req.getRequestURI());
        }

        req.setAttribute(MobileRequests.IS_MOBILE_REQUEST, decider.isMobileRequest(req));
        req.setAttribute(MobileRequests.IS_MOBILE_VIEW, decider.isMobileView(req));
        return true;
    }

    @Override
    public void postHandle(HttpServletRequest req, HttpServletResponse res, Object handler, ModelAndView mv) {
        if (mv == null || isErrorDispatch(req, handler)) {
            return;
        }
        String viewName = mv.getViewName();
        if (viewName == null
                || viewName.startsWith(UrlBasedViewResolver.REDIRECT_URL_PREFIX)
                || viewName.startsWith(UrlBasedViewResolver.FORWARD_URL_PREFIX)) {
            return;
        }

        mv.addObject(MobileRequests.IS_MOBILE_REQUEST, MobileRequests.isMobileRequest(req));
        mv.addObject(MobileRequests.IS_MOBILE_VIEW, MobileRequests.isMobileView(req));

        String format = MobileRequests.format(req);
        if (!decider.getMobileFormat().equals(format)) {
            return;
        }
        MobileViewOptions options = MobileRequests.options(req);
        if (options == null) {
            options = optionsResolver.resolve(handler);
        }
        mv.setViewName(viewNameResolver.resolve(viewName, format, options.fallBack()));
    }

    // request attributes of the failed dispatch are still visible here
    static boolean isErrorDispatch(HttpServletRequest req, Object handler) {
        if (req.getDispatcherType() == DispatcherType.ERROR) {
            return true;
        }
        return handler instanceof HandlerMethod method
                && ErrorController.class.isAssignableFrom(method.getBeanType());
    }
}
