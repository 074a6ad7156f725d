package com.example.mobileview.config;

import com.example.mobileview.detect.MobileUserAgents;
import com.example.mobileview.session.MobileSessionOverrides;
import com.example.mobileview.view.FallbackViewNameResolver;
import com.example.mobileview.view.MobileViewNames;
import com.example.mobileview.view.ResourceViewTemplateLocator;
import com.example.mobileview.view.ViewTemplateLocator;
import com.example.mobileview.web.MobileOverrideController;
import com.example.mobileview.web.MobileRequestDecider;
import com.example.mobileview.web.MobileViewInterceptor;
import com.example.mobileview.web.MobileViewOptions;
import com.example.mobileview.web.MobileViewOptionsResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Mobile view switching for Spring MVC.
 *
 * <p>
 * Wires detection, session overrides and view fallback into one
 * {@link MobileViewInterceptor} and registers it for every request. Everything
 * except the interceptor registration can be replaced by declaring a bean of
 * the same type.
 * </p>
 */
@Slf4j
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.web.servlet.WebMvcAutoConfiguration")
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(HandlerInterceptor.class)
@ConditionalOnProperty(name = "mobile-view.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MobileViewProperties.class)
public class MobileViewAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MobileUserAgents mobileUserAgents(MobileViewProperties props) {
        return new MobileUserAgents(props.getUserAgentPattern());
    }

    @Bean
    @ConditionalOnMissingBean
    public MobileSessionOverrides mobileSessionOverrides(MobileViewProperties props) {
        return new MobileSessionOverrides(props.getSessionAttribute());
    }

    @Bean
    @ConditionalOnMissingBean
    public MobileRequestDecider mobileRequestDecider(MobileUserAgents userAgents,
                                                     MobileSessionOverrides overrides,
                                                     MobileViewProperties props) {
        return new MobileRequestDecider(userAgents, overrides, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public MobileViewOptionsResolver mobileViewOptionsResolver(MobileViewProperties props) {
        MobileViewOptions defaults = MobileViewOptions.of(props.getFallBack(), props.isSkipXhrRequests());
        log.info("[mobile-view] defaults fallBack={} skipXhrRequests={}",
                defaults.fallBackFormat().orElse(MobileViewOptions.NO_FALL_BACK), defaults.skipXhrRequests());
        return new MobileViewOptionsResolver(defaults);
    }

    @Bean
    @ConditionalOnMissingBean
    public ViewTemplateLocator viewTemplateLocator(ResourceLoader resourceLoader, MobileViewProperties props) {
        return new ResourceViewTemplateLocator(resourceLoader, props.getTemplatePrefix(), props.getTemplateSuffix());
    }

    @Bean
    @ConditionalOnMissingBean
    public FallbackViewNameResolver fallbackViewNameResolver(ViewTemplateLocator locator, MobileViewProperties props) {
        return new FallbackViewNameResolver(locator, new MobileViewNames(props.getDefaultFormat()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MobileViewInterceptor mobileViewInterceptor(MobileRequestDecider decider,
                                                       MobileViewOptionsResolver optionsResolver,
                                                       FallbackViewNameResolver viewNameResolver) {
        return new MobileViewInterceptor(decider, optionsResolver, viewNameResolver);
    }

    @Bean
    public MobileViewWebConfig mobileViewWebConfig(MobileViewInterceptor mobileViewInterceptor) {
        return new MobileViewWebConfig(mobileViewInterceptor);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "mobile-view.override-endpoint.enabled", havingValue = "true")
    public MobileOverrideController mobileOverrideController(MobileSessionOverrides overrides) {
        return new MobileOverrideController(overrides);
    }
}
