package com.example.mobileview.config;

import com.example.mobileview.web.MobileViewInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@RequiredArgsConstructor
public class MobileViewWebConfig implements WebMvcConfigurer {

    private final MobileViewInterceptor mobileViewInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(mobileViewInterceptor)
                .addPathPatterns("/**"); // every request
    }
}
