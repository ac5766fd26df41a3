package com.accessgate.backend.global.config;

import com.accessgate.backend.global.security.ActionAuthorizationInterceptor;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final ActionAuthorizationInterceptor actionAuthorizationInterceptor;

    public WebMvcConfig(ActionAuthorizationInterceptor actionAuthorizationInterceptor) {
        this.actionAuthorizationInterceptor = actionAuthorizationInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(actionAuthorizationInterceptor).addPathPatterns("/api/**");
    }
}
