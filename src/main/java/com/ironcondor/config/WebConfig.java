package com.ironcondor.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AnalyticsProperties analyticsProperties;

    public WebConfig(AnalyticsProperties analyticsProperties) {
        this.analyticsProperties = analyticsProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(analyticsProperties.getCors().getAllowedOrigin())
                .allowedMethods("*")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
