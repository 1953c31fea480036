package com.voucherpay.api.config;

import com.voucherpay.api.infrastructure.web.AuthenticatedUserArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS from {@link CorsProperties} and access-token resolution for
 * {@link com.voucherpay.security.AuthenticatedUser} controller parameters.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CorsProperties cors;
    private final AuthenticatedUserArgumentResolver authenticatedUserResolver;

    public WebConfig(CorsProperties cors, AuthenticatedUserArgumentResolver authenticatedUserResolver) {
        this.cors = cors;
        this.authenticatedUserResolver = authenticatedUserResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(cors.allowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(authenticatedUserResolver);
    }
}
