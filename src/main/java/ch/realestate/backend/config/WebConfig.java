package ch.realestate.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * Cross-origin access for the browser front end. Origins are patterns, so the default {@code *} admits every site
 * and still allows credentialed requests.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final List<String> METHODS = List.of("GET", "POST", "OPTIONS");

    private final List<String> allowedOriginPatterns;

    public WebConfig(@Value("${realestate.cors.allowed-origins:*}") String[] allowedOriginPatterns) {
        this.allowedOriginPatterns = List.of(allowedOriginPatterns);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**").combine(corsConfiguration());
    }

    CorsConfiguration corsConfiguration() {
        CorsConfiguration cors = new CorsConfiguration();
        cors.setAllowedOriginPatterns(allowedOriginPatterns);
        cors.setAllowedMethods(METHODS);
        cors.addAllowedHeader(CorsConfiguration.ALL);
        cors.setAllowCredentials(true);
        cors.setMaxAge(3600L);
        return cors;
    }
}
