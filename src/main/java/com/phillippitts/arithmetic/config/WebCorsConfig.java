package com.phillippitts.arithmetic.config;

import com.phillippitts.arithmetic.config.logging.MdcFilter;
import com.phillippitts.arithmetic.config.properties.CalculatorProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Applies the configured CORS allow-list to every endpoint, with all methods and headers allowed.
 */
@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private final CalculatorProperties properties;

    public WebCorsConfig(CalculatorProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
                .allowedOrigins(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("*")
                .allowedHeaders("*")
                .exposedHeaders(MdcFilter.REQUEST_ID_HEADER);
    }
}
