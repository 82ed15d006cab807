package com.mlregistry.dataset.config;

import com.mlregistry.dataset.stream.OffsetPolicy;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web configuration for the dataset service
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    /**
     * Accept offset policies case-insensitively in query parameters
     */
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, OffsetPolicy.class, OffsetPolicy::fromValue);
    }
}
