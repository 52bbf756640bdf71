package com.example.prayer.config;

import com.example.prayer.model.PrayerId;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

@Configuration
public class WebConfig implements WebFluxConfigurer {

    /**
     * Path variables accept prayer names in any case ({@code /fajr}, {@code /FAJR}).
     */
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, PrayerId.class, PrayerId::fromValue);
    }
}
