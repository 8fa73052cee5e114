package com.flagship.otp_rental.config;

import com.flagship.otp_rental.rental.ServiceType;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Lets query parameters use the wire codes ({@code ?serviceType=tiktok-rental})
 * instead of enum constant names.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, ServiceType.class, ServiceType::fromCode);
    }
}
