package com.ephemera.store.config;

import com.ephemera.store.web.ApiKeyInterceptor;
import com.ephemera.store.web.PayloadSizeInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final PayloadSizeInterceptor payloadSizeInterceptor;
    private final ApiKeyInterceptor apiKeyInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(payloadSizeInterceptor);
        registry.addInterceptor(apiKeyInterceptor);
    }
}
