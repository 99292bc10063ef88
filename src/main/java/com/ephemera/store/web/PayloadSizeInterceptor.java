package com.ephemera.store.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs requests whose declared body size exceeds the warning threshold. Never rejects.
 */
@Component
@Slf4j
public class PayloadSizeInterceptor implements HandlerInterceptor {

    private final long warnBytes;

    public PayloadSizeInterceptor(@Value("${ephemera.payload.warn-bytes:1048576}") long warnBytes) {
        this.warnBytes = warnBytes;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        final long size = request.getContentLengthLong();
        if (size > warnBytes) {
            log.warn("Request payload size ({} MB) to {} {} exceeds {} byte warning threshold",
                    String.format("%.2f", size / (1024.0 * 1024.0)), request.getMethod(), request.getRequestURI(), warnBytes);
        }
        return true;
    }
}
