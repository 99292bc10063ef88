package com.ephemera.store.web;

import com.ephemera.store.common.constants.StoreConstants;
import com.ephemera.store.common.exception.UnauthenticatedException;
import com.ephemera.store.model.AccessScope;
import com.ephemera.store.service.PermissionCache;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Authenticates the bearer token and, for routes with a {@code {namespace}} path variable,
 * checks the namespace against the token's scope. Batch routes carry namespaces in the body
 * and are checked item by item in the service.
 * <p>
 * The resolved {@link AccessScope} is exposed as a request attribute.
 */
@Component
@RequiredArgsConstructor
public class ApiKeyInterceptor implements HandlerInterceptor {

    private final PermissionCache permissions;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }

        final String token = bearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token == null) {
            throw new UnauthenticatedException("Missing bearer token");
        }
        final AccessScope scope = permissions.resolve(token)
                .orElseThrow(() -> new UnauthenticatedException("Unknown or inactive API key"));
        request.setAttribute(StoreConstants.REQ_ATTR_ACCESS_SCOPE, scope);

        @SuppressWarnings("unchecked")
        final Map<String, String> vars =
                (Map<String, String>) request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        final String namespace = vars == null ? null : vars.get("namespace");
        if (namespace != null) {
            scope.check(namespace);
        }
        return true;
    }

    static String bearerToken(String header) {
        if (header == null || !header.startsWith(StoreConstants.BEARER_PREFIX)) return null;
        final String token = header.substring(StoreConstants.BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
