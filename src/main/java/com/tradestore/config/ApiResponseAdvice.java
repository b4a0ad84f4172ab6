package com.tradestore.config;

import com.tradestore.api.dto.response.ApiErrorResponse;
import com.tradestore.api.dto.response.ApiResponse;
import java.time.Instant;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Puts store responses into the {@link ApiResponse} envelope.
 *
 * <p>Paths under {@code tradestore.api.unwrapped-paths} (actuator and the servlet error page by
 * default) pass through untouched, as do error bodies and plain strings.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private final StoreConfig storeConfig;

    public ApiResponseAdvice(StoreConfig storeConfig) {
        this.storeConfig = storeConfig;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }
        if (isUnwrapped(request.getURI().getPath())) {
            return body;
        }
        return ApiResponse.wrap(body, Instant.now());
    }

    private boolean isUnwrapped(String path) {
        for (String prefix : storeConfig.getApi().getUnwrappedPaths()) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }
}
