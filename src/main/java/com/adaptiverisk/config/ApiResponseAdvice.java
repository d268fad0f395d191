package com.adaptiverisk.config;

import com.adaptiverisk.api.controller.RiskController;
import com.adaptiverisk.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps bodies returned by the engine's REST controllers in {@link ApiResponse}.
 *
 * <p>Scoped to the controller package: actuator endpoints, the error controller and the
 * exception handler's {@code ApiErrorResponse} bodies are never wrapped.
 */
@RestControllerAdvice(basePackageClasses = RiskController.class)
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        // StringHttpMessageConverter can't serialize ApiResponse
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
        if (body instanceof ApiResponse<?>) {
            return body;
        }
        return ApiResponse.of(body);
    }
}
