package com.pizzaindex.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for browser dashboards and request logging.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/**")
            .allowedOriginPatterns("*")
            .allowedMethods("GET", "OPTIONS")
            .allowedHeaders("*");
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new RequestLoggingInterceptor());
    }

    /**
     * Logs request duration at DEBUG and any exception that escaped the handlers at ERROR.
     */
    public static class RequestLoggingInterceptor implements HandlerInterceptor {

        private static final Logger log = LoggerFactory.getLogger(RequestLoggingInterceptor.class);
        static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

        @Override
        public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
            request.setAttribute(START_ATTRIBUTE, System.nanoTime());
            return true;
        }

        @Override
        public void afterCompletion(
                HttpServletRequest request,
                HttpServletResponse response,
                Object handler,
                Exception ex) {

            if (ex != null) {
                log.error("Uncaught exception in request {}: {}", request.getRequestURI(), ex.getMessage(), ex);
            }
            if (log.isDebugEnabled()) {
                Object start = request.getAttribute(START_ATTRIBUTE);
                long elapsedMs = start instanceof Long ? (System.nanoTime() - (Long) start) / 1_000_000 : -1;
                log.debug("{} {} -> {} in {} ms", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), elapsedMs);
            }
        }
    }
}
