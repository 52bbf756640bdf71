package com.example.prayer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.WebFilter;
import reactor.core.publisher.Mono;

/**
 * Request/response logging for the WebFlux endpoints.
 */
@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            if (!log.isDebugEnabled()) {
                return chain.filter(exchange);
            }
            long startNanos = System.nanoTime();
            String method = exchange.getRequest().getMethod().name();
            String path = exchange.getRequest().getURI().getPath();
            log.debug("Incoming request: {} {}", method, path);

            return chain.filter(exchange)
                .then(Mono.fromRunnable(() -> log.debug("Completed request: {} {} - {} in {}ms",
                        method,
                        path,
                        exchange.getResponse().getStatusCode(),
                        (System.nanoTime() - startNanos) / 1_000_000)));
        };
    }
}
