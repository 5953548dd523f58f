package com.faceblog.gateway.web;

import com.faceblog.gateway.exception.AuthPipelineException;
import com.faceblog.gateway.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders exceptions raised by handlers (e.g. the token endpoints) in the same body shape
 * as pipeline denials.
 */
@Component
@Order(-2) // before Spring Boot's DefaultErrorWebExceptionHandler
public class GlobalExceptionHandler implements ErrorWebExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final DenialResponseWriter denialResponseWriter;

    public GlobalExceptionHandler(DenialResponseWriter denialResponseWriter) {
        this.denialResponseWriter = denialResponseWriter;
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        if (exchange.getResponse().isCommitted()) {
            log.warn("Response already committed, cannot write error for path={} error={}",
                    exchange.getRequest().getPath(), ex.getMessage());
            return Mono.error(ex);
        }

        String path = exchange.getRequest().getPath().value();

        if (ex instanceof AuthPipelineException denial) {
            if (denial.getCode() == ErrorCode.INTERNAL_ERROR) {
                log.error("Request failed: path={} reason={}", path, denial.getReason(), denial.getCause());
            } else {
                log.warn("Request denied: path={} code={} reason={}", path, denial.getCode(), denial.getReason());
            }
            return denialResponseWriter.write(exchange, denial);
        }

        if (ex instanceof WebExchangeBindException bind) {
            String message = bind.getFieldErrors().stream()
                    .map(error -> error.getField() + ": " + error.getDefaultMessage())
                    .collect(Collectors.joining(", "));
            return denialResponseWriter.write(exchange.getResponse(), HttpStatus.BAD_REQUEST,
                    "VALIDATION_ERROR", message, Map.of());
        }

        if (ex instanceof ResponseStatusException rse) {
            HttpStatus status = HttpStatus.valueOf(rse.getStatusCode().value());
            String message = rse.getReason() != null && !rse.getReason().isBlank()
                    ? rse.getReason()
                    : status.getReasonPhrase();
            log.debug("Request error: status={} path={} error={}", status.value(), path, message);
            return denialResponseWriter.write(exchange.getResponse(), status,
                    status.name(), message, Map.of());
        }

        log.error("Unhandled error: path={} error={}", path, ex.getMessage(), ex);
        return denialResponseWriter.write(exchange.getResponse(), HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorCode.INTERNAL_ERROR.name(), "An unexpected error occurred.", Map.of());
    }
}
