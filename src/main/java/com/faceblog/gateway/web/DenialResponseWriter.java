package com.faceblog.gateway.web;

import com.faceblog.gateway.exception.AuthPipelineException;
import com.faceblog.gateway.exception.RateLimitExceededException;
import com.faceblog.gateway.model.RateLimitDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the uniform denial body:
 * <pre>
 * {"success": false, "error": {"message": ..., "code": ..., "timestamp": ..., ...details}}
 * </pre>
 */
@Component
public class DenialResponseWriter {
    private static final Logger log = LoggerFactory.getLogger(DenialResponseWriter.class);

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public DenialResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Mono<Void> write(ServerWebExchange exchange, AuthPipelineException denial) {
        ServerHttpResponse response = exchange.getResponse();
        if (denial instanceof RateLimitExceededException rateLimited) {
            applyRateLimitHeaders(response.getHeaders(), rateLimited.getDecision());
        }
        return write(response, denial.getCode().getStatus(), denial.getCode().name(),
                denial.getMessage(), denial.getDetails());
    }

    public Mono<Void> write(ServerHttpResponse response, HttpStatus status, String code,
                            String message, Map<String, Object> details) {
        if (response.isCommitted()) {
            log.warn("Response already committed, cannot write {} denial", code);
            return Mono.empty();
        }

        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", message);
        error.put("code", code);
        error.put("timestamp", clock.instant().toString());
        if (details != null) {
            error.putAll(details);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize denial body", e);
            bytes = String.format("{\"success\":false,\"error\":{\"message\":\"%s\",\"code\":\"%s\"}}",
                    status.getReasonPhrase(), code).getBytes(StandardCharsets.UTF_8);
        }

        response.setStatusCode(status);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }

    static void applyRateLimitHeaders(HttpHeaders headers, RateLimitDecision decision) {
        headers.set(HEADER_LIMIT, String.valueOf(decision.limit()));
        headers.set(HEADER_REMAINING, String.valueOf(decision.remaining()));
        headers.set(HEADER_RESET, String.valueOf(decision.resetEpochSeconds()));
    }
}
