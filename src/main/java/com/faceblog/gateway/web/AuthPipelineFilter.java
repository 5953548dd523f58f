package com.faceblog.gateway.web;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.exception.AuthPipelineException;
import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.InfrastructureException;
import com.faceblog.gateway.model.AuthContext;
import com.faceblog.gateway.model.AuthRequest;
import com.faceblog.gateway.model.RequestSummary;
import com.faceblog.gateway.model.RouteRequirement;
import com.faceblog.gateway.model.UsageWarning;
import com.faceblog.gateway.service.AuthPipeline;
import com.faceblog.gateway.service.UsageLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;

/**
 * Runs protected paths through the {@link AuthPipeline}.
 * On success the {@link AuthContext} is published as exchange attribute and in the Reactor
 * context, and rate-limit and usage headers are set. On denial the uniform error body is
 * written and the handler is never invoked. Routes with optional authentication are served
 * anonymously when the credential is missing or invalid; every other denial still applies.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AuthPipelineFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(AuthPipelineFilter.class);

    static final String HEADER_USAGE_WARNING = "X-Usage-Warning";
    static final String HEADER_USAGE_CURRENT = "X-Usage-Current";
    static final String HEADER_USAGE_LIMIT = "X-Usage-Limit";

    private final AuthPipeline authPipeline;
    private final CredentialExtractor credentialExtractor;
    private final RoutePolicy routePolicy;
    private final UsageLogService usageLogService;
    private final DenialResponseWriter denialResponseWriter;
    private final String tenantHeader;

    public AuthPipelineFilter(AuthPipeline authPipeline,
                              CredentialExtractor credentialExtractor,
                              RoutePolicy routePolicy,
                              UsageLogService usageLogService,
                              DenialResponseWriter denialResponseWriter,
                              GwProperties properties) {
        this.authPipeline = authPipeline;
        this.credentialExtractor = credentialExtractor;
        this.routePolicy = routePolicy;
        this.usageLogService = usageLogService;
        this.denialResponseWriter = denialResponseWriter;
        this.tenantHeader = properties.getTenancy().getTenantHeader();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().pathWithinApplication().value();

        if (!routePolicy.isProtected(path)) {
            return chain.filter(exchange);
        }

        RouteRequirement requirement = routePolicy.requirementFor(request.getMethod(), path);

        return Mono.fromCallable(() -> credentialExtractor.extract(request))
                .map(credential -> new AuthRequest(
                        credential,
                        request.getHeaders().getFirst(tenantHeader),
                        request.getHeaders().getFirst(HttpHeaders.HOST),
                        requirement))
                .flatMap(authPipeline::authenticate)
                .onErrorMap(e -> !(e instanceof AuthPipelineException),
                        e -> new InfrastructureException("UNEXPECTED", e))
                .onErrorResume(e -> requirement.optionalAuth() && e instanceof CredentialException,
                        e -> anonymous(exchange, chain, (CredentialException) e).then(Mono.<AuthContext>empty()))
                .onErrorResume(AuthPipelineException.class,
                        e -> deny(exchange, e).then(Mono.<AuthContext>empty()))
                .flatMap(context -> proceed(exchange, chain, context));
    }

    private Mono<Void> proceed(ServerWebExchange exchange, WebFilterChain chain, AuthContext context) {
        exchange.getAttributes().put(AuthContext.ATTRIBUTE, context);
        applySuccessHeaders(exchange.getResponse().getHeaders(), context);

        return chain.filter(exchange)
                .contextWrite(ctx -> ctx.put(AuthContext.ATTRIBUTE, context))
                .then(Mono.fromRunnable(() -> usageLogService.recordAsync(context, summarize(exchange))));
    }

    private Mono<Void> anonymous(ServerWebExchange exchange, WebFilterChain chain, CredentialException e) {
        ServerHttpRequest request = exchange.getRequest();
        log.debug("Serving {} {} anonymously: {}", request.getMethod(), request.getPath(), e.getReason());
        return chain.filter(exchange);
    }

    private void applySuccessHeaders(HttpHeaders headers, AuthContext context) {
        if (context.getRateLimit() != null) {
            DenialResponseWriter.applyRateLimitHeaders(headers, context.getRateLimit());
        }
        UsageWarning warning = context.getUsageWarning();
        if (warning != null) {
            headers.set(HEADER_USAGE_WARNING, warning.headerValue());
            headers.set(HEADER_USAGE_CURRENT, String.valueOf(warning.current()));
            headers.set(HEADER_USAGE_LIMIT, String.valueOf(warning.limit()));
        }
    }

    private Mono<Void> deny(ServerWebExchange exchange, AuthPipelineException denial) {
        ServerHttpRequest request = exchange.getRequest();
        if (denial instanceof InfrastructureException) {
            log.error("Auth pipeline failure on {} {}: {}", request.getMethod(), request.getPath(),
                    denial.getReason(), denial.getCause());
        } else {
            log.warn("Denied {} {} from {}: {} ({})", request.getMethod(), request.getPath(),
                    getClientIp(exchange), denial.getCode(), denial.getReason());
        }
        return denialResponseWriter.write(exchange, denial);
    }

    private RequestSummary summarize(ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        HttpStatusCode status = exchange.getResponse().getStatusCode();
        return new RequestSummary(
                request.getMethod().name(),
                request.getPath().pathWithinApplication().value(),
                status != null ? status.value() : 200,
                getClientIp(exchange),
                request.getHeaders().getFirst(HttpHeaders.USER_AGENT)
        );
    }

    /**
     * Get client IP address from request.
     */
    private String getClientIp(ServerWebExchange exchange) {
        // Check for proxy headers
        String forwardedFor = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }

        String realIp = exchange.getRequest().getHeaders().getFirst("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }

        InetSocketAddress remoteAddress = exchange.getRequest().getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }

        return "unknown";
    }
}
