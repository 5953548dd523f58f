package com.faceblog.gateway.web;

import com.faceblog.gateway.dto.ContextResponse;
import com.faceblog.gateway.model.AuthContext;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Echoes the authenticated context back to the caller. Useful for checking which tenant and
 * permissions a key or token resolves to.
 */
@RestController
public class ContextController {

    @GetMapping("/api/context")
    public Mono<ContextResponse> context(ServerWebExchange exchange) {
        AuthContext context = exchange.getAttribute(AuthContext.ATTRIBUTE);
        if (context == null) {
            return Mono.error(new IllegalStateException("No auth context on a protected route"));
        }
        return Mono.just(ContextResponse.from(context));
    }
}
