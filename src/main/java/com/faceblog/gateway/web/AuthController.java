package com.faceblog.gateway.web;

import com.faceblog.gateway.dto.LogoutRequest;
import com.faceblog.gateway.dto.RefreshRequest;
import com.faceblog.gateway.dto.TokenResponse;
import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.service.JwtSessionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Session token endpoints. These sit outside the protected prefixes: the tokens they
 * receive are verified here directly.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {
    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtSessionService jwtSessionService;

    public AuthController(JwtSessionService jwtSessionService) {
        this.jwtSessionService = jwtSessionService;
    }

    /**
     * Exchange a refresh token for a new access token.
     * POST /auth/refresh
     */
    @PostMapping("/refresh")
    public Mono<ResponseEntity<TokenResponse>> refresh(@Valid @RequestBody RefreshRequest request) {
        return jwtSessionService.refresh(request.refreshToken())
                .map(TokenResponse::bearer)
                .map(ResponseEntity::ok);
    }

    /**
     * Revoke the presented access token and, optionally, the refresh token.
     * POST /auth/logout
     */
    @PostMapping("/logout")
    public Mono<ResponseEntity<Map<String, Object>>> logout(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) LogoutRequest request
    ) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)
                || authorization.substring(BEARER_PREFIX.length()).isBlank()) {
            return Mono.error(new CredentialException(ErrorCode.MISSING_TOKEN, "LOGOUT_WITHOUT_TOKEN"));
        }
        String accessToken = authorization.substring(BEARER_PREFIX.length()).trim();

        Mono<Boolean> revokeRefresh = request != null && request.refreshToken() != null
                && !request.refreshToken().isBlank()
                ? jwtSessionService.revoke(request.refreshToken())
                : Mono.just(false);

        return jwtSessionService.revoke(accessToken)
                .flatMap(accessRevoked -> revokeRefresh
                        .map(refreshRevoked -> Map.<String, Object>of(
                                "success", true,
                                "accessTokenRevoked", accessRevoked,
                                "refreshTokenRevoked", refreshRevoked)))
                .doOnSuccess(body -> log.debug("Logout completed: {}", body))
                .map(ResponseEntity::ok);
    }
}
