package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.entity.UserEntity;
import com.faceblog.gateway.exception.AuthPipelineException;
import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.exception.InfrastructureException;
import com.faceblog.gateway.model.IssuedToken;
import com.faceblog.gateway.model.PermissionSet;
import com.faceblog.gateway.model.SessionClaims;
import com.faceblog.gateway.model.SessionUser;
import com.faceblog.gateway.model.TokenPair;
import com.faceblog.gateway.model.TokenType;
import com.faceblog.gateway.repository.UserRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Issues and verifies HS256 session tokens for human callers.
 *
 * <p>Access and refresh tokens are signed with distinct secrets, so a token of one kind can
 * never pass as the other. Every token carries a {@code jti}; logout writes it to the Redis
 * revocation set until the token would have expired anyway.
 */
@Service
public class JwtSessionService {
    private static final Logger log = LoggerFactory.getLogger(JwtSessionService.class);

    static final String CLAIM_TENANT_ID = "tenant_id";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";
    static final String CLAIM_PERMISSIONS = "permissions";
    static final String CLAIM_TOKEN_TYPE = "token_type";

    private static final int MIN_SECRET_BYTES = 32;

    private final CacheService cacheService;
    private final UserRepository userRepository;
    private final Clock clock;
    private final Duration storeTimeout;
    private final Duration accessTtl;
    private final Duration refreshTtl;
    private final String issuer;
    private final String audience;
    private final SecretKey accessKey;
    private final SecretKey refreshKey;
    private final JwtParser accessParser;
    private final JwtParser refreshParser;

    public JwtSessionService(CacheService cacheService,
                             UserRepository userRepository,
                             Clock clock,
                             GwProperties properties) {
        this.cacheService = cacheService;
        this.userRepository = userRepository;
        this.clock = clock;
        this.storeTimeout = properties.getStore().getTimeout();

        GwProperties.JwtConfig jwt = properties.getJwt();
        this.accessTtl = jwt.getAccessTtl();
        this.refreshTtl = jwt.getRefreshTtl();
        this.issuer = jwt.getIssuer();
        this.audience = jwt.getAudience();

        String accessSecret = requireSecret(jwt.getAccessSecret(), "gw.jwt.access-secret");
        String refreshSecret = requireSecret(jwt.getRefreshSecret(), "gw.jwt.refresh-secret");
        if (accessSecret.equals(refreshSecret)) {
            throw new IllegalStateException("gw.jwt.access-secret and gw.jwt.refresh-secret must differ");
        }
        this.accessKey = Keys.hmacShaKeyFor(accessSecret.getBytes(StandardCharsets.UTF_8));
        this.refreshKey = Keys.hmacShaKeyFor(refreshSecret.getBytes(StandardCharsets.UTF_8));
        this.accessParser = parserFor(accessKey);
        this.refreshParser = parserFor(refreshKey);

        log.info("JwtSessionService initialized: issuer={}, accessTtl={}, refreshTtl={}",
                issuer, accessTtl, refreshTtl);
    }

    // ==================== Issuing ====================

    public IssuedToken issueAccessToken(SessionUser user) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(accessTtl);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .id(tokenId)
                .subject(user.userId())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_TENANT_ID, user.tenantId())
                .claim(CLAIM_EMAIL, user.email())
                .claim(CLAIM_ROLE, user.role())
                .claim(CLAIM_PERMISSIONS, new ArrayList<>(user.permissions().asSet()))
                .claim(CLAIM_TOKEN_TYPE, TokenType.ACCESS.name())
                .signWith(accessKey)
                .compact();
        return new IssuedToken(token, tokenId, expiresAt);
    }

    /**
     * Refresh tokens carry only identity: role and permissions are re-read when they are used.
     */
    public IssuedToken issueRefreshToken(SessionUser user) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(refreshTtl);
        String tokenId = UUID.randomUUID().toString();

        String token = Jwts.builder()
                .id(tokenId)
                .subject(user.userId())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .claim(CLAIM_TENANT_ID, user.tenantId())
                .claim(CLAIM_TOKEN_TYPE, TokenType.REFRESH.name())
                .signWith(refreshKey)
                .compact();
        return new IssuedToken(token, tokenId, expiresAt);
    }

    public TokenPair issueTokens(SessionUser user) {
        return new TokenPair(issueAccessToken(user), issueRefreshToken(user));
    }

    // ==================== Verification ====================

    /**
     * Verify an access token: signature, issuer, audience, expiry, then the revocation set.
     * A revocation lookup that fails denies the request.
     */
    public Mono<SessionClaims> verify(String token) {
        return Mono.fromCallable(() -> parse(accessParser, token, TokenType.ACCESS))
                .flatMap(this::ensureNotRevoked);
    }

    /**
     * Exchange a refresh token for a new access token built from the user's current state.
     */
    public Mono<IssuedToken> refresh(String refreshToken) {
        return Mono.fromCallable(() -> parse(refreshParser, refreshToken, TokenType.REFRESH))
                .flatMap(this::ensureNotRevoked)
                .flatMap(claims -> userRepository.findByIdAndTenantId(claims.userId(), claims.tenantId())
                        .timeout(storeTimeout)
                        .onErrorMap(e -> !(e instanceof AuthPipelineException),
                                e -> new InfrastructureException("USER_LOOKUP", e))
                        .filter(UserEntity::isActive)
                        .switchIfEmpty(Mono.error(() -> new CredentialException(
                                ErrorCode.INVALID_TOKEN, CredentialException.REASON_USER_INACTIVE))))
                .map(SessionUser::fromEntity)
                .map(this::issueAccessToken)
                .doOnNext(issued -> log.debug("Refreshed access token {}", issued.tokenId()));
    }

    /**
     * Add an access or refresh token to the revocation set for the rest of its lifetime.
     *
     * @return true when an entry was written, false when the token had already expired
     */
    public Mono<Boolean> revoke(String token) {
        return Mono.fromCallable(() -> parseForRevocation(token))
                .flatMap(claims -> {
                    Instant now = clock.instant();
                    Duration remaining = Duration.between(now, claims.expiresAt());
                    if (remaining.isNegative() || remaining.isZero()) {
                        return Mono.just(false);
                    }
                    return cacheService.revokeToken(claims.tokenId(), now, remaining)
                            .timeout(storeTimeout)
                            .onErrorMap(e -> new InfrastructureException("REVOCATION_WRITE", e))
                            .doOnNext(ok -> log.info("Revoked {} token {} for user {}",
                                    claims.type(), claims.tokenId(), claims.userId()));
                })
                .defaultIfEmpty(false);
    }

    // ==================== Internals ====================

    private SessionClaims parse(JwtParser parser, String token, TokenType expected) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            throw new CredentialException(ErrorCode.INVALID_TOKEN,
                    CredentialException.REASON_TOKEN_EXPIRED, "Token expired", e);
        } catch (SignatureException e) {
            throw new CredentialException(ErrorCode.INVALID_TOKEN,
                    CredentialException.REASON_TOKEN_SIGNATURE, null, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new CredentialException(ErrorCode.INVALID_TOKEN,
                    CredentialException.REASON_TOKEN_MALFORMED, null, e);
        }

        if (!expected.name().equals(claims.get(CLAIM_TOKEN_TYPE, String.class))) {
            throw new CredentialException(ErrorCode.INVALID_TOKEN, CredentialException.REASON_TOKEN_MALFORMED);
        }
        String tenantId = claims.get(CLAIM_TENANT_ID, String.class);
        if (claims.getSubject() == null || tenantId == null || claims.getId() == null) {
            throw new CredentialException(ErrorCode.INVALID_TOKEN, CredentialException.REASON_TOKEN_MALFORMED);
        }
        return toSessionClaims(claims, expected);
    }

    /**
     * Logout accepts both token kinds. Expired tokens yield null (nothing to revoke).
     */
    private SessionClaims parseForRevocation(String token) {
        try {
            return parse(accessParser, token, TokenType.ACCESS);
        } catch (CredentialException accessFailure) {
            if (CredentialException.REASON_TOKEN_EXPIRED.equals(accessFailure.getReason())) {
                return null;
            }
            try {
                return parse(refreshParser, token, TokenType.REFRESH);
            } catch (CredentialException refreshFailure) {
                if (CredentialException.REASON_TOKEN_EXPIRED.equals(refreshFailure.getReason())) {
                    return null;
                }
                throw accessFailure;
            }
        }
    }

    private Mono<SessionClaims> ensureNotRevoked(SessionClaims claims) {
        return cacheService.isTokenRevoked(claims.tokenId())
                .timeout(storeTimeout)
                .onErrorMap(e -> new InfrastructureException("REVOCATION_LOOKUP", e))
                .flatMap(revoked -> Boolean.TRUE.equals(revoked)
                        ? Mono.<SessionClaims>error(new CredentialException(
                                ErrorCode.INVALID_TOKEN, CredentialException.REASON_TOKEN_REVOKED))
                        : Mono.just(claims));
    }

    private SessionClaims toSessionClaims(Claims claims, TokenType type) {
        return new SessionClaims(
                claims.getSubject(),
                claims.get(CLAIM_TENANT_ID, String.class),
                claims.get(CLAIM_EMAIL, String.class),
                claims.get(CLAIM_ROLE, String.class),
                permissionsOf(claims.get(CLAIM_PERMISSIONS)),
                claims.getId(),
                claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                claims.getExpiration().toInstant(),
                type
        );
    }

    private PermissionSet permissionsOf(Object raw) {
        if (!(raw instanceof Collection<?> values)) {
            return PermissionSet.empty();
        }
        List<String> capabilities = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value != null) {
                capabilities.add(value.toString());
            }
        }
        return PermissionSet.of(capabilities);
    }

    private JwtParser parserFor(SecretKey key) {
        return Jwts.parser()
                .verifyWith(key)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    private static String requireSecret(String secret, String property) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(property + " must be set to at least " + MIN_SECRET_BYTES + " bytes");
        }
        return secret;
    }
}
