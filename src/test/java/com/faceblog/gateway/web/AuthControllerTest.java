package com.faceblog.gateway.web;

import com.faceblog.gateway.dto.LogoutRequest;
import com.faceblog.gateway.dto.RefreshRequest;
import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.model.IssuedToken;
import com.faceblog.gateway.service.JwtSessionService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private JwtSessionService jwtSessionService;

    @InjectMocks
    private AuthController authController;

    @Test
    void refresh_ReturnsBearerToken() {
        Instant expiresAt = Instant.parse("2026-03-01T12:15:00Z");
        when(jwtSessionService.refresh("refresh-token"))
                .thenReturn(Mono.just(new IssuedToken("new-access", "jti-1", expiresAt)));

        StepVerifier.create(authController.refresh(new RefreshRequest("refresh-token")))
                .assertNext(response -> {
                    assertThat(response.getStatusCode().value()).isEqualTo(200);
                    assertThat(response.getBody().accessToken()).isEqualTo("new-access");
                    assertThat(response.getBody().tokenType()).isEqualTo("Bearer");
                    assertThat(response.getBody().expiresAt()).isEqualTo(expiresAt);
                })
                .verifyComplete();
    }

    @Test
    void logout_RevokesBothTokens() {
        when(jwtSessionService.revoke("access")).thenReturn(Mono.just(true));
        when(jwtSessionService.revoke("refresh")).thenReturn(Mono.just(true));

        StepVerifier.create(authController.logout("Bearer access", new LogoutRequest("refresh")))
                .assertNext(response -> assertThat(response.getBody())
                        .containsEntry("success", true)
                        .containsEntry("accessTokenRevoked", true)
                        .containsEntry("refreshTokenRevoked", true))
                .verifyComplete();
    }

    @Test
    void logout_AccessTokenOnly() {
        when(jwtSessionService.revoke("access")).thenReturn(Mono.just(false));

        StepVerifier.create(authController.logout("Bearer access", null))
                .assertNext(response -> assertThat(response.getBody())
                        .containsEntry("accessTokenRevoked", false)
                        .containsEntry("refreshTokenRevoked", false))
                .verifyComplete();
    }

    @Test
    void logout_WithoutBearerIsRejected() {
        StepVerifier.create(authController.logout(null, null))
                .expectErrorSatisfies(e -> assertThat(((CredentialException) e).getCode())
                        .isEqualTo(ErrorCode.MISSING_TOKEN))
                .verify();

        verify(jwtSessionService, never()).revoke(anyString());
    }
}
