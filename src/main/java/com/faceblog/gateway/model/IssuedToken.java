package com.faceblog.gateway.model;

import java.time.Instant;

public record IssuedToken(String token, String tokenId, Instant expiresAt) {
}
