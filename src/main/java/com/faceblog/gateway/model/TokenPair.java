package com.faceblog.gateway.model;

public record TokenPair(IssuedToken accessToken, IssuedToken refreshToken) {
}
