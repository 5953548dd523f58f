package com.faceblog.gateway.model;

public record QuotaViolation(String type, long current, long limit) {
}
