package com.faceblog.gateway.model;

public enum TokenType {
    ACCESS,
    REFRESH
}
