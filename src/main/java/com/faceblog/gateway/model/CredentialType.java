package com.faceblog.gateway.model;

public enum CredentialType {
    API_KEY,
    SESSION
}
