package com.faceblog.gateway.web;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.model.PresentedCredential;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

/**
 * Finds the credential on a request.
 *
 * Carriers, first match wins:
 * 1. API key header
 * 2. Authorization: Bearer (a three-segment value is a session token, anything else an API key)
 * 3. API key query parameter
 */
@Component
public class CredentialExtractor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final String apiKeyHeader;
    private final String apiKeyQueryParam;
    private final String apiKeyPrefix;

    public CredentialExtractor(GwProperties properties) {
        GwProperties.ApiKeyConfig apiKey = properties.getApiKey();
        this.apiKeyHeader = apiKey.getHeader();
        this.apiKeyQueryParam = apiKey.getQueryParam();
        this.apiKeyPrefix = apiKey.getPrefix();
    }

    /**
     * @throws CredentialException {@code MISSING_TOKEN} for an Authorization header without a
     *                             bearer value, {@code MISSING_API_KEY} when nothing is present
     */
    public PresentedCredential extract(ServerHttpRequest request) {
        HttpHeaders headers = request.getHeaders();

        String headerKey = headers.getFirst(apiKeyHeader);
        if (headerKey != null && !headerKey.isBlank()) {
            return PresentedCredential.apiKey(headerKey.trim());
        }

        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        boolean authorizationPresent = authorization != null && !authorization.isBlank();
        if (authorizationPresent && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String bearer = authorization.substring(BEARER_PREFIX.length()).trim();
            if (bearer.isEmpty()) {
                throw new CredentialException(ErrorCode.MISSING_TOKEN, "EMPTY_BEARER");
            }
            return looksLikeJwt(bearer) ? PresentedCredential.session(bearer) : PresentedCredential.apiKey(bearer);
        }

        String queryKey = request.getQueryParams().getFirst(apiKeyQueryParam);
        if (queryKey != null && !queryKey.isBlank()) {
            return PresentedCredential.apiKey(queryKey.trim());
        }

        if (authorizationPresent) {
            throw new CredentialException(ErrorCode.MISSING_TOKEN, "UNSUPPORTED_AUTH_SCHEME");
        }
        throw new CredentialException(ErrorCode.MISSING_API_KEY, "NO_CREDENTIAL");
    }

    boolean looksLikeJwt(String value) {
        if (value.startsWith(apiKeyPrefix)) {
            return false;
        }
        String[] segments = value.split("\\.", -1);
        if (segments.length != 3) {
            return false;
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
