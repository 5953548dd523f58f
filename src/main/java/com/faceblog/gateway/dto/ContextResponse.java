package com.faceblog.gateway.dto;

import com.faceblog.gateway.model.AuthContext;

import java.util.List;

/**
 * Who the gateway thinks the caller is.
 */
public record ContextResponse(
        String tenantId,
        String tenantSlug,
        String plan,
        String credentialType,
        String apiKeyId,
        String userId,
        String role,
        List<String> permissions
) {
    public static ContextResponse from(AuthContext context) {
        return new ContextResponse(
                context.getTenantId(),
                context.getTenant().slug(),
                context.getTenant().plan(),
                context.getCredentialType().name(),
                context.getApiKeyId(),
                context.getUserId(),
                context.getRole(),
                List.copyOf(context.getPermissions().asSet())
        );
    }
}
