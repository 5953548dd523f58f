package com.faceblog.gateway.crypto;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.ErrorCode;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Turns raw API keys into the lookup value stored in {@code api_key.key_hash}.
 * Keys have the form {@code fb_<tenant-slug>_<64 hex chars>} (256 bits of randomness)
 * and are stored as unsalted SHA-256 hex digests so they can be found by equality.
 */
@Service
public class CredentialHasher {

    private static final int RANDOM_HEX_LENGTH = 64;

    private final String keyPrefix;
    private final Pattern keyPattern;

    public CredentialHasher(GwProperties properties) {
        this.keyPrefix = properties.getApiKey().getPrefix();
        this.keyPattern = Pattern.compile(
                "^" + Pattern.quote(keyPrefix) + "[a-zA-Z0-9_-]+_[a-fA-F0-9]{" + RANDOM_HEX_LENGTH + "}$");
    }

    /**
     * Hash an API key using SHA-256.
     *
     * @param rawKey The plaintext API key
     * @return 64-character hex string (256 bits)
     * @throws CredentialException if the key is null or blank
     */
    public String hash(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            throw new CredentialException(ErrorCode.INVALID_FORMAT, "EMPTY_CREDENTIAL");
        }
        return sha256Hex(rawKey);
    }

    /**
     * Validate API key format.
     *
     * @param rawKey The API key to validate
     * @return true if valid format
     */
    public boolean isValidKeyFormat(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        return keyPattern.matcher(rawKey).matches();
    }

    /**
     * Display prefix of a key for logs: the configured prefix plus four characters.
     */
    public String extractPrefix(String rawKey) {
        int visible = keyPrefix.length() + 4;
        if (rawKey == null || rawKey.length() < visible) {
            return "****";
        }
        return rawKey.substring(0, visible) + "...";
    }

    private String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
