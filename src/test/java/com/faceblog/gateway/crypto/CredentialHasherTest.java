package com.faceblog.gateway.crypto;

import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialHasherTest {

    private CredentialHasher hasher;

    @BeforeEach
    void setUp() {
        hasher = new CredentialHasher(Fixtures.properties());
    }

    @Test
    void hash_IsSha256Hex() {
        assertThat(hasher.hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void hash_IsDeterministic() {
        assertThat(hasher.hash(Fixtures.ACME_KEY)).isEqualTo(hasher.hash(Fixtures.ACME_KEY));
    }

    @Test
    void hash_DistinctKeysDistinctDigests() {
        String other = Fixtures.ACME_KEY.substring(0, Fixtures.ACME_KEY.length() - 1) + "0";

        assertThat(hasher.hash(other)).isNotEqualTo(hasher.hash(Fixtures.ACME_KEY));
    }

    @Test
    void hash_BlankRejected() {
        assertThatThrownBy(() -> hasher.hash("  "))
                .isInstanceOf(CredentialException.class)
                .satisfies(e -> assertThat(((CredentialException) e).getCode()).isEqualTo(ErrorCode.INVALID_FORMAT));
        assertThatThrownBy(() -> hasher.hash(null)).isInstanceOf(CredentialException.class);
    }

    @Test
    void isValidKeyFormat() {
        assertThat(hasher.isValidKeyFormat(Fixtures.ACME_KEY)).isTrue();
        assertThat(hasher.isValidKeyFormat("fb_my-blog_" + "ab".repeat(32))).isTrue();

        assertThat(hasher.isValidKeyFormat("fb_acme_0123")).isFalse();
        assertThat(hasher.isValidKeyFormat("xx_acme_" + "ab".repeat(32))).isFalse();
        assertThat(hasher.isValidKeyFormat("fb_acme_" + "zz".repeat(32))).isFalse();
        assertThat(hasher.isValidKeyFormat(null)).isFalse();
    }

    @Test
    void extractPrefix_MasksRest() {
        assertThat(hasher.extractPrefix(Fixtures.ACME_KEY)).isEqualTo("fb_acme...");
        assertThat(hasher.extractPrefix("fb_")).isEqualTo("****");
    }
}
