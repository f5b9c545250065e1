package com.wpanther.greengoods.config;

import com.wpanther.greengoods.service.CredentialVault;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jcajce.provider.digest.SHA256;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * Configuration for the custodial key vault
 */
@Configuration
@Slf4j
public class CredentialVaultConfig {

    @Value("${app.vault.master-secret:}")
    private String masterSecret;

    @Value("${app.vault.fallback-secret:}")
    private String fallbackSecret;

    @Value("${app.vault.pbkdf2-iterations:100000}")
    private int iterations;

    /**
     * Creates the vault from the master secret, or from the hashed fallback secret in degraded mode
     *
     * @return CredentialVault used by the storage adapter
     */
    @Bean
    public CredentialVault credentialVault(SecureRandom secureRandom) {
        return new CredentialVault(resolveSecret(masterSecret, fallbackSecret), iterations, secureRandom);
    }

    static String resolveSecret(String masterSecret, String fallbackSecret) {
        if (masterSecret != null && !masterSecret.isEmpty()) {
            log.info("Credential vault initialized with configured master secret");
            return masterSecret;
        }
        if (fallbackSecret != null && !fallbackSecret.isEmpty()) {
            log.warn("app.vault.master-secret is not set; deriving the vault key from app.vault.fallback-secret. "
                    + "Configure a dedicated master secret for production.");
            SHA256.Digest digest = new SHA256.Digest();
            return Hex.toHexString(digest.digest(fallbackSecret.getBytes(StandardCharsets.UTF_8)));
        }
        throw new IllegalStateException(
            "No vault secret configured. Set app.vault.master-secret (or app.vault.fallback-secret).");
    }
}
