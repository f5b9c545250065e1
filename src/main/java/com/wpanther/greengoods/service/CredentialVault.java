package com.wpanther.greengoods.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wpanther.greengoods.dto.EncryptedSecret;
import com.wpanther.greengoods.dto.KeyMigrationResult;
import com.wpanther.greengoods.exception.CredentialVaultException;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.spec.KeySpec;
import java.util.Arrays;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * Authenticated encryption of custodial keys at rest.
 * AES-256-GCM with a PBKDF2-HMAC-SHA256 key derived per encryption from the master secret and a fresh salt.
 */
@Slf4j
public class CredentialVault {

    public static final int ENVELOPE_VERSION = 1;
    public static final int MIN_ITERATIONS = 100_000;

    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final int KEY_BITS = 256;
    private static final int SALT_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BYTES = 16;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final char[] masterSecret;
    private final int iterations;
    private final SecureRandom secureRandom;

    public CredentialVault(String masterSecret, int iterations, SecureRandom secureRandom) {
        if (masterSecret == null || masterSecret.isEmpty()) {
            throw new IllegalArgumentException("Master secret must not be empty");
        }
        if (iterations < MIN_ITERATIONS) {
            throw new IllegalArgumentException("PBKDF2 iterations must be at least " + MIN_ITERATIONS);
        }
        this.masterSecret = masterSecret.toCharArray();
        this.iterations = iterations;
        this.secureRandom = secureRandom;
    }

    /**
     * Encrypts a secret and returns the serialized envelope.
     */
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new CredentialVaultException("Nothing to encrypt");
        }
        return serialize(encryptToEnvelope(plaintext));
    }

    public EncryptedSecret encryptToEnvelope(String plaintext) {
        byte[] salt = new byte[SALT_BYTES];
        byte[] iv = new byte[IV_BYTES];
        secureRandom.nextBytes(salt);
        secureRandom.nextBytes(iv);

        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_BYTES * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext
            int split = sealed.length - TAG_BYTES;
            return EncryptedSecret.builder()
                    .version(ENVELOPE_VERSION)
                    .salt(Hex.toHexString(salt))
                    .iv(Hex.toHexString(iv))
                    .ciphertext(Hex.toHexString(Arrays.copyOfRange(sealed, 0, split)))
                    .authTag(Hex.toHexString(Arrays.copyOfRange(sealed, split, sealed.length)))
                    .build();
        } catch (GeneralSecurityException e) {
            throw new CredentialVaultException("Encryption failed: " + e.getMessage(), e);
        }
    }

    public String decrypt(String envelopeJson) {
        if (!isEncryptedEnvelope(envelopeJson)) {
            throw new CredentialVaultException("Value is not an encrypted envelope");
        }
        try {
            return decrypt(MAPPER.readValue(envelopeJson, EncryptedSecret.class));
        } catch (JsonProcessingException e) {
            throw new CredentialVaultException("Malformed envelope", e);
        }
    }

    /**
     * Verifies the authentication tag before any plaintext is returned.
     *
     * @throws CredentialVaultException on tampering, a wrong master secret or a malformed envelope
     */
    public String decrypt(EncryptedSecret envelope) {
        if (envelope.getVersion() != ENVELOPE_VERSION) {
            throw new CredentialVaultException("Unsupported envelope version: " + envelope.getVersion());
        }

        if (envelope.getSalt() == null || envelope.getIv() == null
                || envelope.getCiphertext() == null || envelope.getAuthTag() == null) {
            throw new CredentialVaultException("Malformed envelope: missing field");
        }

        byte[] salt;
        byte[] iv;
        byte[] ciphertext;
        byte[] tag;
        try {
            salt = Hex.decode(envelope.getSalt());
            iv = Hex.decode(envelope.getIv());
            ciphertext = Hex.decode(envelope.getCiphertext());
            tag = Hex.decode(envelope.getAuthTag());
        } catch (DecoderException e) {
            throw new CredentialVaultException("Malformed envelope encoding", e);
        }
        if (salt.length != SALT_BYTES || iv.length != IV_BYTES || tag.length != TAG_BYTES) {
            throw new CredentialVaultException("Malformed envelope field lengths");
        }

        byte[] sealed = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

        try {
            Cipher cipher = Cipher.getInstance(CIPHER);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_BYTES * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new CredentialVaultException("Decryption failed: authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new CredentialVaultException("Decryption failed: " + e.getMessage(), e);
        }
    }

    /**
     * Structural check only: a JSON object carrying every envelope field.
     */
    public boolean isEncryptedEnvelope(String raw) {
        if (raw == null || !raw.trim().startsWith("{")) {
            return false;
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            return node.isObject()
                    && node.hasNonNull("version")
                    && node.hasNonNull("salt")
                    && node.hasNonNull("iv")
                    && node.hasNonNull("ciphertext")
                    && node.hasNonNull("authTag");
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    /**
     * Returns the plaintext of a stored value and whether it still has to be re-encrypted.
     */
    public KeyMigrationResult migrateIfNeeded(String raw) {
        if (isEncryptedEnvelope(raw)) {
            return new KeyMigrationResult(decrypt(raw), false);
        }
        if (raw == null || raw.isEmpty()) {
            throw new CredentialVaultException("Stored secret is empty");
        }
        return new KeyMigrationResult(raw, true);
    }

    private SecretKeySpec deriveKey(byte[] salt) throws GeneralSecurityException {
        KeySpec spec = new PBEKeySpec(masterSecret, salt, iterations, KEY_BITS);
        SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF);
        byte[] key = factory.generateSecret(spec).getEncoded();
        return new SecretKeySpec(key, "AES");
    }

    private String serialize(EncryptedSecret envelope) {
        try {
            return MAPPER.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new CredentialVaultException("Failed to serialize envelope", e);
        }
    }
}
