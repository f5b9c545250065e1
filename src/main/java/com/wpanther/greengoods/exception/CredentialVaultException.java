package com.wpanther.greengoods.exception;

/**
 * Encryption or decryption of a custodial secret failed. Never carries plaintext.
 */
public class CredentialVaultException extends RuntimeException {

    public CredentialVaultException(String message) {
        super(message);
    }

    public CredentialVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
