package com.wpanther.greengoods.exception;

public class InvalidKeyMaterialException extends RuntimeException {

    public InvalidKeyMaterialException(String message) {
        super(message);
    }

    public InvalidKeyMaterialException(String message, Throwable cause) {
        super(message, cause);
    }
}
