package com.wpanther.greengoods.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Versioned envelope stored in place of a raw key. All binary fields are lowercase hex.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EncryptedSecret {

    private int version;

    private String salt;

    private String iv;

    private String ciphertext;

    private String authTag;
}
