package com.wpanther.greengoods.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.ToString;

@Data
@AllArgsConstructor
public class KeyMigrationResult {

    @ToString.Exclude
    private String plaintext;

    // True when the stored value was a legacy plaintext key
    private boolean needsMigration;
}
