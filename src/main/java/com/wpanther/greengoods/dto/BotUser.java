package com.wpanther.greengoods.dto;

import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.entity.UserRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * User as seen by handlers: the custodial key is already decrypted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BotUser {

    private Platform platform;

    private String platformId;

    @ToString.Exclude
    private String privateKey;

    private String address;

    private String currentGarden;

    private UserRole role;

    private Instant createdAt;

    public boolean hasGarden() {
        return currentGarden != null && !currentGarden.isEmpty();
    }

    public boolean isOperator() {
        return role == UserRole.OPERATOR;
    }
}
