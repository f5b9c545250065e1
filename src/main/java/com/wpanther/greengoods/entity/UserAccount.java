package com.wpanther.greengoods.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Persisted user record. The private key column holds a vault envelope, or a legacy plaintext key
 * until the first read migrates it.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_role_garden", columnList = "role, current_garden")
})
@IdClass(UserKey.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 16)
    private Platform platform;

    @Id
    @Column(name = "platform_id", nullable = false, length = 128)
    private String platformId;

    @ToString.Exclude
    @Column(name = "encrypted_private_key", nullable = false, length = 1024)
    private String encryptedPrivateKey;

    // Derived from the key at creation, never updated
    @Column(name = "address", nullable = false, length = 42, updatable = false)
    private String address;

    @Column(name = "current_garden", length = 42)
    private String currentGarden;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private UserRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
