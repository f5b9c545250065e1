package com.wpanther.greengoods.entity;

import com.wpanther.greengoods.dto.WorkDraftData;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Work submission awaiting operator approval or rejection.
 * Both dispositions delete the row, so a missing id means "never existed or already processed".
 */
@Entity
@Table(name = "pending_works", indexes = {
    @Index(name = "idx_pending_works_garden", columnList = "garden_address")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingWork {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "action_id", nullable = false)
    private long actionId;

    @Column(name = "gardener_address", nullable = false, length = 42)
    private String gardenerAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "gardener_platform", nullable = false, length = 16)
    private Platform gardenerPlatform;

    @Column(name = "gardener_platform_id", nullable = false, length = 128)
    private String gardenerPlatformId;

    @Column(name = "garden_address", nullable = false, length = 42)
    private String gardenAddress;

    @Convert(converter = WorkDraftDataConverter.class)
    @Column(name = "work_data", nullable = false, length = 8192)
    private WorkDraftData data;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
