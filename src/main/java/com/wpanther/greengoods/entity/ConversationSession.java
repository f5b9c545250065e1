package com.wpanther.greengoods.entity;

import com.wpanther.greengoods.dto.SessionDraft;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * Conversation state for one user. No row means idle with no draft.
 */
@Entity
@Table(name = "sessions")
@IdClass(UserKey.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationSession {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 16)
    private Platform platform;

    @Id
    @Column(name = "platform_id", nullable = false, length = 128)
    private String platformId;

    @Enumerated(EnumType.STRING)
    @Column(name = "step", nullable = false, length = 32)
    private SessionStep step;

    @Convert(converter = SessionDraftConverter.class)
    @Column(name = "draft", length = 8192)
    private SessionDraft draft;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Concurrent read-modify-write of the same row fails instead of overwriting
    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Returns the draft only when the current step declares that draft type.
     */
    public <T extends SessionDraft> Optional<T> draftAs(Class<T> type) {
        if (step == null || draft == null || step.getDraftType() != type || !type.isInstance(draft)) {
            return Optional.empty();
        }
        return Optional.of(type.cast(draft));
    }
}
