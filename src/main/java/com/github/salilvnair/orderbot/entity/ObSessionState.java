package com.github.salilvnair.orderbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * Serialized {@code SessionState} of one user: pending action, pending suggestion and dialogue state.
 */
@Entity
@Table(name = "ob_session_state")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObSessionState {

    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "state_json", length = 4000)
    private String stateJson;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = OffsetDateTime.now();
    }
}
