package com.github.salilvnair.orderbot.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

@Entity
@Table(name = "ob_user")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObUser {

    /** Supplied by the caller, not generated. */
    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "name")
    private String name;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
