package com.github.salilvnair.orderbot.entity;

import com.github.salilvnair.orderbot.entity.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.Map;

@Entity
@Table(name = "ob_conversation_history")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObConversationHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "history_id")
    private Long historyId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "role", nullable = false, length = 16)
    private String role;

    @Column(name = "content_text", length = 4000)
    private String contentText;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata_json", length = 2000)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;
}
