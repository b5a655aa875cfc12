package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObConversationHistory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationHistoryRepository extends JpaRepository<ObConversationHistory, Long> {

    Page<ObConversationHistory>
    findByUserIdOrderByHistoryIdDesc(
            Long userId,
            Pageable pageable
    );
}
