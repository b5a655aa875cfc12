package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObOrder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface OrderRepository extends JpaRepository<ObOrder, Long> {

    List<ObOrder> findByUserIdOrderByCreatedAtDesc(Long userId);

    long countByUserId(Long userId);
}
