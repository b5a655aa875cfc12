package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObCartItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;

import java.util.List;
import java.util.Optional;

public interface CartItemRepository extends JpaRepository<ObCartItem, Long> {

    List<ObCartItem> findByUserIdOrderByCartItemIdAsc(Long userId);

    Optional<ObCartItem> findByUserIdAndSizeId(Long userId, Long sizeId);

    @Modifying
    void deleteByUserId(Long userId);
}
