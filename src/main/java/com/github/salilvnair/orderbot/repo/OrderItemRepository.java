package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObOrderItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface OrderItemRepository extends JpaRepository<ObOrderItem, Long> {

    List<ObOrderItem> findByOrderIdOrderByOrderItemIdAsc(Long orderId);

    @Query("select i.itemName from ObOrderItem i group by i.itemName order by sum(i.quantity) desc")
    List<String> findPopularItemNames(Pageable pageable);
}
