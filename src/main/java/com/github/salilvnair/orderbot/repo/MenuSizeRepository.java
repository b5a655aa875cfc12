package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObMenuSize;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface MenuSizeRepository extends JpaRepository<ObMenuSize, Long> {

    List<ObMenuSize> findByItemIdOrderBySizeIdAsc(Long itemId);

    List<ObMenuSize> findByItemIdInOrderBySizeIdAsc(Collection<Long> itemIds);
}
