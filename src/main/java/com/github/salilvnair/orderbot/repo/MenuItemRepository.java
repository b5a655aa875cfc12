package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObMenuItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface MenuItemRepository extends JpaRepository<ObMenuItem, Long> {

    Optional<ObMenuItem> findFirstByNameIgnoreCase(String name);

    List<ObMenuItem> findByNameContainingIgnoreCaseOrderByItemIdAsc(String fragment);

    List<ObMenuItem> findAllByOrderByItemIdAsc();
}
