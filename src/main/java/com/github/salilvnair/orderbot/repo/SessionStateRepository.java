package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObSessionState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SessionStateRepository extends JpaRepository<ObSessionState, Long> {
}
