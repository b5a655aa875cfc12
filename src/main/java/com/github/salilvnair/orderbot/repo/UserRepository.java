package com.github.salilvnair.orderbot.repo;

import com.github.salilvnair.orderbot.entity.ObUser;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<ObUser, Long> {
}
