package com.ledgerly.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.ledgerly.backend.entities.Account;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    List<Account> findByUserIdAndActiveTrueOrderByCreatedAtAsc(UUID userId);
}
