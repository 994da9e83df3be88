package com.invoice.chargemap.repository;

import com.invoice.chargemap.entity.AccountService;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AccountServiceRepository extends JpaRepository<AccountService, Long> {

    List<AccountService> findAllByOrderByAccountIdentifierAscIdAsc();
}
