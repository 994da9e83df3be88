package com.invoice.chargemap.repository;

import com.invoice.chargemap.entity.ChargePattern;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChargePatternRepository extends JpaRepository<ChargePattern, Long> {

    // Priority first, then declaration order
    List<ChargePattern> findAllByOrderByPriorityAscIdAsc();
}
