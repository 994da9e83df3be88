package com.invoice.chargemap.repository;

import com.invoice.chargemap.entity.ExtractionAlias;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExtractionAliasRepository extends JpaRepository<ExtractionAlias, Long> {

    /**
     * Aliases of one kind in evaluation order.
     */
    List<ExtractionAlias> findByKindOrderBySortOrderAscIdAsc(ExtractionAlias.AliasKind kind);
}
