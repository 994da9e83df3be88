package com.invoice.chargemap.service;

import com.invoice.chargemap.entity.ExtractionAlias.AliasKind;
import com.invoice.chargemap.exception.RuleTablesNotLoadedException;
import com.invoice.chargemap.model.RuleSnapshot;
import com.invoice.chargemap.repository.AccountServiceRepository;
import com.invoice.chargemap.repository.ChargePatternRepository;
import com.invoice.chargemap.repository.ExtractionAliasRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the published rule snapshot.
 *
 * The tables are read once at startup; a bad table aborts startup. A reload
 * compiles a complete new snapshot and swaps it in with one reference write,
 * so a batch that already took the old snapshot never sees a mix of both.
 */
@Service
@Slf4j
public class RuleTableService {

    private final ExtractionAliasRepository aliasRepo;
    private final ChargePatternRepository chargePatternRepo;
    private final AccountServiceRepository accountServiceRepo;
    private final RuleTableCompiler compiler;

    private final AtomicReference<RuleSnapshot> current = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();

    public RuleTableService(ExtractionAliasRepository aliasRepo,
                            ChargePatternRepository chargePatternRepo,
                            AccountServiceRepository accountServiceRepo,
                            RuleTableCompiler compiler) {
        this.aliasRepo = aliasRepo;
        this.chargePatternRepo = chargePatternRepo;
        this.accountServiceRepo = accountServiceRepo;
        this.compiler = compiler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        reload();
    }

    /**
     * Reads and compiles all tables, then publishes the result.
     * On failure the previous snapshot stays published and the exception propagates.
     */
    public synchronized RuleSnapshot reload() {
        RuleSnapshot snapshot = compiler.compile(
                versions.get() + 1,
                aliasRepo.findByKindOrderBySortOrderAscIdAsc(AliasKind.EQUIPMENT),
                aliasRepo.findByKindOrderBySortOrderAscIdAsc(AliasKind.MATERIAL),
                chargePatternRepo.findAllByOrderByPriorityAscIdAsc(),
                accountServiceRepo.findAllByOrderByAccountIdentifierAscIdAsc());

        versions.incrementAndGet();
        current.set(snapshot);
        log.info("Published rule snapshot v{}: {} equipment aliases, {} material aliases, {} charge rules, {} account services",
                snapshot.getVersion(),
                snapshot.getEquipmentAliases().size(),
                snapshot.getMaterialAliases().size(),
                snapshot.getChargeRules().size(),
                snapshot.getServiceMap().size());
        return snapshot;
    }

    public RuleSnapshot current() {
        RuleSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new RuleTablesNotLoadedException();
        }
        return snapshot;
    }
}
