package com.invoice.chargemap.service;

import com.invoice.chargemap.model.AccountServiceMap;
import com.invoice.chargemap.model.ClassifiedLineItem;
import com.invoice.chargemap.model.ServiceResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Picks the account service a line bills for, keyed on (account, equipment, material).
 *
 *   1. exact (account, equipment, material)       → that service
 *   2. exactly one (account, equipment, *)        → that service
 *   3. several (account, equipment, *)            → AMBIGUOUS, never a tie-break
 *   4. none                                        → NOT_FOUND
 */
@Service
@Slf4j
public class ServiceDisambiguator {

    public ServiceResolution resolve(String accountId, String equipment, String material,
                                     AccountServiceMap serviceMap) {
        if (isMissing(equipment)) {
            return ServiceResolution.notFound();
        }

        List<AccountServiceMap.Entry> sameEquipment = serviceMap.entriesFor(accountId).stream()
                .filter(e -> e.hasEquipment(equipment))
                .toList();

        if (sameEquipment.isEmpty()) {
            return ServiceResolution.notFound();
        }

        if (!isMissing(material)) {
            for (AccountServiceMap.Entry entry : sameEquipment) {
                if (entry.hasMaterial(material)) {
                    return ServiceResolution.resolved(entry.getServiceId());
                }
            }
        }

        if (sameEquipment.size() == 1) {
            return ServiceResolution.resolved(sameEquipment.get(0).getServiceId());
        }

        log.debug("Account {} has {} services for {} / {}", accountId, sameEquipment.size(), equipment, material);
        return ServiceResolution.ambiguous(sameEquipment.stream()
                .map(AccountServiceMap.Entry::getServiceId)
                .toList());
    }

    private static boolean isMissing(String label) {
        return label == null || label.isBlank() || ClassifiedLineItem.UNCLASSIFIED.equals(label);
    }
}
