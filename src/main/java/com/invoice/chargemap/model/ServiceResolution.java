package com.invoice.chargemap.model;

import lombok.Value;

import java.util.List;

/**
 * Outcome of mapping a line to one of its account's services.
 * AMBIGUOUS carries every candidate so the line can be reviewed by hand.
 */
@Value
public class ServiceResolution {

    private static final ServiceResolution NOT_FOUND = new ServiceResolution(Status.NOT_FOUND, null, List.of());

    Status status;
    String serviceId;
    List<String> candidateServiceIds;

    public static ServiceResolution resolved(String serviceId) {
        return new ServiceResolution(Status.RESOLVED, serviceId, List.of(serviceId));
    }

    public static ServiceResolution ambiguous(List<String> candidates) {
        return new ServiceResolution(Status.AMBIGUOUS, null, List.copyOf(candidates));
    }

    public static ServiceResolution notFound() {
        return NOT_FOUND;
    }

    public enum Status { RESOLVED, AMBIGUOUS, NOT_FOUND }
}
