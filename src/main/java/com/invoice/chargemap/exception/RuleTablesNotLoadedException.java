package com.invoice.chargemap.exception;

/**
 * No rule snapshot has been published yet, so nothing can be classified.
 */
public class RuleTablesNotLoadedException extends IllegalStateException {

    public RuleTablesNotLoadedException() {
        super("Rule tables have not been loaded yet");
    }
}
