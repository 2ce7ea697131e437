package com.medkg.ingestion.core.spi;

/**
 * Dependencies handed to an adapter at construction time.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param ledger the ledger the adapter records its document transitions in
 */
public record AdapterContext(Ledger ledger) {

    public AdapterContext {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
    }
}
