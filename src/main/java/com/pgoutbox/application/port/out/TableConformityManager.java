package com.pgoutbox.application.port.out;

import com.pgoutbox.domain.model.TableDescriptor;

/**
 * Makes sure the outbox table exists and has the columns the subscription reads.
 */
public interface TableConformityManager {

    /**
     * Creates the table if absent, otherwise verifies it without changing it.
     *
     * @throws com.pgoutbox.infrastructure.exception.SchemaConflictException if an existing table is incompatible
     */
    EnsureOutcome ensureTable(TableDescriptor table);

    enum EnsureOutcome {
        CREATED,
        VERIFIED
    }
}
