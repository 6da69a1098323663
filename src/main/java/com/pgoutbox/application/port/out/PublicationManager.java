package com.pgoutbox.application.port.out;

import com.pgoutbox.domain.model.PublicationSpec;

public interface PublicationManager {

    /**
     * Creates the publication or verifies that the existing one covers exactly the outbox table.
     * Updates the row filter when discriminator filtering is on and the registered set changed.
     */
    void ensurePublication(PublicationSpec publication);

    void dropPublication(String name);
}
